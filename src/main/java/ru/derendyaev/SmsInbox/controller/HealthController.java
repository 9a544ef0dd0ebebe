package ru.derendyaev.SmsInbox.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.derendyaev.SmsInbox.config.WebhookSecret;
import ru.derendyaev.SmsInbox.controller.dto.HealthResponse;
import ru.derendyaev.SmsInbox.service.MessageStore;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final MessageStore messageStore;
    private final WebhookSecret webhookSecret;

    @GetMapping("/live")
    public HealthResponse live() {
        return new HealthResponse("ok", null);
    }

    @GetMapping("/ready")
    public ResponseEntity<HealthResponse> ready() {
        if (!webhookSecret.isConfigured()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new HealthResponse("not ready", "WEBHOOK_SECRET not set"));
        }
        if (!messageStore.readiness()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new HealthResponse("not ready", "database not ready"));
        }
        return ResponseEntity.ok(new HealthResponse("ready", null));
    }
}
