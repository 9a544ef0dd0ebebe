package ru.derendyaev.SmsInbox.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import ru.derendyaev.SmsInbox.controller.dto.ErrorResponse;
import ru.derendyaev.SmsInbox.controller.dto.ValidationErrorResponse;
import ru.derendyaev.SmsInbox.controller.dto.WebhookResponse;
import ru.derendyaev.SmsInbox.model.IngestionOutcome;
import ru.derendyaev.SmsInbox.service.IngestionPipeline;

@RestController
@RequiredArgsConstructor
public class WebhookController {

    public static final String SIGNATURE_HEADER = "X-Signature";

    private final IngestionPipeline ingestionPipeline;

    /**
     * Тело читается как сырые байты: подпись считается именно от них, а не от перекодированного JSON.
     */
    @PostMapping("/webhook")
    public ResponseEntity<Object> handleWebhook(@RequestBody(required = false) byte[] body,
                                                @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        IngestionOutcome outcome = ingestionPipeline.handle(body != null ? body : new byte[0], signature);

        switch (outcome.getType()) {
            case CREATED:
            case DUPLICATE:
                return ResponseEntity.ok(WebhookResponse.OK);
            case INVALID_SIGNATURE:
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .body(new ErrorResponse("invalid signature"));
            case VALIDATION_ERROR:
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                        .body(ValidationErrorResponse.of(outcome.getErrors()));
            default:
                throw new IllegalStateException("Unexpected ingestion outcome: " + outcome.getType());
        }
    }
}
