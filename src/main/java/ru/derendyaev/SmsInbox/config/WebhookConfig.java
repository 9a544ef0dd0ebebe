package ru.derendyaev.SmsInbox.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class WebhookConfig {

    @Bean
    public WebhookSecret webhookSecret(AppProperties properties) {
        AppProperties.Webhook webhook = properties.getWebhook();
        WebhookSecret secret = new WebhookSecret(webhook.getSecret());

        if (!secret.isConfigured()) {
            if (!webhook.isAllowMissingSecret()) {
                log.error("WEBHOOK_SECRET не задан, запуск невозможен");
                throw new IllegalStateException("WEBHOOK_SECRET environment variable is required");
            }
            log.warn("WEBHOOK_SECRET не задан: все вебхуки будут отклонены, readiness = not ready");
        }
        return secret;
    }
}
