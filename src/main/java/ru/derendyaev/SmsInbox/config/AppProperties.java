package ru.derendyaev.SmsInbox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.values")
public class AppProperties {

    private Webhook webhook = new Webhook();
    private Store store = new Store();

    @Data
    public static class Webhook {
        /**
         * Общий секрет для подписи HMAC-SHA256 входящих вебхуков.
         */
        private String secret;

        /**
         * Разрешить старт без секрета. Тогда все вебхуки отклоняются, а readiness отвечает 503.
         */
        private boolean allowMissingSecret = false;
    }

    @Data
    public static class Store {
        /**
         * Таймаут по умолчанию для чтения (список сообщений, статистика).
         */
        private Duration queryTimeout = Duration.ofSeconds(5);
    }
}
