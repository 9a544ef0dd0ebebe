package ru.derendyaev.SmsInbox.config;

/**
 * Секрет вебхука, прочитанный один раз при старте приложения.
 */
public final class WebhookSecret {

    private final String value;

    public WebhookSecret(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isConfigured() {
        return value != null && !value.isEmpty();
    }

    @Override
    public String toString() {
        return "WebhookSecret{configured=" + isConfigured() + "}";
    }
}
