package ru.derendyaev.SmsInbox.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Тело вебхука после JSON-декодирования. Неизвестные поля игнорируются.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookPayload {

    public static final String E164_REGEX = "\\+[0-9]+";
    public static final String E164_MESSAGE = "must be E.164 format: + followed by digits";

    @JsonProperty("message_id")
    @NotEmpty(message = "field required and must not be empty")
    private String messageId;

    @JsonProperty("from")
    @NotNull(message = "field required")
    @Pattern(regexp = E164_REGEX, message = E164_MESSAGE)
    private String from;

    @JsonProperty("to")
    @NotNull(message = "field required")
    @Pattern(regexp = E164_REGEX, message = E164_MESSAGE)
    private String to;

    @JsonProperty("ts")
    @NotNull(message = "field required")
    private String ts;

    @JsonProperty("text")
    private String text;

    @Override
    public String toString() {
        return "WebhookPayload{" +
                "messageId='" + messageId + '\'' +
                ", from='" + from + '\'' +
                ", to='" + to + '\'' +
                ", ts='" + ts + '\'' +
                ", textLength=" + (text == null ? 0 : text.length()) +
                '}';
    }
}
