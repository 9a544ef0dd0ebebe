package ru.derendyaev.SmsInbox.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.derendyaev.SmsInbox.model.MessageCandidate;
import ru.derendyaev.SmsInbox.model.ValidationError;
import ru.derendyaev.SmsInbox.model.ValidationResult;
import ru.derendyaev.SmsInbox.model.WebhookPayload;
import ru.derendyaev.SmsInbox.utils.TimestampParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Валидация декодированного тела вебхука. Собирает все ошибки, а не только первую.
 */
@Component
@RequiredArgsConstructor
public class MessageValidator {

    public static final int MAX_TEXT_CODE_POINTS = 4096;

    private static final String LOCATION_PREFIX = "body.";

    // имя поля в Java -> имя поля в JSON
    private static final Map<String, String> JSON_NAMES = Map.of(
            "messageId", "message_id",
            "from", "from",
            "to", "to",
            "ts", "ts",
            "text", "text");

    private static final List<String> FIELD_ORDER = List.of("message_id", "from", "to", "ts", "text");

    private final Validator validator;

    public ValidationResult validate(WebhookPayload payload) {
        List<ValidationError> errors = new ArrayList<>();

        for (ConstraintViolation<WebhookPayload> violation : validator.validate(payload)) {
            String property = violation.getPropertyPath().toString();
            String field = JSON_NAMES.getOrDefault(property, property);
            errors.add(new ValidationError(LOCATION_PREFIX + field, violation.getMessage()));
        }

        Instant timestamp = null;
        if (payload.getTs() != null) {
            timestamp = TimestampParser.parseUtc(payload.getTs()).orElse(null);
            if (timestamp == null) {
                errors.add(new ValidationError(LOCATION_PREFIX + "ts", TimestampParser.FORMAT_MESSAGE));
            }
        }

        String text = payload.getText();
        if (text != null && text.codePointCount(0, text.length()) > MAX_TEXT_CODE_POINTS) {
            errors.add(new ValidationError(LOCATION_PREFIX + "text",
                    "text must be at most " + MAX_TEXT_CODE_POINTS + " characters"));
        }

        if (!errors.isEmpty()) {
            errors.sort(Comparator
                    .comparingInt(MessageValidator::fieldRank)
                    .thenComparing(ValidationError::getMessage));
            return ValidationResult.invalid(errors);
        }

        return ValidationResult.valid(MessageCandidate.builder()
                .messageId(payload.getMessageId())
                .fromAddress(payload.getFrom())
                .toAddress(payload.getTo())
                .timestamp(timestamp)
                .text(text)
                .build());
    }

    private static int fieldRank(ValidationError error) {
        int index = FIELD_ORDER.indexOf(error.getLocation().substring(LOCATION_PREFIX.length()));
        return index >= 0 ? index : FIELD_ORDER.size();
    }
}
