package ru.derendyaev.SmsInbox.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Итог обработки одного вебхука.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IngestionOutcome {

    public enum Type {
        CREATED("created"),
        DUPLICATE("duplicate"),
        INVALID_SIGNATURE("invalid_signature"),
        VALIDATION_ERROR("validation_error");

        private final String metricTag;

        Type(String metricTag) {
            this.metricTag = metricTag;
        }

        /**
         * Значение тега result у счётчика webhook_requests_total.
         */
        public String getMetricTag() {
            return metricTag;
        }
    }

    private static final IngestionOutcome INVALID_SIGNATURE = new IngestionOutcome(Type.INVALID_SIGNATURE, null, List.of());

    private final Type type;
    private final String messageId;
    private final List<ValidationError> errors;

    public static IngestionOutcome created(String messageId) {
        return new IngestionOutcome(Type.CREATED, messageId, List.of());
    }

    public static IngestionOutcome duplicate(String messageId) {
        return new IngestionOutcome(Type.DUPLICATE, messageId, List.of());
    }

    public static IngestionOutcome invalidSignature() {
        return INVALID_SIGNATURE;
    }

    public static IngestionOutcome validationError(List<ValidationError> errors) {
        return new IngestionOutcome(Type.VALIDATION_ERROR, null, List.copyOf(errors));
    }

    @Override
    public String toString() {
        return "IngestionOutcome{" +
                "type=" + type +
                ", messageId='" + messageId + '\'' +
                ", errors=" + errors +
                '}';
    }
}
