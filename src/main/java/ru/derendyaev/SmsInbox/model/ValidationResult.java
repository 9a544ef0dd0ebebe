package ru.derendyaev.SmsInbox.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private final MessageCandidate candidate;
    private final List<ValidationError> errors;

    public static ValidationResult valid(MessageCandidate candidate) {
        return new ValidationResult(candidate, List.of());
    }

    public static ValidationResult invalid(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("invalid result needs at least one error");
        }
        return new ValidationResult(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
