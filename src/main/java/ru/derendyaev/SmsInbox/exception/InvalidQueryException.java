package ru.derendyaev.SmsInbox.exception;

import lombok.Getter;
import ru.derendyaev.SmsInbox.model.ValidationError;

import java.util.List;

@Getter
public class InvalidQueryException extends RuntimeException {

    private final List<ValidationError> errors;

    public InvalidQueryException(List<ValidationError> errors) {
        super("Invalid query parameters: " + errors);
        this.errors = List.copyOf(errors);
    }
}
