package ru.derendyaev.SmsInbox.model;

import lombok.Value;

/**
 * Ошибка валидации одного поля. location вида "body.from" или "query.limit".
 */
@Value
public class ValidationError {
    String location;
    String message;
}
