package ru.derendyaev.SmsInbox.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Условия отбора сообщений, объединяются через AND. null означает "без фильтра".
 */
@Value
@Builder
public class MessageFilter {

    public static final MessageFilter NONE = MessageFilter.builder().build();

    /** Точное совпадение отправителя. */
    String from;

    /** timestamp >= since. */
    Instant since;

    /** Подстрока в тексте без учёта регистра. */
    String text;
}
