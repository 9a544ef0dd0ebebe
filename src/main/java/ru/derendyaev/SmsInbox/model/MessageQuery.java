package ru.derendyaev.SmsInbox.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import ru.derendyaev.SmsInbox.exception.InvalidQueryException;
import ru.derendyaev.SmsInbox.utils.TimestampParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Запрос списка сообщений. Ограничения на limit/offset проверяются при создании,
 * до обращения к хранилищу.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MessageQuery {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    int limit;
    int offset;
    MessageFilter filter;

    public static MessageQuery of(int limit, int offset, MessageFilter filter) {
        List<ValidationError> errors = new ArrayList<>();
        checkWindow(limit, offset, errors);
        if (!errors.isEmpty()) {
            throw new InvalidQueryException(errors);
        }
        return new MessageQuery(limit, offset, filter == null ? MessageFilter.NONE : filter);
    }

    /**
     * Сборка из сырых параметров запроса. Пустые from и q трактуются как отсутствие фильтра.
     */
    public static MessageQuery fromParams(Integer limit, Integer offset, String from, String since, String q) {
        int effectiveLimit = limit != null ? limit : DEFAULT_LIMIT;
        int effectiveOffset = offset != null ? offset : 0;

        List<ValidationError> errors = new ArrayList<>();
        checkWindow(effectiveLimit, effectiveOffset, errors);

        Instant sinceInstant = null;
        if (since != null && !since.isEmpty()) {
            sinceInstant = TimestampParser.parseUtc(since).orElse(null);
            if (sinceInstant == null) {
                errors.add(new ValidationError("query.since", TimestampParser.FORMAT_MESSAGE));
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidQueryException(errors);
        }

        MessageFilter filter = MessageFilter.builder()
                .from(from == null || from.isEmpty() ? null : from)
                .since(sinceInstant)
                .text(q == null || q.isEmpty() ? null : q)
                .build();
        return new MessageQuery(effectiveLimit, effectiveOffset, filter);
    }

    private static void checkWindow(int limit, int offset, List<ValidationError> errors) {
        if (limit < 1 || limit > MAX_LIMIT) {
            errors.add(new ValidationError("query.limit", "limit must be between 1 and " + MAX_LIMIT));
        }
        if (offset < 0) {
            errors.add(new ValidationError("query.offset", "offset must be greater than or equal to 0"));
        }
    }
}
