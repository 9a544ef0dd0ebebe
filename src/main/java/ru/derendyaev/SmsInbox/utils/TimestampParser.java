package ru.derendyaev.SmsInbox.utils;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Разбор ISO-8601 времени в UTC. Допускается только явный суффикс Z, секунды обязательны.
 * Дробная часть до микросекунд (точность столбца ts). Час 24 и секунда 60 не принимаются.
 */
public final class TimestampParser {

    public static final String FORMAT_MESSAGE =
            "timestamp must be ISO-8601 UTC with Z suffix: YYYY-MM-DDTHH:MM:SS[.ffffff]Z";

    private static final Pattern UTC_TIMESTAMP =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T([01]\\d|2[0-3]):[0-5]\\d:[0-5]\\d(\\.\\d{1,6})?Z$");

    private TimestampParser() {
    }

    public static Optional<Instant> parseUtc(String value) {
        if (value == null || !UTC_TIMESTAMP.matcher(value).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeException e) {
            // формат верный, но дата несуществующая (2025-02-30T00:00:00Z)
            return Optional.empty();
        }
    }
}
