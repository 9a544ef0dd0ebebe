package ru.derendyaev.SmsInbox.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Агрегаты по хранилищу, посчитанные в одном снимке.
 */
@Value
@Builder
public class MessageStats {

    public static final int TOP_SENDERS_LIMIT = 10;

    long total;
    long distinctSenders;
    List<SenderCount> topSenders;
    Instant earliest;
    Instant latest;

    public Optional<Instant> getEarliest() {
        return Optional.ofNullable(earliest);
    }

    public Optional<Instant> getLatest() {
        return Optional.ofNullable(latest);
    }
}
