package ru.derendyaev.SmsInbox.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Провалидированное входящее сообщение, готовое к сохранению.
 */
@Value
@Builder
public class MessageCandidate {
    String messageId;
    String fromAddress;
    String toAddress;
    Instant timestamp;
    String text;
}
