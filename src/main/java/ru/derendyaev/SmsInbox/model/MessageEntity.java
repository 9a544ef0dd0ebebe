package ru.derendyaev.SmsInbox.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "messages", indexes = {
        @Index(name = "idx_messages_ts", columnList = "ts, message_id"),
        @Index(name = "idx_messages_from", columnList = "from_address")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MessageEntity {

    // длина id и номеров не ограничена, varchar без длины (в H2 и PostgreSQL)
    @Id
    @Column(name = "message_id", nullable = false, updatable = false, columnDefinition = "varchar")
    private String messageId;

    @Column(name = "from_address", nullable = false, updatable = false, columnDefinition = "varchar")
    private String fromAddress;

    @Column(name = "to_address", nullable = false, updatable = false, columnDefinition = "varchar")
    private String toAddress;

    @Column(name = "ts", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "message_text", updatable = false, length = 8192)
    private String text;

    @Column(name = "ingested_at", nullable = false, updatable = false)
    private Instant ingestedAt;
}
