package ru.derendyaev.SmsInbox.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.derendyaev.SmsInbox.model.MessageEntity;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class MessageDto {

    @JsonProperty("message_id")
    private String messageId;

    @JsonProperty("from")
    private String from;

    @JsonProperty("to")
    private String to;

    @JsonProperty("ts")
    private Instant ts;

    @JsonProperty("text")
    private String text;

    public static MessageDto from(MessageEntity entity) {
        return new MessageDto(
                entity.getMessageId(),
                entity.getFromAddress(),
                entity.getToAddress(),
                entity.getTimestamp(),
                entity.getText());
    }
}
