package ru.derendyaev.SmsInbox.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.derendyaev.SmsInbox.model.MessageStats;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Getter
@AllArgsConstructor
public class StatsResponse {

    @JsonProperty("total_messages")
    private long totalMessages;

    @JsonProperty("senders_count")
    private long sendersCount;

    @JsonProperty("messages_per_sender")
    private List<SenderCountDto> messagesPerSender;

    @JsonProperty("first_message_ts")
    private Instant firstMessageTs;

    @JsonProperty("last_message_ts")
    private Instant lastMessageTs;

    public static StatsResponse from(MessageStats stats) {
        return new StatsResponse(
                stats.getTotal(),
                stats.getDistinctSenders(),
                stats.getTopSenders().stream()
                        .map(s -> new SenderCountDto(s.getSender(), s.getCount()))
                        .collect(Collectors.toList()),
                stats.getEarliest().orElse(null),
                stats.getLatest().orElse(null));
    }

    @Getter
    @AllArgsConstructor
    public static class SenderCountDto {
        @JsonProperty("from")
        private String from;

        @JsonProperty("count")
        private long count;
    }
}
