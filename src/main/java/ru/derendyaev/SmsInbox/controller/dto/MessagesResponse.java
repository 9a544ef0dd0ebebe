package ru.derendyaev.SmsInbox.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class MessagesResponse {
    private List<MessageDto> data;
    private long total;
    private int limit;
    private int offset;
}
