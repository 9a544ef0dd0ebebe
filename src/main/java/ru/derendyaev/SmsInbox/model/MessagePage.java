package ru.derendyaev.SmsInbox.model;

import lombok.Value;

import java.util.List;

@Value
public class MessagePage {
    List<MessageEntity> items;
    long total;
}
