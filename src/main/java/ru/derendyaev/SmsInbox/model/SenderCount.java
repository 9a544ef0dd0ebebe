package ru.derendyaev.SmsInbox.model;

import lombok.Value;

@Value
public class SenderCount {
    String sender;
    Long count;
}
