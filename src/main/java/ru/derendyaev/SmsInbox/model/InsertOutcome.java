package ru.derendyaev.SmsInbox.model;

public enum InsertOutcome {
    CREATED,
    ALREADY_EXISTS
}
