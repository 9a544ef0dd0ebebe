package ru.derendyaev.SmsInbox.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class WebhookResponse {

    public static final WebhookResponse OK = new WebhookResponse("ok");

    private String status;
}
