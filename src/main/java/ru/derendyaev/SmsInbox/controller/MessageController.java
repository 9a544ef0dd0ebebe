package ru.derendyaev.SmsInbox.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.derendyaev.SmsInbox.controller.dto.MessageDto;
import ru.derendyaev.SmsInbox.controller.dto.MessagesResponse;
import ru.derendyaev.SmsInbox.controller.dto.StatsResponse;
import ru.derendyaev.SmsInbox.model.MessagePage;
import ru.derendyaev.SmsInbox.model.MessageQuery;
import ru.derendyaev.SmsInbox.service.MessageStore;

import java.util.stream.Collectors;

@Slf4j
@RestController
@RequiredArgsConstructor
public class MessageController {

    private final MessageStore messageStore;

    @GetMapping("/messages")
    public MessagesResponse getMessages(@RequestParam(value = "limit", required = false) Integer limit,
                                        @RequestParam(value = "offset", required = false) Integer offset,
                                        @RequestParam(value = "from", required = false) String from,
                                        @RequestParam(value = "since", required = false) String since,
                                        @RequestParam(value = "q", required = false) String q) {
        MessageQuery query = MessageQuery.fromParams(limit, offset, from, since, q);
        MessagePage page = messageStore.list(query);
        log.debug("Список сообщений: filter={}, limit={}, offset={}, total={}",
                query.getFilter(), query.getLimit(), query.getOffset(), page.getTotal());

        return new MessagesResponse(
                page.getItems().stream().map(MessageDto::from).collect(Collectors.toList()),
                page.getTotal(),
                query.getLimit(),
                query.getOffset());
    }

    @GetMapping("/stats")
    public StatsResponse getStats() {
        return StatsResponse.from(messageStore.stats());
    }
}
