package ru.derendyaev.SmsInbox.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import ru.derendyaev.SmsInbox.model.MessageCandidate;
import ru.derendyaev.SmsInbox.repository.MessageRepository;
import ru.derendyaev.SmsInbox.service.MessageStore;

import java.time.Instant;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("GET /messages, /stats, /health")
class MessageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MessageStore store;

    @Autowired
    private MessageRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void insert(String id, String from, String ts, String text) {
        store.insert(MessageCandidate.builder()
                .messageId(id)
                .fromAddress(from)
                .toAddress("+14155550100")
                .timestamp(Instant.parse(ts))
                .text(text)
                .build());
    }

    @Test
    @DisplayName("Should list messages in order with defaults")
    void testMessages_Defaults() throws Exception {
        insert("m2", "+911111111111", "2025-01-15T11:00:00Z", "Second");
        insert("m1", "+911111111111", "2025-01-15T10:00:00Z", null);

        mockMvc.perform(get("/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.limit").value(50))
                .andExpect(jsonPath("$.offset").value(0))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].message_id").value("m1"))
                .andExpect(jsonPath("$.data[0].from").value("+911111111111"))
                .andExpect(jsonPath("$.data[0].to").value("+14155550100"))
                .andExpect(jsonPath("$.data[0].ts").value("2025-01-15T10:00:00Z"))
                .andExpect(jsonPath("$.data[0].text").value(nullValue()))
                .andExpect(jsonPath("$.data[1].message_id").value("m2"));
    }

    @Test
    @DisplayName("Should apply from, since and q filters")
    void testMessages_Filters() throws Exception {
        insert("m1", "+911111111111", "2025-01-15T09:00:00Z", "hi early");
        insert("m2", "+911111111111", "2025-01-15T10:00:00Z", "Hi later");
        insert("m3", "+922222222222", "2025-01-15T11:00:00Z", "hi other");

        mockMvc.perform(get("/messages")
                        .param("from", "+911111111111")
                        .param("since", "2025-01-15T10:00:00Z")
                        .param("q", "HI"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.data[0].message_id").value("m2"));
    }

    @Test
    @DisplayName("Should reject out of range or malformed parameters with 422")
    void testMessages_BadParams() throws Exception {
        mockMvc.perform(get("/messages").param("limit", "0"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc").value("query.limit"));
        mockMvc.perform(get("/messages").param("limit", "101"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/messages").param("offset", "-1"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/messages").param("limit", "abc"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc").value("query.limit"));
        mockMvc.perform(get("/messages").param("since", "2025-01-15"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc").value("query.since"));
    }

    @Test
    @DisplayName("Should render stats with null timestamps on an empty store")
    void testStats_Empty() throws Exception {
        mockMvc.perform(get("/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_messages").value(0))
                .andExpect(jsonPath("$.senders_count").value(0))
                .andExpect(jsonPath("$.messages_per_sender", hasSize(0)))
                .andExpect(jsonPath("$.first_message_ts").value(nullValue()))
                .andExpect(jsonPath("$.last_message_ts").value(nullValue()));
    }

    @Test
    @DisplayName("Should render stats per sender")
    void testStats_WithMessages() throws Exception {
        insert("s1", "+917777777777", "2025-01-15T10:00:00Z", "A");
        insert("s2", "+917777777777", "2025-01-15T10:01:00Z", "B");
        insert("s3", "+918888888888", "2025-01-15T10:02:00Z", "C");

        mockMvc.perform(get("/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_messages").value(3))
                .andExpect(jsonPath("$.senders_count").value(2))
                .andExpect(jsonPath("$.messages_per_sender[0].from").value("+917777777777"))
                .andExpect(jsonPath("$.messages_per_sender[0].count").value(2))
                .andExpect(jsonPath("$.messages_per_sender[1].from").value("+918888888888"))
                .andExpect(jsonPath("$.first_message_ts").value("2025-01-15T10:00:00Z"))
                .andExpect(jsonPath("$.last_message_ts").value("2025-01-15T10:02:00Z"));
    }

    @Test
    @DisplayName("Should report live and ready")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"))
                .andExpect(jsonPath("$.reason").doesNotExist());
    }
}
