package ru.derendyaev.SmsInbox.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MessageSpecifications Tests")
class MessageSpecificationsTest {

    @Test
    @DisplayName("Should escape LIKE wildcards and the escape character")
    void testEscapeLike_Wildcards_Escaped() {
        assertThat(MessageSpecifications.escapeLike("50%_off\\")).isEqualTo("50\\%\\_off\\\\");
    }

    @Test
    @DisplayName("Should leave plain text unchanged")
    void testEscapeLike_PlainText_Unchanged() {
        assertThat(MessageSpecifications.escapeLike("plain")).isEqualTo("plain");
    }
}
