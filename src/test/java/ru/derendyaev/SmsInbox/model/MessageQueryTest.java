package ru.derendyaev.SmsInbox.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.derendyaev.SmsInbox.exception.InvalidQueryException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MessageQuery Tests")
class MessageQueryTest {

    @Test
    @DisplayName("Should apply defaults when parameters are absent")
    void testFromParams_Defaults() {
        MessageQuery query = MessageQuery.fromParams(null, null, null, null, null);

        assertThat(query.getLimit()).isEqualTo(MessageQuery.DEFAULT_LIMIT);
        assertThat(query.getOffset()).isZero();
        assertThat(query.getFilter()).isEqualTo(MessageFilter.NONE);
    }

    @Test
    @DisplayName("Should treat empty from and q as no filter")
    void testFromParams_EmptyStrings_NoFilter() {
        MessageQuery query = MessageQuery.fromParams(10, 5, "", null, "");

        assertThat(query.getFilter().getFrom()).isNull();
        assertThat(query.getFilter().getText()).isNull();
    }

    @Test
    @DisplayName("Should parse since as UTC instant")
    void testFromParams_Since_Parsed() {
        MessageQuery query = MessageQuery.fromParams(10, 0, "+1", "2025-01-15T09:30:00Z", "hi");

        assertThat(query.getFilter().getSince()).isEqualTo(Instant.parse("2025-01-15T09:30:00Z"));
        assertThat(query.getFilter().getFrom()).isEqualTo("+1");
        assertThat(query.getFilter().getText()).isEqualTo("hi");
    }

    @Test
    @DisplayName("Should reject limit outside [1, 100] and negative offset together")
    void testFromParams_BadWindow_CollectsErrors() {
        assertThatThrownBy(() -> MessageQuery.fromParams(0, -1, null, "nope", null))
                .isInstanceOfSatisfying(InvalidQueryException.class, e -> assertThat(e.getErrors())
                        .extracting(ValidationError::getLocation)
                        .containsExactly("query.limit", "query.offset", "query.since"));

        assertThatThrownBy(() -> MessageQuery.of(101, 0, MessageFilter.NONE))
                .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    @DisplayName("Should accept limit bounds")
    void testOf_LimitBounds_Accepted() {
        assertThat(MessageQuery.of(1, 0, null).getLimit()).isEqualTo(1);
        assertThat(MessageQuery.of(100, 0, null).getLimit()).isEqualTo(100);
    }
}
