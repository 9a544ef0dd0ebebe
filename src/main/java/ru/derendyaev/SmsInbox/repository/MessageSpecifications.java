package ru.derendyaev.SmsInbox.repository;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import ru.derendyaev.SmsInbox.model.MessageEntity;
import ru.derendyaev.SmsInbox.model.MessageFilter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class MessageSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private MessageSpecifications() {
    }

    public static Specification<MessageEntity> matching(MessageFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getFrom() != null) {
                predicates.add(cb.equal(root.get("fromAddress"), filter.getFrom()));
            }
            if (filter.getSince() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("timestamp"), filter.getSince()));
            }
            if (filter.getText() != null) {
                String pattern = "%" + escapeLike(filter.getText().toLowerCase(Locale.ROOT)) + "%";
                predicates.add(cb.like(cb.lower(root.<String>get("text")), pattern, LIKE_ESCAPE));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    // % и _ из строки поиска ищутся буквально
    static String escapeLike(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
