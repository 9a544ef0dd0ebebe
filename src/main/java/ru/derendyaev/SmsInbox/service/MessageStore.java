package ru.derendyaev.SmsInbox.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import ru.derendyaev.SmsInbox.config.AppProperties;
import ru.derendyaev.SmsInbox.model.InsertOutcome;
import ru.derendyaev.SmsInbox.model.MessageCandidate;
import ru.derendyaev.SmsInbox.model.MessageEntity;
import ru.derendyaev.SmsInbox.model.MessageFilter;
import ru.derendyaev.SmsInbox.model.MessagePage;
import ru.derendyaev.SmsInbox.model.MessageQuery;
import ru.derendyaev.SmsInbox.model.MessageStats;
import ru.derendyaev.SmsInbox.repository.MessageRepository;
import ru.derendyaev.SmsInbox.repository.MessageSpecifications;
import ru.derendyaev.SmsInbox.repository.OffsetLimitRequest;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Хранилище входящих сообщений.
 * <p>
 * Идемпотентность держится на первичном ключе message_id: вставка идёт через
 * INSERT ... ON CONFLICT DO NOTHING, никаких блокировок на уровне приложения.
 * Список и статистика читаются в одной транзакции REPEATABLE READ, поэтому все
 * значения ответа относятся к одному снимку данных.
 */
@Slf4j
@Service
public class MessageStore {

    static final int MAX_INSERT_ATTEMPTS = 5;
    private static final long RETRY_BACKOFF_MS = 25;

    // 23505 unique_violation, 40001 serialization_failure, 40P01 deadlock (PostgreSQL),
    // 90131 concurrent update, HYT00 lock timeout (H2)
    private static final Set<String> RACE_SQL_STATES = Set.of("23505", "40001", "40P01", "90131", "HYT00");

    private static final Sort LISTING_ORDER = Sort.by(
            Sort.Order.asc("timestamp"),
            Sort.Order.asc("messageId"));

    private final MessageRepository repository;
    private final PlatformTransactionManager transactionManager;
    private final Duration defaultQueryTimeout;

    public MessageStore(MessageRepository repository,
                        PlatformTransactionManager transactionManager,
                        AppProperties properties) {
        this.repository = repository;
        this.transactionManager = transactionManager;
        this.defaultQueryTimeout = properties.getStore().getQueryTimeout();
    }

    /**
     * Атомарная вставка, если message_id ещё не встречался.
     * При гонке за один message_id ровно один вызов получает CREATED.
     */
    public InsertOutcome insert(MessageCandidate candidate) {
        Instant ingestedAt = Instant.now();
        for (int attempt = 1; ; attempt++) {
            try {
                int inserted = repository.insertIfAbsent(
                        candidate.getMessageId(),
                        candidate.getFromAddress(),
                        candidate.getToAddress(),
                        candidate.getTimestamp(),
                        candidate.getText(),
                        ingestedAt);
                return inserted > 0 ? InsertOutcome.CREATED : InsertOutcome.ALREADY_EXISTS;
            } catch (DataAccessException e) {
                if (!isInsertRace(e)) {
                    throw e;
                }
                if (repository.existsById(candidate.getMessageId())) {
                    log.debug("Конкурентная вставка message_id={} уже зафиксирована: {}",
                            candidate.getMessageId(), e.getMessage());
                    return InsertOutcome.ALREADY_EXISTS;
                }
                if (attempt >= MAX_INSERT_ATTEMPTS) {
                    throw e;
                }
                log.warn("Повтор вставки message_id={} (попытка {}): {}",
                        candidate.getMessageId(), attempt, e.getMessage());
                try {
                    // даём конкурирующей транзакции зафиксироваться
                    Thread.sleep(RETRY_BACKOFF_MS * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /**
     * Конкурентная вставка того же id может закончиться нарушением ключа или конфликтом блокировки.
     * Остальные ошибки (например, слишком длинное значение) пробрасываются сразу, без повторов.
     */
    static boolean isInsertRace(DataAccessException e) {
        if (e instanceof DuplicateKeyException || e instanceof ConcurrencyFailureException) {
            return true;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException
                    && RACE_SQL_STATES.contains(((SQLException) cause).getSQLState())) {
                return true;
            }
        }
        return false;
    }

    public MessagePage list(MessageFilter filter, int limit, int offset) {
        return list(MessageQuery.of(limit, offset, filter));
    }

    public MessagePage list(MessageQuery query) {
        return list(query, defaultQueryTimeout);
    }

    public MessagePage list(MessageQuery query, Duration timeout) {
        return readTransaction(timeout).execute(status -> {
            Page<MessageEntity> page = repository.findAll(
                    MessageSpecifications.matching(query.getFilter()),
                    new OffsetLimitRequest(query.getOffset(), query.getLimit(), LISTING_ORDER));
            return new MessagePage(page.getContent(), page.getTotalElements());
        });
    }

    public MessageStats stats() {
        return stats(defaultQueryTimeout);
    }

    public MessageStats stats(Duration timeout) {
        return readTransaction(timeout).execute(status -> MessageStats.builder()
                .total(repository.count())
                .distinctSenders(repository.countDistinctSenders())
                .topSenders(repository.findTopSenders(PageRequest.of(0, MessageStats.TOP_SENDERS_LIMIT)))
                .earliest(repository.findEarliestTimestamp().orElse(null))
                .latest(repository.findLatestTimestamp().orElse(null))
                .build());
    }

    /**
     * Проверка доступности базы простым запросом.
     */
    public boolean readiness() {
        try {
            repository.ping();
            return true;
        } catch (DataAccessException | TransactionException e) {
            log.warn("База данных недоступна: {}", e.getMessage());
            return false;
        }
    }

    private TransactionTemplate readTransaction(Duration timeout) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setReadOnly(true);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        template.setTimeout(toSeconds(timeout));
        return template;
    }

    private static int toSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
