package ru.derendyaev.SmsInbox.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import ru.derendyaev.SmsInbox.model.MessageEntity;
import ru.derendyaev.SmsInbox.model.SenderCount;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface MessageRepository extends JpaRepository<MessageEntity, String>, JpaSpecificationExecutor<MessageEntity> {

    /**
     * Вставка, если message_id ещё не встречался.
     *
     * @return 1 если строка добавлена, 0 если такой message_id уже есть
     */
    @Modifying
    @Transactional
    @Query(value = """
            INSERT INTO messages (message_id, from_address, to_address, ts, message_text, ingested_at)
            VALUES (:messageId, :fromAddress, :toAddress, :ts, :text, :ingestedAt)
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("messageId") String messageId,
                       @Param("fromAddress") String fromAddress,
                       @Param("toAddress") String toAddress,
                       @Param("ts") Instant ts,
                       @Param("text") String text,
                       @Param("ingestedAt") Instant ingestedAt);

    @Query("select count(distinct m.fromAddress) from MessageEntity m")
    long countDistinctSenders();

    @Query("""
            select new ru.derendyaev.SmsInbox.model.SenderCount(m.fromAddress, count(m))
            from MessageEntity m
            group by m.fromAddress
            order by count(m) desc, m.fromAddress asc
            """)
    List<SenderCount> findTopSenders(Pageable pageable);

    @Query("select min(m.timestamp) from MessageEntity m")
    Optional<Instant> findEarliestTimestamp();

    @Query("select max(m.timestamp) from MessageEntity m")
    Optional<Instant> findLatestTimestamp();

    @Query(value = "SELECT 1", nativeQuery = true)
    Integer ping();
}
