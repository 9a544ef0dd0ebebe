package ru.derendyaev.SmsInbox.service;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import ru.derendyaev.SmsInbox.config.WebhookSecret;
import ru.derendyaev.SmsInbox.exception.StorageUnavailableException;
import ru.derendyaev.SmsInbox.model.IngestionOutcome;
import ru.derendyaev.SmsInbox.model.InsertOutcome;
import ru.derendyaev.SmsInbox.model.MessageCandidate;
import ru.derendyaev.SmsInbox.model.ValidationError;
import ru.derendyaev.SmsInbox.model.ValidationResult;
import ru.derendyaev.SmsInbox.model.WebhookPayload;

import java.io.IOException;
import java.util.List;

/**
 * Обработка одного вебхука: подпись -> валидация -> сохранение.
 * Каждый вызов заканчивается ровно одним итогом и одним инкрементом счётчика.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final SignatureVerifier signatureVerifier;
    private final MessageValidator messageValidator;
    private final MessageStore messageStore;
    private final IngestionMetrics metrics;
    private final ObjectMapper objectMapper;
    private final WebhookSecret webhookSecret;

    public IngestionOutcome handle(byte[] rawBody, String signatureHeader) {
        return handle(rawBody, signatureHeader, webhookSecret.getValue());
    }

    public IngestionOutcome handle(byte[] rawBody, String signatureHeader, String secret) {
        IngestionOutcome outcome = process(rawBody != null ? rawBody : new byte[0], signatureHeader, secret);
        metrics.record(outcome);
        return outcome;
    }

    private IngestionOutcome process(byte[] rawBody, String signatureHeader, String secret) {
        // ------------------- Проверка подписи -------------------
        if (!signatureVerifier.verify(rawBody, signatureHeader, secret)) {
            log.error("Неверная подпись вебхука, result=invalid_signature");
            return IngestionOutcome.invalidSignature();
        }

        // ------------------- Декодирование и валидация -------------------
        WebhookPayload payload;
        try {
            payload = objectMapper.readValue(rawBody, WebhookPayload.class);
        } catch (IOException e) {
            ValidationError error = decodeError(e);
            log.error("Не удалось разобрать тело вебхука: {}, result=validation_error", error);
            return IngestionOutcome.validationError(List.of(error));
        }
        if (payload == null) {
            log.error("Пустое тело вебхука, result=validation_error");
            return IngestionOutcome.validationError(
                    List.of(new ValidationError("body", "body must be a JSON object")));
        }

        ValidationResult validation = messageValidator.validate(payload);
        if (!validation.isValid()) {
            log.error("Ошибка валидации вебхука: {}, result=validation_error", validation.getErrors());
            return IngestionOutcome.validationError(validation.getErrors());
        }

        // ------------------- Сохранение -------------------
        MessageCandidate candidate = validation.getCandidate();
        InsertOutcome inserted;
        try {
            inserted = messageStore.insert(candidate);
        } catch (DataAccessException | TransactionException e) {
            log.error("Хранилище недоступно при сохранении message_id={}: {}",
                    candidate.getMessageId(), e.getMessage(), e);
            throw new StorageUnavailableException("storage unavailable", e);
        }

        boolean duplicate = inserted == InsertOutcome.ALREADY_EXISTS;
        log.info("Вебхук обработан: message_id={}, dup={}, result={}",
                candidate.getMessageId(), duplicate, duplicate ? "duplicate" : "created");
        return duplicate
                ? IngestionOutcome.duplicate(candidate.getMessageId())
                : IngestionOutcome.created(candidate.getMessageId());
    }

    private ValidationError decodeError(IOException e) {
        if (e instanceof JsonMappingException) {
            List<JsonMappingException.Reference> path = ((JsonMappingException) e).getPath();
            if (!path.isEmpty() && path.get(0).getFieldName() != null) {
                return new ValidationError("body." + path.get(0).getFieldName(), "invalid value type");
            }
        }
        return new ValidationError("body", "body must be a valid JSON object");
    }
}
