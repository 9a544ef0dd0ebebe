package ru.derendyaev.SmsInbox.exception;

/**
 * Хранилище недоступно: запрос завершается ошибкой сервера, данные не повреждаются.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
