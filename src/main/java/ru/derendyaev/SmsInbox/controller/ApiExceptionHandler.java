package ru.derendyaev.SmsInbox.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import ru.derendyaev.SmsInbox.controller.dto.ErrorResponse;
import ru.derendyaev.SmsInbox.controller.dto.ValidationErrorResponse;
import ru.derendyaev.SmsInbox.exception.InvalidQueryException;
import ru.derendyaev.SmsInbox.exception.StorageUnavailableException;
import ru.derendyaev.SmsInbox.model.ValidationError;

import java.util.List;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ValidationErrorResponse> handleInvalidQuery(InvalidQueryException e) {
        log.info("Некорректные параметры запроса: {}", e.getErrors());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ValidationErrorResponse.of(e.getErrors()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ValidationErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.info("Некорректный тип параметра {}: {}", e.getName(), e.getValue());
        ValidationError error = new ValidationError("query." + e.getName(), "invalid value");
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ValidationErrorResponse.of(List.of(error)));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(StorageUnavailableException e) {
        // причина уже залогирована в месте возникновения
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("storage unavailable"));
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleDataAccess(RuntimeException e) {
        log.error("Ошибка при обращении к хранилищу: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("storage unavailable"));
    }
}
