package ru.derendyaev.SmsInbox.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.derendyaev.SmsInbox.model.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@AllArgsConstructor
public class ValidationErrorResponse {

    private List<Detail> detail;

    public static ValidationErrorResponse of(List<ValidationError> errors) {
        return new ValidationErrorResponse(errors.stream()
                .map(e -> new Detail(e.getLocation(), e.getMessage()))
                .collect(Collectors.toList()));
    }

    @Getter
    @AllArgsConstructor
    public static class Detail {
        private String loc;
        private String msg;
    }
}
