package com.techStack.geoAccess.exception.validation;

import com.techStack.geoAccess.exception.service.CustomException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validation exception with per-field messages
 */
@Getter
public class ValidationException extends CustomException {
    private final Map<String, String> fieldErrors;

    public ValidationException(String message, String field) {
        super(HttpStatus.BAD_REQUEST, message, null, field, "VALIDATION_ERROR");
        this.fieldErrors = Map.of(field, message);
    }

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(HttpStatus.BAD_REQUEST, message, "VALIDATION_ERROR");
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }
}
