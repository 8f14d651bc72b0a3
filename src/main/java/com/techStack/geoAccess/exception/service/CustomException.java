package com.techStack.geoAccess.exception.service;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every error the security core reports to its callers.
 */
@Getter
public class CustomException extends RuntimeException {
    private final HttpStatus status;
    private final String field;
    private final String code;

    public CustomException(HttpStatus status, String message) {
        this(status, message, null, null, null);
    }

    public CustomException(HttpStatus status, String message, String code) {
        this(status, message, null, null, code);
    }

    public CustomException(HttpStatus status, String message, Throwable cause, String code) {
        this(status, message, cause, null, code);
    }

    public CustomException(HttpStatus status, String message, Throwable cause, String field, String code) {
        super(message, cause);
        this.status = status;
        this.field = field;
        this.code = code;
    }

    @Override
    public String toString() {
        return "CustomException{" +
                "status=" + status +
                ", field='" + field + '\'' +
                ", code='" + code + '\'' +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
