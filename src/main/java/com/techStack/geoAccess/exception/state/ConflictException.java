package com.techStack.geoAccess.exception.state;

import com.techStack.geoAccess.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * A write would break a uniqueness rule or lost an optimistic race. Nothing was written.
 */
public class ConflictException extends CustomException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message, "CONFLICT");
    }

    public ConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, message, cause, "CONFLICT");
    }
}
