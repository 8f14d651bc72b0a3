package com.techStack.geoAccess.exception.data;

import com.techStack.geoAccess.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * Raised for every attempt to modify or remove an audit ledger entry.
 */
public class ImmutableRecordException extends CustomException {

    public ImmutableRecordException(String message) {
        super(HttpStatus.METHOD_NOT_ALLOWED, message, "IMMUTABLE_RECORD");
    }
}
