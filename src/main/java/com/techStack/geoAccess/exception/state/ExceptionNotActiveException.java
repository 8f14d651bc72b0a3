package com.techStack.geoAccess.exception.state;

import com.techStack.geoAccess.exception.service.CustomException;
import org.springframework.http.HttpStatus;

/**
 * Usage was recorded against an exception that is not approved or outside its window.
 */
public class ExceptionNotActiveException extends CustomException {

    public ExceptionNotActiveException(String exceptionId) {
        super(HttpStatus.CONFLICT, "Exception " + exceptionId + " is not active", "NOT_ACTIVE");
    }
}
