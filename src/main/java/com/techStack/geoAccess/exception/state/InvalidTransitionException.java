package com.techStack.geoAccess.exception.state;

import com.techStack.geoAccess.exception.service.CustomException;
import com.techStack.geoAccess.models.access.ExceptionStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InvalidTransitionException extends CustomException {
    private final ExceptionStatus currentStatus;

    public InvalidTransitionException(String exceptionId, ExceptionStatus currentStatus, String action) {
        super(HttpStatus.CONFLICT,
                "Cannot " + action + " exception " + exceptionId + " in status " + currentStatus,
                "INVALID_TRANSITION");
        this.currentStatus = currentStatus;
    }
}
