package com.techStack.geoAccess.exception.service;

import org.springframework.http.HttpStatus;

/**
 * The security policy could not be read from storage.
 */
public class PolicyUnavailableException extends CustomException {

    public PolicyUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause, "POLICY_UNAVAILABLE");
    }
}
