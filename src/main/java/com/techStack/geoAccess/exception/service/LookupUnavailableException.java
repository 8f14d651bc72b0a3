package com.techStack.geoAccess.exception.service;

import org.springframework.http.HttpStatus;

/**
 * The geolocation provider could not answer in time, rejected the address, or the address was
 * not resolvable at all. Absorbed by the access decision; never shown to end users.
 */
public class LookupUnavailableException extends CustomException {

    public LookupUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, "LOOKUP_UNAVAILABLE");
    }

    public LookupUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause, "LOOKUP_UNAVAILABLE");
    }
}
