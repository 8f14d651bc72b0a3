package com.techStack.geoAccess.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Error body for the administrative and user APIs.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    boolean success;
    int status;
    String errorCode;
    String message;
    String field;
    Map<String, String> errors;
    Instant timestamp;
    String path;
}
