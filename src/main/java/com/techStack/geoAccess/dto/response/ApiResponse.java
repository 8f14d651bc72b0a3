package com.techStack.geoAccess.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;

/**
 * Response envelope for the administrative and user APIs.
 *
 * @param <T> Type of the data in success response
 */
@Setter
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private boolean success;
    private String message;
    private T data;
    private Instant timestamp;
    private Long timestampMillis;

    public ApiResponse() {
    }

    public ApiResponse(boolean success, String message, T data, Instant timestamp) {
        this.success = success;
        this.message = message;
        this.data = data;
        this.timestamp = timestamp;
        this.timestampMillis = timestamp != null ? timestamp.toEpochMilli() : null;
    }

    public static <T> ApiResponse<T> success(String message, T data, Instant timestamp) {
        return new ApiResponse<>(true, message, data, timestamp);
    }

    public static <T> ApiResponse<T> success(T data, Instant timestamp) {
        return new ApiResponse<>(true, "Operation successful", data, timestamp);
    }

    @Override
    public String toString() {
        return "ApiResponse{" +
                "success=" + success +
                ", message='" + message + '\'' +
                ", data=" + data +
                ", timestamp=" + timestamp +
                '}';
    }
}
