package com.techStack.geoAccess.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Body of the 403 sent when the geographic policy refuses a request.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlockedAccessResponse {
    String error;
    String reason;
    String ip;
    String country;
    String city;
    String message;
}
