package com.techStack.geoAccess.dto.internal;

import lombok.Builder;
import lombok.Value;

/**
 * Request facts recorded alongside decisions and audit entries.
 */
@Value
@Builder
public class RequestContext {
    String ipAddress;
    String userAgent;
    String path;

    public static RequestContext system() {
        return RequestContext.builder().build();
    }
}
