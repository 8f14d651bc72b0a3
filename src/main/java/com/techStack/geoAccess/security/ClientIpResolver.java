package com.techStack.geoAccess.security;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.RequestContext;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Client address of a request: first {@code X-Forwarded-For} hop, else the peer address.
 */
@Component
public class ClientIpResolver {

    public String resolve(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst(GeoSecurityConstants.HEADER_FORWARDED_FOR);
        if (StringUtils.isNotBlank(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return GeoSecurityConstants.UNKNOWN_IP;
    }

    public RequestContext context(ServerHttpRequest request) {
        return RequestContext.builder()
                .ipAddress(resolve(request))
                .userAgent(request.getHeaders().getFirst(HttpHeaders.USER_AGENT))
                .path(request.getPath().value())
                .build();
    }
}
