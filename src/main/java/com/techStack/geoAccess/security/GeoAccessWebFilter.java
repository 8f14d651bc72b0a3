package com.techStack.geoAccess.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.AccessDecision;
import com.techStack.geoAccess.dto.internal.DecisionReason;
import com.techStack.geoAccess.dto.internal.RequestContext;
import com.techStack.geoAccess.dto.response.BlockedAccessResponse;
import com.techStack.geoAccess.models.geo.GeoRecord;
import com.techStack.geoAccess.service.access.AccessDecisionEngine;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.Optional;

/**
 * Geographic Access Filter
 *
 * Runs after Spring Security has authenticated the request. Authenticated requests are passed
 * to the {@link AccessDecisionEngine}; a refusal ends the exchange with 403 (or 503 when the
 * policy could not be read). Unauthenticated requests and exempt paths pass untouched.
 */
@Component
@Order(0)
@RequiredArgsConstructor
public class GeoAccessWebFilter implements WebFilter {

    private static final Logger logger = LoggerFactory.getLogger(GeoAccessWebFilter.class);

    private final AccessDecisionEngine decisionEngine;
    private final ClientIpResolver clientIpResolver;
    private final GeoSecurityProperties properties;
    private final ObjectMapper objectMapper;

    /* =========================
       Filter Implementation
       ========================= */

    @NonNull
    @Override
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (isExempt(path)) {
            return chain.filter(exchange);
        }

        return exchange.getPrincipal()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(principal -> {
                    if (principal.isEmpty() || principal.get() instanceof AnonymousAuthenticationToken) {
                        return chain.filter(exchange);
                    }
                    return check(exchange, chain, principal.get(), path);
                });
    }

    private Mono<Void> check(ServerWebExchange exchange, WebFilterChain chain, Principal principal, String path) {
        RequestContext context = clientIpResolver.context(exchange.getRequest());
        String ip = context.getIpAddress();

        return decisionEngine.authorize(ip, principal.getName(), context)
                .onErrorResume(e -> {
                    logger.error("❌ Access decision failed for {} from {}: {}", principal.getName(), ip, e.getMessage());
                    return Mono.just(AccessDecision.deny(DecisionReason.POLICY_UNAVAILABLE, null));
                })
                .flatMap(decision -> {
                    if (decision.isAllowed()) {
                        return chain.filter(exchange);
                    }
                    logger.warn("Access denied for {} from {} on {}: {}",
                            principal.getName(), ip, path, decision.getReason());
                    return reject(exchange, decision, ip);
                });
    }

    /* =========================
       Rejection
       ========================= */

    private Mono<Void> reject(ServerWebExchange exchange, AccessDecision decision, String ip) {
        boolean unavailable = decision.getReason() == DecisionReason.POLICY_UNAVAILABLE;
        GeoRecord geo = decision.getGeo();

        BlockedAccessResponse body = BlockedAccessResponse.builder()
                .error(unavailable ? "Service Unavailable" : "Access Denied")
                .reason(decision.getReason().name())
                .ip(ip)
                .country(geo != null ? geo.getCountryName() : null)
                .city(geo != null ? geo.getCity() : null)
                .message(messageFor(decision.getReason()))
                .build();

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(unavailable ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.FORBIDDEN);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            logger.error("Could not serialise blocked-access body: {}", e.getMessage());
            bytes = ("{\"error\":\"Access Denied\",\"reason\":\"" + decision.getReason() + "\"}")
                    .getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }

    private static String messageFor(DecisionReason reason) {
        return switch (reason) {
            case COUNTRY_BLOCKED -> "Access from your current location is not permitted. "
                    + "Request an international access exception if you are travelling.";
            case GEO_UNAVAILABLE -> "Your location could not be verified. Please try again shortly.";
            case POLICY_UNAVAILABLE -> "Access control is temporarily unavailable.";
            default -> "Access denied.";
        };
    }

    private boolean isExempt(String path) {
        return properties.getExemptPaths().stream().anyMatch(prefix ->
                path.startsWith(prefix) || (prefix.endsWith("/") && path.equals(prefix.substring(0, prefix.length() - 1))));
    }
}
