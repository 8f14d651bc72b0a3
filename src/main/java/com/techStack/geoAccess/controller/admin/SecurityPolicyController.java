package com.techStack.geoAccess.controller.admin;

import com.techStack.geoAccess.dto.internal.PolicyUpdateResult;
import com.techStack.geoAccess.dto.request.PolicyUpdateRequest;
import com.techStack.geoAccess.dto.response.ApiResponse;
import com.techStack.geoAccess.dto.response.SecurityStatusResponse;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.security.ClientIpResolver;
import com.techStack.geoAccess.service.policy.PolicyStore;
import com.techStack.geoAccess.service.status.SecurityStatusService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Clock;

/**
 * Security Policy Controller
 *
 * Read and change the geographic access policy; dashboard status.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/security")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class SecurityPolicyController {

    /* =========================
       Dependencies
       ========================= */

    private final PolicyStore policyStore;
    private final SecurityStatusService statusService;
    private final ClientIpResolver clientIpResolver;
    private final Clock clock;

    /* =========================
       Policy
       ========================= */

    @GetMapping("/policy")
    public Mono<ApiResponse<SecurityPolicy>> getPolicy() {
        return policyStore.get()
                .map(policy -> ApiResponse.success(policy, clock.instant()));
    }

    /**
     * Applies the non-null fields of the request. Every changed field produces one audit entry;
     * country changes and enforcement toggles also notify leadership.
     */
    @PutMapping("/policy")
    public Mono<ApiResponse<PolicyUpdateResult>> updatePolicy(@Valid @RequestBody PolicyUpdateRequest request,
                                                              Principal principal,
                                                              ServerWebExchange exchange) {
        log.info("Policy update requested by {}", principal.getName());

        return policyStore.update(request, principal.getName(), clientIpResolver.context(exchange.getRequest()))
                .map(result -> ApiResponse.success(
                        result.isChanged()
                                ? "Security policy updated (" + result.getEntries().size() + " change(s))"
                                : "No changes",
                        result,
                        clock.instant()));
    }

    /* =========================
       Status
       ========================= */

    @GetMapping("/status")
    public Mono<ApiResponse<SecurityStatusResponse>> getStatus() {
        return statusService.status()
                .map(status -> ApiResponse.success(status, clock.instant()));
    }
}
