package com.techStack.geoAccess.controller.admin;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.request.ReviewNotesRequest;
import com.techStack.geoAccess.dto.response.ApiResponse;
import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.models.access.ExceptionStatus;
import com.techStack.geoAccess.service.access.ExceptionManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Clock;
import java.util.List;

/**
 * Access Exception Admin Controller
 *
 * Review queue and lifecycle actions for international access exceptions.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/security/exceptions")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AccessExceptionAdminController {

    private final ExceptionManager exceptionManager;
    private final Clock clock;

    /* =========================
       Queries
       ========================= */

    @GetMapping
    public Mono<ApiResponse<List<AccessException>>> list(
            @RequestParam(required = false) ExceptionStatus status,
            @RequestParam(defaultValue = "" + GeoSecurityConstants.DEFAULT_LIST_LIMIT) int limit) {
        return exceptionManager.list(status, limit)
                .collectList()
                .map(exceptions -> ApiResponse.success(
                        exceptions.size() + " exception(s)", exceptions, clock.instant()));
    }

    @GetMapping("/{id}")
    public Mono<ApiResponse<AccessException>> get(@PathVariable String id) {
        return exceptionManager.get(id)
                .map(exception -> ApiResponse.success(exception, clock.instant()));
    }

    /* =========================
       Lifecycle
       ========================= */

    @PostMapping("/{id}/approve")
    public Mono<ApiResponse<AccessException>> approve(@PathVariable String id,
                                                      @Valid @RequestBody(required = false) ReviewNotesRequest review,
                                                      Principal principal) {
        return exceptionManager.decide(id, true, principal.getName(), notes(review))
                .map(exception -> ApiResponse.success("Exception approved", exception, clock.instant()));
    }

    @PostMapping("/{id}/deny")
    public Mono<ApiResponse<AccessException>> deny(@PathVariable String id,
                                                   @Valid @RequestBody(required = false) ReviewNotesRequest review,
                                                   Principal principal) {
        return exceptionManager.decide(id, false, principal.getName(), notes(review))
                .map(exception -> ApiResponse.success("Exception denied", exception, clock.instant()));
    }

    @PostMapping("/{id}/revoke")
    public Mono<ApiResponse<AccessException>> revoke(@PathVariable String id,
                                                     @Valid @RequestBody(required = false) ReviewNotesRequest review,
                                                     Principal principal) {
        return exceptionManager.revoke(id, principal.getName(), notes(review))
                .map(exception -> ApiResponse.success("Exception revoked", exception, clock.instant()));
    }

    private static String notes(ReviewNotesRequest review) {
        return review != null ? review.getNotes() : null;
    }
}
