package com.techStack.geoAccess.controller.admin;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.request.AttemptExceptionRequest;
import com.techStack.geoAccess.dto.request.ReviewNotesRequest;
import com.techStack.geoAccess.dto.response.ApiResponse;
import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.service.access.ExceptionManager;
import com.techStack.geoAccess.service.security.AttemptReviewService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/admin/security/attempts")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class SuspiciousAttemptController {

    private final AttemptReviewService reviewService;
    private final ExceptionManager exceptionManager;
    private final Clock clock;

    @GetMapping
    public Mono<ApiResponse<List<SuspiciousAccessAttempt>>> list(
            @RequestParam(defaultValue = "false") boolean unresolved,
            @RequestParam(defaultValue = "" + GeoSecurityConstants.DEFAULT_LIST_LIMIT) int limit) {
        return reviewService.list(unresolved, limit)
                .collectList()
                .map(attempts -> ApiResponse.success(attempts.size() + " attempt(s)", attempts, clock.instant()));
    }

    @PostMapping("/{id}/resolve")
    public Mono<ApiResponse<SuspiciousAccessAttempt>> resolve(@PathVariable String id,
                                                              @Valid @RequestBody(required = false) ReviewNotesRequest review,
                                                              Principal principal) {
        return reviewService.resolve(id, principal.getName(), review != null ? review.getNotes() : null)
                .map(attempt -> ApiResponse.success("Attempt resolved", attempt, clock.instant()));
    }

    /** Opens a PENDING exception for the attempt's user and country. */
    @PostMapping("/{id}/exception")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<AccessException>> createException(@PathVariable String id,
                                                              @Valid @RequestBody(required = false) AttemptExceptionRequest request,
                                                              Principal principal) {
        return exceptionManager.createFromAttempt(id, principal.getName(), request)
                .map(exception -> ApiResponse.success("Exception created", exception, clock.instant()));
    }
}
