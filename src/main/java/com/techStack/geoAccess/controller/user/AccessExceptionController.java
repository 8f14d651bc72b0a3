package com.techStack.geoAccess.controller.user;

import com.techStack.geoAccess.dto.request.ExceptionRequest;
import com.techStack.geoAccess.dto.response.ApiResponse;
import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.service.access.ExceptionManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Clock;
import java.util.List;

/**
 * Access Exception Controller
 *
 * Lets a signed-in user ask for temporary access from another country and follow their requests.
 */
@Slf4j
@RestController
@RequestMapping("/api/security/exceptions")
@RequiredArgsConstructor
public class AccessExceptionController {

    private final ExceptionManager exceptionManager;
    private final Clock clock;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<AccessException>> request(@Valid @RequestBody ExceptionRequest request,
                                                      Principal principal) {
        return exceptionManager.request(principal.getName(), request, principal.getName())
                .map(exception -> ApiResponse.success(
                        "Exception requested; you will be notified once it is reviewed", exception, clock.instant()));
    }

    @GetMapping
    public Mono<ApiResponse<List<AccessException>>> mine(Principal principal) {
        return exceptionManager.listForUser(principal.getName())
                .collectList()
                .map(exceptions -> ApiResponse.success(exceptions, clock.instant()));
    }
}
