package com.techStack.geoAccess.service.access;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.TransitionOutcome;
import com.techStack.geoAccess.dto.request.AttemptExceptionRequest;
import com.techStack.geoAccess.dto.request.ExceptionRequest;
import com.techStack.geoAccess.event.ExceptionLifecycleEvent;
import com.techStack.geoAccess.exception.data.ResourceNotFoundException;
import com.techStack.geoAccess.exception.state.ExceptionNotActiveException;
import com.techStack.geoAccess.exception.state.InvalidTransitionException;
import com.techStack.geoAccess.exception.validation.ValidationException;
import com.techStack.geoAccess.models.access.AccessException;
import com.techStack.geoAccess.models.access.ExceptionStatus;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.repository.AccessExceptionRepository;
import com.techStack.geoAccess.repository.SuspiciousAttemptRepository;
import com.techStack.geoAccess.util.validation.CountryCodes;
import com.techStack.geoAccess.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Lifecycle of per-user international access exceptions.
 *
 * <pre>
 *   PENDING ──approve──▶ APPROVED ──revoke──▶ REVOKED
 *      │                    │
 *      └──deny──▶ DENIED    └──(end passed)──▶ EXPIRED
 * </pre>
 *
 * Every transition is a guarded read-modify-write in one storage transaction, so two approvers
 * racing on the same exception produce one winner and one {@link InvalidTransitionException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExceptionManager {

    private final AccessExceptionRepository repository;
    private final SuspiciousAttemptRepository attemptRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final GeoSecurityProperties properties;
    private final Clock clock;

    /* ===== Requests ===== */

    public Mono<AccessException> request(String userId, ExceptionRequest request, String requestedBy) {
        return request(userId, request, requestedBy, null);
    }

    private Mono<AccessException> request(String userId, ExceptionRequest request,
                                          String requestedBy, String sourceAttemptId) {
        Instant now = clock.instant();
        Instant startsAt = request.getStartsAt() != null ? request.getStartsAt() : now;

        Map<String, String> errors = validate(userId, request, startsAt, now);
        if (!errors.isEmpty()) {
            return Mono.error(new ValidationException("Invalid exception request", errors));
        }

        AccessException exception = AccessException.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .destinationCountry(CountryCodes.normalize(request.getDestinationCountry()))
                .reason(request.getReason().trim())
                .startsAt(startsAt)
                .endsAt(request.getEndsAt())
                .status(ExceptionStatus.PENDING)
                .requestedBy(requestedBy)
                .requestedAt(now)
                .contactEmail(StringUtils.trimToNull(request.getContactEmail()))
                .sourceAttemptId(sourceAttemptId)
                .build();

        return repository.createIfNoneOpen(exception, now)
                .doOnNext(created -> {
                    log.info("✈️ Exception {} requested for user {} to {} ({} → {})",
                            created.getId(), userId, created.getDestinationCountry(),
                            created.getStartsAt(), created.getEndsAt());
                    publish(created, ExceptionLifecycleEvent.Action.REQUESTED, now);
                });
    }

    /** Opens a PENDING exception for the user and country of a blocked attempt. */
    public Mono<AccessException> createFromAttempt(String attemptId, String actor, AttemptExceptionRequest request) {
        return attemptRepository.findById(attemptId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Suspicious attempt", attemptId)))
                .flatMap(attempt -> {
                    if (attempt.getUserId() == null || attempt.getCountryCode() == null) {
                        return Mono.error(new ValidationException(
                                "Attempt has no user or country to grant an exception for", "attemptId"));
                    }
                    Instant now = clock.instant();
                    Duration window = request != null && request.getDurationDays() != null
                            ? Duration.ofDays(request.getDurationDays())
                            : properties.getExceptions().getDefaultDuration();

                    ExceptionRequest derived = ExceptionRequest.builder()
                            .destinationCountry(attempt.getCountryCode())
                            .startsAt(now)
                            .endsAt(now.plus(window))
                            .reason(reasonFor(attempt, request))
                            .build();
                    return request(attempt.getUserId(), derived, actor, attempt.getId());
                });
    }

    private static String reasonFor(SuspiciousAccessAttempt attempt, AttemptExceptionRequest request) {
        if (request != null && StringUtils.isNotBlank(request.getReason())) {
            return request.getReason();
        }
        return "Created from blocked attempt " + attempt.getId() + " (" + attempt.getCountryCode() + ")";
    }

    private Map<String, String> validate(String userId, ExceptionRequest request, Instant startsAt, Instant now) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (StringUtils.isBlank(userId)) {
            errors.put("userId", "User is required");
        }
        if (!CountryCodes.isValid(request.getDestinationCountry())) {
            errors.put("destinationCountry", "Destination must be an ISO 3166-1 alpha-2 code");
        }
        if (StringUtils.isBlank(request.getReason())) {
            errors.put("reason", "A justification is required");
        }
        if (request.getEndsAt() == null) {
            errors.put("endsAt", "End of the window is required");
        } else if (!request.getEndsAt().isAfter(startsAt)) {
            errors.put("endsAt", "End must be after start");
        } else if (!request.getEndsAt().isAfter(now)) {
            errors.put("endsAt", "End must be in the future");
        }
        if (StringUtils.isNotBlank(request.getContactEmail()) && !HelperUtils.isValidEmail(request.getContactEmail())) {
            errors.put("contactEmail", "Invalid email address");
        }
        return errors;
    }

    /* ===== Transitions ===== */

    public Mono<AccessException> decide(String exceptionId, boolean approve, String actor, String notes) {
        Instant now = clock.instant();
        ExceptionStatus target = approve ? ExceptionStatus.APPROVED : ExceptionStatus.DENIED;

        return repository.transition(exceptionId, now,
                        current -> current.getStatus() == ExceptionStatus.PENDING,
                        current -> current.toBuilder()
                                .status(target)
                                .decidedBy(actor)
                                .decidedAt(now)
                                .adminNotes(StringUtils.trimToNull(notes))
                                .build())
                .flatMap(outcome -> applied(outcome, exceptionId, approve ? "approve" : "deny"))
                .doOnNext(decided -> {
                    log.info("✅ Exception {} {} by {}", exceptionId, target, actor);
                    publish(decided, approve ? ExceptionLifecycleEvent.Action.APPROVED
                            : ExceptionLifecycleEvent.Action.DENIED, now);
                });
    }

    public Mono<AccessException> revoke(String exceptionId, String actor, String notes) {
        Instant now = clock.instant();

        return repository.transition(exceptionId, now,
                        current -> current.getStatus() == ExceptionStatus.APPROVED,
                        current -> current.toBuilder()
                                .status(ExceptionStatus.REVOKED)
                                .revokedBy(actor)
                                .revokedAt(now)
                                .adminNotes(notes != null ? StringUtils.trimToNull(notes) : current.getAdminNotes())
                                .build())
                .flatMap(outcome -> applied(outcome, exceptionId, "revoke"))
                .doOnNext(revoked -> {
                    log.warn("⛔ Exception {} revoked by {}", exceptionId, actor);
                    publish(revoked, ExceptionLifecycleEvent.Action.REVOKED, now);
                });
    }

    /** Counts one use of an active exception. Fails with NOT_ACTIVE outside the approved window. */
    public Mono<AccessException> recordUsage(String exceptionId) {
        Instant now = clock.instant();

        return repository.transition(exceptionId, now,
                        current -> current.isActiveAt(now),
                        current -> current.toBuilder()
                                .timesUsed(current.getTimesUsed() + 1)
                                .lastUsed(now)
                                .build())
                .flatMap(outcome -> outcome.isApplied()
                        ? Mono.just(outcome.getException())
                        : Mono.error(new ExceptionNotActiveException(exceptionId)));
    }

    private static Mono<AccessException> applied(TransitionOutcome outcome, String exceptionId, String action) {
        if (outcome.isApplied()) {
            return Mono.just(outcome.getException());
        }
        return Mono.error(new InvalidTransitionException(exceptionId, outcome.getException().getStatus(), action));
    }

    private void publish(AccessException exception, ExceptionLifecycleEvent.Action action, Instant at) {
        eventPublisher.publishEvent(new ExceptionLifecycleEvent(this, exception, action, at));
    }

    /* ===== Queries ===== */

    /** The exception currently granting {@code userId} access from {@code countryCode}, if any. */
    public Mono<AccessException> findActive(String userId, String countryCode) {
        Instant now = clock.instant();
        return repository.findByUserAndCountry(userId, CountryCodes.normalize(countryCode))
                .filter(exception -> exception.isActiveAt(now))
                .next();
    }

    public Mono<AccessException> get(String exceptionId) {
        return repository.findById(exceptionId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Access exception", exceptionId)))
                .map(exception -> exception.withEffectiveStatus(clock.instant()));
    }

    /**
     * Newest first, with the derived status. Filtering by EXPIRED also returns approvals whose
     * window has passed but whose stored status has not been rewritten yet.
     */
    public Flux<AccessException> list(ExceptionStatus status, int limit) {
        Instant now = clock.instant();
        int bounded = HelperUtils.clampLimit(limit);

        Flux<AccessException> source = status == ExceptionStatus.EXPIRED
                ? Flux.merge(repository.findRecent(ExceptionStatus.EXPIRED, bounded),
                        repository.findRecent(ExceptionStatus.APPROVED, bounded))
                : repository.findRecent(status, bounded);

        return source
                .map(exception -> exception.withEffectiveStatus(now))
                .filter(exception -> status == null || exception.getStatus() == status)
                .sort(Comparator.comparing(AccessException::getRequestedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .take(bounded);
    }

    public Flux<AccessException> listForUser(String userId) {
        Instant now = clock.instant();
        return repository.findByUser(userId)
                .map(exception -> exception.withEffectiveStatus(now))
                .sort(Comparator.comparing(AccessException::getRequestedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())));
    }

    /* ===== Maintenance ===== */

    /** Persists EXPIRED on approvals whose window has ended. Emits how many were rewritten. */
    public Mono<Long> expireOverdue() {
        Instant now = clock.instant();
        return repository.findByStatus(ExceptionStatus.APPROVED)
                .filter(exception -> exception.isStaleApproval(now))
                .concatMap(exception -> repository.transition(exception.getId(), now, current -> false, current -> current)
                        .onErrorResume(e -> {
                            log.warn("Could not persist expiry of exception {}: {}", exception.getId(), e.getMessage());
                            return Mono.empty();
                        }))
                .filter(outcome -> outcome.getException().getStatus() == ExceptionStatus.EXPIRED)
                .count();
    }
}
