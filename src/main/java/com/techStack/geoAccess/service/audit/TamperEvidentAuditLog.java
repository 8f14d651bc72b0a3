package com.techStack.geoAccess.service.audit;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.AuditEntryDraft;
import com.techStack.geoAccess.dto.internal.IntegrityReport;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import com.techStack.geoAccess.dto.internal.VerificationResult;
import com.techStack.geoAccess.dto.response.AuditEntryView;
import com.techStack.geoAccess.exception.data.ResourceNotFoundException;
import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.models.audit.NotificationReceipt;
import com.techStack.geoAccess.models.audit.TamperNote;
import com.techStack.geoAccess.models.audit.VerificationStatus;
import com.techStack.geoAccess.repository.AuditLedgerRepository;
import com.techStack.geoAccess.repository.PolicyRepository;
import com.techStack.geoAccess.repository.metrics.MetricsService;
import com.techStack.geoAccess.service.notification.SecurityNotificationService;
import com.techStack.geoAccess.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only ledger of security policy changes.
 *
 * <p>Entries are sealed with a keyed checksum at creation and never change afterwards. There is no
 * update or delete path at any layer. Verification recomputes the checksum; a mismatch is an
 * integrity failure that is logged, written to a tamper note and notified to IT and security
 * before the verification result is returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TamperEvidentAuditLog {

    private static final Logger securityLog = LoggerFactory.getLogger(GeoSecurityConstants.SECURITY_AUDIT_LOGGER);

    private final AuditLedgerRepository repository;
    private final PolicyRepository policyRepository;
    private final AuditChecksumCalculator checksumCalculator;
    private final SecurityNotificationService notificationService;
    private final MetricsService metricsService;
    private final Clock clock;

    /* ===== Sealing & appending ===== */

    /**
     * Stamps and seals a draft without storing it. Used when the entry must be written in the
     * same transaction as the change it describes.
     *
     * <p>Timestamps are truncated to milliseconds: Firestore keeps microseconds, and the sealed
     * value has to survive a round trip unchanged.
     */
    public AuditEntry seal(AuditEntryDraft draft) {
        AuditEntry unsealed = AuditEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .actor(draft.getActor())
                .changeType(draft.getChangeType())
                .oldValue(draft.getOldValue())
                .newValue(draft.getNewValue())
                .justification(draft.getJustification())
                .requestIp(draft.getRequestIp())
                .userAgent(draft.getUserAgent())
                .build();

        return unsealed.toBuilder()
                .checksum(checksumCalculator.compute(unsealed))
                .build();
    }

    public Mono<AuditEntry> append(AuditEntryDraft draft) {
        AuditEntry entry = seal(draft);
        return repository.create(entry)
                .doOnSuccess(saved -> securityLog.info("Audit entry {} appended: {} by {}",
                        saved.getId(), saved.getChangeType(), saved.getActor()));
    }

    /**
     * Stores the notification outcome for each entry. Receipts are write-once.
     */
    public Mono<Void> recordNotification(List<AuditEntry> entries, NotificationOutcome outcome) {
        Instant now = clock.instant();
        return Flux.fromIterable(entries)
                .concatMap(entry -> repository.createReceipt(NotificationReceipt.builder()
                        .entryId(entry.getId())
                        .delivered(outcome.isDelivered())
                        .recipientCount(outcome.getRecipientCount())
                        .error(outcome.getError())
                        .recordedAt(now)
                        .build()))
                .then();
    }

    /* ===== Verification ===== */

    public boolean verify(AuditEntry entry) {
        return checksumCalculator.matches(entry);
    }

    public Mono<VerificationResult> verify(String entryId) {
        return repository.findById(entryId)
                .flatMap(entry -> {
                    Instant checkedAt = clock.instant();
                    if (verify(entry)) {
                        return Mono.just(new VerificationResult(entryId, VerificationStatus.VALID, checkedAt));
                    }
                    return handleIntegrityFailures(List.of(entry), "on-demand verification")
                            .thenReturn(new VerificationResult(entryId, VerificationStatus.INTEGRITY_FAILURE, checkedAt));
                })
                .defaultIfEmpty(new VerificationResult(entryId, VerificationStatus.NOT_FOUND, clock.instant()));
    }

    /**
     * Verifies the whole ledger. All failures found in one sweep are reported together.
     */
    public Mono<IntegrityReport> verifyAll(String trigger) {
        Instant startedAt = clock.instant();

        return repository.streamAll()
                .reduceWith(SweepTally::new, (tally, entry) -> tally.add(entry, verify(entry)))
                .flatMap(tally -> {
                    IntegrityReport report = IntegrityReport.builder()
                            .validCount(tally.valid)
                            .invalidCount(tally.invalid.size())
                            .invalidEntryIds(tally.invalid.stream().map(AuditEntry::getId).toList())
                            .checkedAt(startedAt)
                            .build();

                    log.info("Audit ledger verification ({}): {} valid, {} invalid",
                            trigger, report.getValidCount(), report.getInvalidCount());

                    if (tally.invalid.isEmpty()) {
                        return Mono.just(report);
                    }
                    return handleIntegrityFailures(tally.invalid, trigger).thenReturn(report);
                });
    }

    private Mono<Void> handleIntegrityFailures(List<AuditEntry> failures, String detectedBy) {
        Instant detectedAt = clock.instant();
        List<String> entryIds = failures.stream().map(AuditEntry::getId).toList();

        for (AuditEntry entry : failures) {
            log.error("CRITICAL: audit entry {} ({}) failed integrity verification during {}",
                    entry.getId(), entry.getChangeType(), detectedBy);
            securityLog.error("CRITICAL integrity failure entry={} changeType={} detectedBy={}",
                    entry.getId(), entry.getChangeType(), detectedBy);
            metricsService.incrementCounter("audit.integrity.failures", "trigger", detectedBy);
        }

        Mono<Void> notes = Flux.fromIterable(failures)
                .concatMap(entry -> repository.saveTamperNote(TamperNote.builder()
                                .id(UUID.randomUUID().toString())
                                .entryId(entry.getId())
                                .detectedAt(detectedAt)
                                .detectedBy(detectedBy)
                                .detail("Checksum mismatch for " + entry.getChangeType() + " entry")
                                .build())
                        .onErrorResume(e -> {
                            log.error("CRITICAL: tamper note for entry {} not written: {}", entry.getId(), e.getMessage());
                            return Mono.empty();
                        }))
                .then();

        Mono<Void> alert = policyRepository.find()
                .flatMap(policy -> notificationService.notifyIntegrityFailure(policy, entryIds, detectedAt))
                .doOnNext(outcome -> {
                    if (!outcome.isDelivered()) {
                        log.error("CRITICAL: integrity failure alert for {} was not delivered: {}",
                                entryIds, outcome.getError());
                    }
                })
                .switchIfEmpty(Mono.fromRunnable(() ->
                        log.error("CRITICAL: no security policy available to route integrity alert for {}", entryIds)))
                .onErrorResume(e -> {
                    log.error("CRITICAL: integrity alert for {} could not be sent: {}", entryIds, e.getMessage());
                    return Mono.empty();
                })
                .then();

        return notes.then(alert);
    }

    /* ===== Read-only views ===== */

    public Flux<AuditEntryView> list(ChangeType changeType, int limit) {
        return repository.findRecent(changeType, HelperUtils.clampLimit(limit))
                .collectList()
                .flatMapMany(entries -> repository.findReceipts(entries.stream().map(AuditEntry::getId).toList())
                        .flatMapMany(receipts -> Flux.fromIterable(entries)
                                .map(entry -> AuditEntryView.of(entry, receipts.get(entry.getId())))));
    }

    public Mono<AuditEntryView> view(String entryId) {
        return repository.findById(entryId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Audit entry", entryId)))
                .flatMap(entry -> repository.findReceipts(List.of(entryId))
                        .map(receipts -> AuditEntryView.of(entry, receipts.get(entryId))));
    }

    private static final class SweepTally {
        private long valid;
        private final List<AuditEntry> invalid = new ArrayList<>();

        private SweepTally add(AuditEntry entry, boolean intact) {
            if (intact) {
                valid++;
            } else {
                invalid.add(entry);
            }
            return this;
        }
    }
}
