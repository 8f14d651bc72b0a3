package com.techStack.geoAccess.service.policy;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.AuditEntryDraft;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import com.techStack.geoAccess.dto.internal.PolicyUpdateResult;
import com.techStack.geoAccess.dto.internal.RequestContext;
import com.techStack.geoAccess.dto.request.PolicyUpdateRequest;
import com.techStack.geoAccess.exception.service.PolicyUnavailableException;
import com.techStack.geoAccess.exception.state.ConflictException;
import com.techStack.geoAccess.exception.validation.ValidationException;
import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.repository.PolicyRepository;
import com.techStack.geoAccess.service.audit.TamperEvidentAuditLog;
import com.techStack.geoAccess.service.notification.SecurityNotificationService;
import com.techStack.geoAccess.util.validation.CountryCodes;
import com.techStack.geoAccess.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the single security policy.
 *
 * <p>Holds the current policy as an immutable snapshot that the request path reads without
 * locking. The snapshot is loaded once at startup ({@link PolicyBootstrap}), replaced after every
 * committed update and refreshed periodically to pick up writes from other instances.
 *
 * <p>Updates are committed together with one audit entry per changed field in a single
 * transaction guarded by the policy version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyStore {

    private static final Logger securityLog = LoggerFactory.getLogger(GeoSecurityConstants.SECURITY_AUDIT_LOGGER);

    private final PolicyRepository repository;
    private final TamperEvidentAuditLog auditLog;
    private final PolicyValidator validator;
    private final SecurityNotificationService notificationService;
    private final GeoSecurityProperties properties;
    private final Clock clock;

    private final AtomicReference<SecurityPolicy> snapshot = new AtomicReference<>();

    /* ===== Loading ===== */

    /**
     * Loads the stored policy, creating the default disabled-enforcement policy if none exists.
     * Safe to call concurrently and repeatedly: a losing creator re-reads the winner's policy.
     */
    public Mono<SecurityPolicy> initialize() {
        return repository.find()
                .switchIfEmpty(Mono.defer(this::createDefault))
                .doOnNext(this::swap);
    }

    public Mono<SecurityPolicy> get() {
        SecurityPolicy current = snapshot.get();
        if (current != null) {
            return Mono.just(current);
        }
        return initialize()
                .onErrorMap(e -> !(e instanceof PolicyUnavailableException),
                        e -> new PolicyUnavailableException("Security policy could not be loaded", e));
    }

    public Mono<SecurityPolicy> refresh() {
        return repository.find()
                .doOnNext(this::swap);
    }

    private Mono<SecurityPolicy> createDefault() {
        Instant now = clock.instant();
        SecurityPolicy initial = SecurityPolicy.builder()
                .id(GeoSecurityConstants.ACTIVE_POLICY_DOC_ID)
                .version(1)
                .primaryCountry(CountryCodes.normalize(properties.getPolicy().getDefaultPrimaryCountry()))
                .enforcementEnabled(false)
                .setupCompleted(false)
                .createdAt(now)
                .updatedAt(now)
                .build();

        AuditEntry initEntry = auditLog.seal(AuditEntryDraft.builder()
                .changeType(ChangeType.POLICY_INITIALIZED)
                .newValue("primaryCountry=" + initial.getPrimaryCountry() + ";enforcementEnabled=false")
                .justification("Default policy created at first start")
                .build());

        return repository.createInitial(initial, initEntry)
                .doOnNext(created -> log.info("🛡️ Default security policy created (primary={}, enforcement disabled)",
                        created.getPrimaryCountry()))
                .onErrorResume(ConflictException.class, e -> {
                    log.info("Security policy was created concurrently, loading it");
                    return repository.find();
                });
    }

    /** Never moves the snapshot to an older version. */
    private void swap(SecurityPolicy policy) {
        snapshot.accumulateAndGet(policy, (previous, next) ->
                previous == null || next.getVersion() >= previous.getVersion() ? next : previous);
    }

    /* ===== Updating ===== */

    public Mono<PolicyUpdateResult> update(PolicyUpdateRequest request, String actor, RequestContext context) {
        return get().flatMap(current -> {
            SecurityPolicy candidate = applyChanges(current, request);
            List<AuditEntryDraft> changes = diff(current, candidate, request.getJustification(), actor, context);

            Map<String, String> errors = validator.validate(candidate, changes, request.getJustification());
            if (!errors.isEmpty()) {
                log.warn("Policy update by {} rejected: {}", actor, errors);
                return Mono.error(new ValidationException("Security policy update rejected", errors));
            }

            if (changes.isEmpty()) {
                return Mono.just(PolicyUpdateResult.builder().policy(current).changed(false).build());
            }

            Instant now = clock.instant();
            List<AuditEntry> entries = changes.stream().map(auditLog::seal).toList();
            SecurityPolicy next = stamp(current, candidate, changes, actor, now);

            return repository.commitUpdate(current.getVersion(), next, entries)
                    .doOnNext(committed -> {
                        swap(committed);
                        entries.forEach(entry -> securityLog.info(
                                "Policy change {} {}: '{}' -> '{}' by {} from {}",
                                entry.getId(), entry.getChangeType(), entry.getOldValue(), entry.getNewValue(),
                                actor, context.getIpAddress()));
                        log.info("🛡️ Security policy updated to version {} ({} change(s)) by {}",
                                committed.getVersion(), entries.size(), actor);
                    })
                    .flatMap(committed -> notifyLeadership(committed, entries));
        });
    }

    private Mono<PolicyUpdateResult> notifyLeadership(SecurityPolicy committed, List<AuditEntry> entries) {
        List<AuditEntry> noticeEntries = entries.stream()
                .filter(entry -> entry.getChangeType().requiresLeadershipNotice())
                .toList();

        PolicyUpdateResult.PolicyUpdateResultBuilder result = PolicyUpdateResult.builder()
                .policy(committed)
                .entries(entries)
                .changed(true);

        if (noticeEntries.isEmpty()) {
            return Mono.just(result.build());
        }

        return notificationService.notifyPolicyChange(committed, noticeEntries)
                .onErrorResume(e -> Mono.just(NotificationOutcome.failed(0, e.getMessage())))
                .flatMap(outcome -> {
                    if (!outcome.isDelivered()) {
                        log.warn("Leadership was not notified of policy version {}: {}",
                                committed.getVersion(), outcome.getError());
                        result.warning("Leadership notification failed: " + outcome.getError());
                    }
                    return auditLog.recordNotification(noticeEntries, outcome)
                            .onErrorResume(e -> {
                                log.warn("Notification receipt for policy version {} not recorded: {}",
                                        committed.getVersion(), e.getMessage());
                                result.warning("Notification outcome could not be recorded");
                                return Mono.empty();
                            })
                            .then(Mono.fromSupplier(result::build));
                });
    }

    /* ===== Change computation ===== */

    private SecurityPolicy applyChanges(SecurityPolicy current, PolicyUpdateRequest request) {
        SecurityPolicy.SecurityPolicyBuilder builder = current.toBuilder();

        if (request.getDepartmentName() != null) {
            builder.departmentName(StringUtils.trimToNull(request.getDepartmentName()));
        }
        if (request.getDepartmentAbbreviation() != null) {
            builder.departmentAbbreviation(StringUtils.trimToNull(request.getDepartmentAbbreviation()));
        }
        if (request.getTimezone() != null) {
            builder.timezone(StringUtils.trimToNull(request.getTimezone()));
        }
        if (request.getPrimaryCountry() != null) {
            builder.primaryCountry(CountryCodes.normalize(request.getPrimaryCountry()));
        }
        if (Boolean.TRUE.equals(request.getClearSecondaryCountry())) {
            builder.secondaryCountry(null);
        } else if (request.getSecondaryCountry() != null) {
            builder.secondaryCountry(StringUtils.isBlank(request.getSecondaryCountry())
                    ? null : CountryCodes.normalize(request.getSecondaryCountry()));
        }
        if (request.getEnforcementEnabled() != null) {
            builder.enforcementEnabled(request.getEnforcementEnabled());
        }
        if (request.getAdminEmail() != null) {
            builder.adminEmail(StringUtils.trimToNull(request.getAdminEmail()));
        }
        if (request.getItEmail() != null) {
            builder.itEmail(StringUtils.trimToNull(request.getItEmail()));
        }
        if (request.getSecurityEmail() != null) {
            builder.securityEmail(StringUtils.trimToNull(request.getSecurityEmail()));
        }
        return builder.build();
    }

    private List<AuditEntryDraft> diff(SecurityPolicy current, SecurityPolicy candidate,
                                       String justification, String actor, RequestContext context) {
        List<AuditEntryDraft> changes = new ArrayList<>();
        ChangeCollector collector = new ChangeCollector(changes, StringUtils.trimToNull(justification), actor, context);

        collector.compare(ChangeType.PRIMARY_COUNTRY, current.getPrimaryCountry(), candidate.getPrimaryCountry());
        collector.compare(ChangeType.SECONDARY_COUNTRY, current.getSecondaryCountry(), candidate.getSecondaryCountry());
        collector.compare(ChangeType.ENFORCEMENT_TOGGLE,
                String.valueOf(current.isEnforcementEnabled()), String.valueOf(candidate.isEnforcementEnabled()));
        collector.compare(ChangeType.DEPARTMENT_NAME, current.getDepartmentName(), candidate.getDepartmentName());
        collector.compare(ChangeType.DEPARTMENT_ABBREVIATION,
                current.getDepartmentAbbreviation(), candidate.getDepartmentAbbreviation());
        collector.compare(ChangeType.TIMEZONE, current.getTimezone(), candidate.getTimezone());
        collector.compare(ChangeType.ADMIN_CONTACT, current.getAdminEmail(), candidate.getAdminEmail());
        collector.compare(ChangeType.IT_CONTACT, current.getItEmail(), candidate.getItEmail());
        collector.compare(ChangeType.SECURITY_CONTACT, current.getSecurityEmail(), candidate.getSecurityEmail());
        return changes;
    }

    private SecurityPolicy stamp(SecurityPolicy current, SecurityPolicy candidate,
                                 List<AuditEntryDraft> changes, String actor, Instant now) {
        SecurityPolicy.SecurityPolicyBuilder builder = candidate.toBuilder()
                .version(current.getVersion() + 1)
                .updatedAt(now)
                .updatedBy(actor);

        for (AuditEntryDraft change : changes) {
            if (change.getChangeType() == ChangeType.PRIMARY_COUNTRY) {
                builder.previousPrimaryCountry(current.getPrimaryCountry())
                        .primaryCountryChangedAt(now)
                        .primaryCountryChangedBy(actor);
            } else if (change.getChangeType() == ChangeType.SECONDARY_COUNTRY) {
                builder.previousSecondaryCountry(current.getSecondaryCountry())
                        .secondaryCountryChangedAt(now)
                        .secondaryCountryChangedBy(actor);
            }
        }

        if (!current.isSetupCompleted()) {
            builder.setupCompleted(true)
                    .setupCompletedBy(actor)
                    .setupCompletedAt(now);
        }
        return builder.build();
    }

    /**
     * Collects one draft per changed field. Contact addresses are recorded masked.
     */
    private record ChangeCollector(List<AuditEntryDraft> changes, String justification,
                                   String actor, RequestContext context) {

        void compare(ChangeType type, String oldValue, String newValue) {
            if (Objects.equals(oldValue, newValue)) {
                return;
            }
            boolean contact = type == ChangeType.ADMIN_CONTACT
                    || type == ChangeType.IT_CONTACT
                    || type == ChangeType.SECURITY_CONTACT;
            changes.add(AuditEntryDraft.builder()
                    .changeType(type)
                    .oldValue(contact && oldValue != null ? HelperUtils.maskEmail(oldValue) : oldValue)
                    .newValue(contact && newValue != null ? HelperUtils.maskEmail(newValue) : newValue)
                    .justification(justification)
                    .actor(actor)
                    .requestIp(context.getIpAddress())
                    .userAgent(context.getUserAgent())
                    .build());
        }
    }
}
