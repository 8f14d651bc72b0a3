package com.techStack.geoAccess.controller.admin;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.IntegrityReport;
import com.techStack.geoAccess.dto.internal.VerificationResult;
import com.techStack.geoAccess.dto.response.ApiResponse;
import com.techStack.geoAccess.dto.response.AuditEntryView;
import com.techStack.geoAccess.exception.data.ImmutableRecordException;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.service.audit.TamperEvidentAuditLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Clock;
import java.util.List;

/**
 * Audit Ledger Controller
 *
 * Read-only access to the security policy change ledger plus integrity verification.
 * There is no write path: every modifying method answers 405.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/security/audit")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AuditLedgerController {

    private final TamperEvidentAuditLog auditLog;
    private final Clock clock;

    /* =========================
       Ledger Retrieval
       ========================= */

    @GetMapping
    public Mono<ApiResponse<List<AuditEntryView>>> list(
            @RequestParam(required = false) ChangeType changeType,
            @RequestParam(defaultValue = "" + GeoSecurityConstants.DEFAULT_LIST_LIMIT) int limit) {
        return auditLog.list(changeType, limit)
                .collectList()
                .map(entries -> ApiResponse.success(entries.size() + " audit entr" + (entries.size() == 1 ? "y" : "ies"),
                        entries, clock.instant()));
    }

    @GetMapping("/{id}")
    public Mono<ApiResponse<AuditEntryView>> get(@PathVariable String id) {
        return auditLog.view(id)
                .map(entry -> ApiResponse.success(entry, clock.instant()));
    }

    /* =========================
       Integrity
       ========================= */

    @GetMapping("/{id}/verify")
    public Mono<ApiResponse<VerificationResult>> verify(@PathVariable String id) {
        return auditLog.verify(id)
                .map(result -> ApiResponse.success(result.getStatus().name(), result, clock.instant()));
    }

    @PostMapping("/verify")
    public Mono<ApiResponse<IntegrityReport>> verifyAll(Principal principal) {
        String trigger = "manual sweep by " + (principal != null ? principal.getName() : "unknown");
        log.info("Audit integrity verification requested: {}", trigger);

        return auditLog.verifyAll(trigger)
                .map(report -> ApiResponse.success(
                        report.isIntact() ? "Ledger intact" : "INTEGRITY FAILURE: " + report.getInvalidCount()
                                + " tampered entr" + (report.getInvalidCount() == 1 ? "y" : "ies"),
                        report,
                        clock.instant()));
    }

    /* =========================
       Immutability
       ========================= */

    @RequestMapping(value = {"", "/**"}, method = {RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE})
    public Mono<ApiResponse<Void>> rejectModification() {
        return Mono.error(new ImmutableRecordException("Audit entries cannot be modified or deleted"));
    }
}
