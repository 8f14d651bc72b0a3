package com.techStack.geoAccess.service.audit;

import com.techStack.geoAccess.dto.internal.IntegrityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic full verification of the audit ledger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntegritySweepJob {

    private static final Duration SWEEP_TIMEOUT = Duration.ofMinutes(5);

    private final TamperEvidentAuditLog auditLog;

    @Scheduled(cron = "${geo-security.audit.integrity-sweep-cron:0 0 * * * *}")
    public void sweep() {
        IntegrityReport report = auditLog.verifyAll("scheduled sweep").block(SWEEP_TIMEOUT);
        if (report != null && !report.isIntact()) {
            log.error("CRITICAL: scheduled sweep found {} tampered audit entr{}",
                    report.getInvalidCount(), report.getInvalidCount() == 1 ? "y" : "ies");
        }
    }
}
