package com.techStack.geoAccess.service.access;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExceptionExpirySweep {

    private static final Duration SWEEP_TIMEOUT = Duration.ofMinutes(2);

    private final ExceptionManager exceptionManager;

    @Scheduled(fixedDelayString = "#{@geoSecurityProperties.exceptions.expirySweepInterval.toMillis()}",
            initialDelayString = "#{@geoSecurityProperties.exceptions.expirySweepInterval.toMillis()}")
    public void sweep() {
        try {
            Long expired = exceptionManager.expireOverdue().block(SWEEP_TIMEOUT);
            if (expired != null && expired > 0) {
                log.info("⏰ Marked {} overdue access exception(s) EXPIRED", expired);
            }
        } catch (RuntimeException e) {
            log.error("❌ Exception expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
