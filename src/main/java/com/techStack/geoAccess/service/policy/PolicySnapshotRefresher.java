package com.techStack.geoAccess.service.policy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class PolicySnapshotRefresher {

    private static final Duration REFRESH_TIMEOUT = Duration.ofSeconds(10);

    private final PolicyStore policyStore;

    @Scheduled(fixedDelayString = "#{@geoSecurityProperties.policy.refreshInterval.toMillis()}",
            initialDelayString = "#{@geoSecurityProperties.policy.refreshInterval.toMillis()}")
    public void refresh() {
        try {
            policyStore.refresh().block(REFRESH_TIMEOUT);
        } catch (RuntimeException e) {
            log.warn("Security policy refresh failed, keeping current snapshot: {}", e.getMessage());
        }
    }
}
