package com.techStack.geoAccess.service.policy;

import com.techStack.geoAccess.models.policy.SecurityPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Loads the security policy once at startup. If storage is unreachable the service still starts;
 * the request path then denies with POLICY_UNAVAILABLE until a later load succeeds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyBootstrap implements ApplicationRunner {

    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final PolicyStore policyStore;

    @Override
    public void run(ApplicationArguments args) {
        try {
            SecurityPolicy policy = policyStore.initialize().block(STARTUP_TIMEOUT);
            if (policy != null) {
                log.info("🛡️ Security policy v{} loaded: allowed={}, enforcement={}",
                        policy.getVersion(), policy.getAllowedCountries(),
                        policy.isEnforcementEnabled() ? "ENABLED" : "DISABLED");
            }
        } catch (RuntimeException e) {
            log.error("❌ Security policy could not be loaded at startup, requests will be denied until it is: {}",
                    e.getMessage(), e);
        }
    }
}
