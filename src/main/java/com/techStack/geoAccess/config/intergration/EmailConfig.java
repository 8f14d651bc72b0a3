package com.techStack.geoAccess.config.intergration;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.util.validation.HelperUtils;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * The {@code JavaMailSender} itself is auto-configured from {@code spring.mail.*}; SMTP sends are
 * blocking, so they run on {@link #emailScheduler()}.
 */
@Configuration
@RequiredArgsConstructor
public class EmailConfig {
    private static final Logger log = LoggerFactory.getLogger(EmailConfig.class);

    private final GeoSecurityProperties properties;

    @Value("${spring.mail.host:}") private String host;
    @Value("${spring.mail.port:0}") private int port;

    @Bean
    public Scheduler emailScheduler() {
        return Schedulers.boundedElastic();
    }

    @PostConstruct
    public void logEmailConfiguration() {
        log.info("Security mail transport {}:{} from {}, send timeout {}",
                host, port,
                HelperUtils.maskEmail(properties.getNotifications().getFrom()),
                properties.getNotifications().getSendTimeout());
    }
}
