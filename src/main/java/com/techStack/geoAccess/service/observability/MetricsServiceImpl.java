package com.techStack.geoAccess.service.observability;

import com.techStack.geoAccess.repository.metrics.MetricsService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer-backed counters and timers for the security core.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsServiceImpl implements MetricsService {

    private final MeterRegistry meterRegistry;

    @Override
    public void incrementCounter(String name, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs");
        }
        Counter.builder(name)
                .tags(tags)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordTimer(String name, Duration duration, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs");
        }
        Timer.builder(name)
                .tags(tags)
                .register(meterRegistry)
                .record(duration);
    }
}
