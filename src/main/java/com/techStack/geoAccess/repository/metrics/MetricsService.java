package com.techStack.geoAccess.repository.metrics;

import java.time.Duration;

public interface MetricsService {

    void incrementCounter(String name, String... tags);

    void recordTimer(String name, Duration duration, String... tags);
}
