package com.techStack.geoAccess.service.security;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.EscalationReason;
import com.techStack.geoAccess.dto.internal.NotificationOutcome;
import com.techStack.geoAccess.models.attempt.AttemptType;
import com.techStack.geoAccess.models.attempt.SuspiciousAccessAttempt;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.repository.SuspiciousAttemptRepository;
import com.techStack.geoAccess.repository.metrics.MetricsService;
import com.techStack.geoAccess.service.notification.SecurityNotificationService;
import com.techStack.geoAccess.service.policy.PolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SuspiciousActivityDetectorTest {

    private static final Instant NOW = Instant.parse("2024-09-01T15:00:00Z");

    @Mock
    private SuspiciousAttemptRepository attemptRepository;

    @Mock
    private PolicyStore policyStore;

    @Mock
    private SecurityNotificationService notificationService;

    @Mock
    private MetricsService metricsService;

    @Captor
    private ArgumentCaptor<Collection<String>> idsCaptor;

    private SuspiciousActivityDetector detector;

    private final Set<String> claimedStore = new HashSet<>();

    private final SecurityPolicy policy = SecurityPolicy.builder()
            .id("active")
            .primaryCountry("US")
            .enforcementEnabled(true)
            .adminEmail("ciso@example.com")
            .securityEmail("security@example.com")
            .build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        detector = new SuspiciousActivityDetector(attemptRepository, policyStore, notificationService,
                metricsService, new GeoSecurityProperties(), Schedulers.immediate(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        when(policyStore.get()).thenReturn(Mono.just(policy));
        when(notificationService.notifyEscalation(any(), any(), anyCollection(), anyInt(), anyCollection()))
                .thenReturn(Mono.just(NotificationOutcome.delivered(2)));
        when(attemptRepository.markNotified(anyCollection(), any(), anyCollection())).thenReturn(Mono.empty());
        when(attemptRepository.releaseClaim(anyCollection())).thenAnswer(invocation -> {
            Collection<String> ids = invocation.getArgument(0);
            claimedStore.removeAll(ids);
            return Mono.empty();
        });
        when(attemptRepository.claimForEscalation(anyCollection(), any(), any())).thenAnswer(invocation -> {
            Collection<String> ids = invocation.getArgument(0);
            Set<String> claimed = new LinkedHashSet<>();
            for (String id : ids) {
                if (claimedStore.add(id)) {
                    claimed.add(id);
                }
            }
            return Mono.just(claimed);
        });
    }

    private static SuspiciousAccessAttempt blocked(String id, String country, Duration ago) {
        return SuspiciousAccessAttempt.builder()
                .id(id)
                .userId("u1")
                .countryCode(country)
                .timestamp(NOW.minus(ago))
                .attemptType(AttemptType.BLOCKED_COUNTRY)
                .wasBlocked(true)
                .build();
    }

    @Test
    void evaluate_shouldEscalateOnThirdAttempt_andMarkAllThree() {
        // Arrange
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofHours(20));
        SuspiciousAccessAttempt second = blocked("a2", "RU", Duration.ofHours(5));
        SuspiciousAccessAttempt third = blocked("a3", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.just(first, second, third));

        // Act & Assert
        StepVerifier.create(detector.evaluate(third))
                .assertNext(decision -> {
                    assertThat(decision.isEscalated()).isTrue();
                    assertThat(decision.getReasons()).containsExactly(EscalationReason.REPEATED_ATTEMPTS);
                    assertThat(decision.getAttemptCount()).isEqualTo(3);
                    assertThat(decision.isNotificationDelivered()).isTrue();
                    assertThat(decision.getMarkedAttemptIds()).containsExactlyInAnyOrder("a1", "a2", "a3");
                })
                .verifyComplete();

        verify(attemptRepository).markNotified(idsCaptor.capture(), eq(NOW), anyCollection());
        assertThat(idsCaptor.getValue()).containsExactlyInAnyOrder("a1", "a2", "a3");
        verify(metricsService).incrementCounter("geo.escalations", "reason", "REPEATED_ATTEMPTS");
    }

    @Test
    void evaluate_shouldNotEscalate_belowThreshold() {
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofHours(3));
        SuspiciousAccessAttempt second = blocked("a2", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.just(first, second));

        StepVerifier.create(detector.evaluate(second))
                .assertNext(decision -> {
                    assertThat(decision.isEscalated()).isFalse();
                    assertThat(decision.getAttemptCount()).isEqualTo(2);
                })
                .verifyComplete();

        verify(notificationService, never()).notifyEscalation(any(), any(), anyCollection(), anyInt(), anyCollection());
        verify(attemptRepository, never()).markNotified(anyCollection(), any(), anyCollection());
    }

    @Test
    void evaluate_shouldIgnoreAttemptsOutsideWindow() {
        SuspiciousAccessAttempt old = blocked("a0", "RU", Duration.ofHours(25));
        SuspiciousAccessAttempt recent = blocked("a1", "RU", Duration.ofHours(2));
        SuspiciousAccessAttempt current = blocked("a2", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.just(old, recent, current));

        StepVerifier.create(detector.evaluate(current))
                .assertNext(decision -> assertThat(decision.isEscalated()).isFalse())
                .verifyComplete();
    }

    @Test
    void evaluate_shouldNotCountAlreadyNotifiedAttempts() {
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofHours(6)).toBuilder().itNotified(true).build();
        SuspiciousAccessAttempt second = blocked("a2", "RU", Duration.ofHours(5)).toBuilder().itNotified(true).build();
        SuspiciousAccessAttempt third = blocked("a3", "RU", Duration.ofHours(4)).toBuilder().itNotified(true).build();
        SuspiciousAccessAttempt fourth = blocked("a4", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.just(first, second, third, fourth));

        StepVerifier.create(detector.evaluate(fourth))
                .assertNext(decision -> {
                    assertThat(decision.isEscalated()).isFalse();
                    assertThat(decision.getAttemptCount()).isEqualTo(4);
                })
                .verifyComplete();
    }

    @Test
    void evaluate_shouldEscalateImmediately_forAnonymizedSource() {
        SuspiciousAccessAttempt proxied = blocked("p1", "NL", Duration.ZERO).toBuilder()
                .attemptType(AttemptType.PROXY_DETECTED)
                .build();
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.empty());

        StepVerifier.create(detector.evaluate(proxied))
                .assertNext(decision -> {
                    assertThat(decision.getReasons()).containsExactly(EscalationReason.ANONYMIZER_DETECTED);
                    assertThat(decision.getMarkedAttemptIds()).containsExactly("p1");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_shouldDetectRapidCountryChanges() {
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofMinutes(40));
        SuspiciousAccessAttempt second = blocked("a2", "CN", Duration.ofMinutes(20));
        SuspiciousAccessAttempt third = blocked("a3", "BR", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.just(first, second, third));

        StepVerifier.create(detector.evaluate(third))
                .assertNext(decision -> assertThat(decision.getReasons())
                        .contains(EscalationReason.RAPID_COUNTRY_CHANGE, EscalationReason.REPEATED_ATTEMPTS))
                .verifyComplete();
    }

    @Test
    void evaluate_shouldLeaveAttemptsUnmarked_whenNoticeNotDelivered() {
        // Arrange
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofHours(2));
        SuspiciousAccessAttempt second = blocked("a2", "RU", Duration.ofHours(1));
        SuspiciousAccessAttempt third = blocked("a3", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.just(first, second, third));
        when(notificationService.notifyEscalation(any(), any(), anyCollection(), anyInt(), anyCollection()))
                .thenReturn(Mono.just(NotificationOutcome.failed(2, "SMTP unavailable")));

        // Act & Assert
        StepVerifier.create(detector.evaluate(third))
                .assertNext(decision -> {
                    assertThat(decision.isEscalated()).isTrue();
                    assertThat(decision.isNotificationDelivered()).isFalse();
                    assertThat(decision.getMarkedAttemptIds()).isEmpty();
                })
                .verifyComplete();

        verify(attemptRepository, never()).markNotified(anyCollection(), any(), anyCollection());
        verify(attemptRepository).releaseClaim(idsCaptor.capture());
        assertThat(idsCaptor.getValue()).containsExactlyInAnyOrder("a1", "a2", "a3");
        assertThat(claimedStore).isEmpty();
    }

    @Test
    void evaluate_shouldEscalateOnce_whenNextAttemptReadsStaleHistory() {
        // Arrange: both evaluations see a1..a4 as not yet notified
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofHours(3));
        SuspiciousAccessAttempt second = blocked("a2", "RU", Duration.ofHours(2));
        SuspiciousAccessAttempt third = blocked("a3", "RU", Duration.ofHours(1));
        SuspiciousAccessAttempt fourth = blocked("a4", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any()))
                .thenReturn(Flux.just(first, second, third, fourth));

        // Act & Assert
        StepVerifier.create(detector.evaluate(third))
                .assertNext(decision -> {
                    assertThat(decision.isEscalated()).isTrue();
                    assertThat(decision.getMarkedAttemptIds()).containsExactlyInAnyOrder("a1", "a2", "a3", "a4");
                })
                .verifyComplete();

        StepVerifier.create(detector.evaluate(fourth))
                .assertNext(decision -> assertThat(decision.isEscalated()).isFalse())
                .verifyComplete();

        verify(notificationService, times(1))
                .notifyEscalation(any(), any(), anyCollection(), anyInt(), anyCollection());
        verify(attemptRepository, times(1)).markNotified(anyCollection(), any(), anyCollection());
    }

    @Test
    void evaluate_shouldNotEscalate_whenConcurrentEvaluationHoldsTheHistory() {
        // Arrange
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofHours(2));
        SuspiciousAccessAttempt second = blocked("a2", "RU", Duration.ofHours(1));
        SuspiciousAccessAttempt third = blocked("a3", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(eq("u1"), any())).thenReturn(Flux.just(first, second, third));
        claimedStore.addAll(Set.of("a1", "a2"));

        // Act & Assert
        StepVerifier.create(detector.evaluate(third))
                .assertNext(decision -> {
                    assertThat(decision.isEscalated()).isFalse();
                    assertThat(decision.getAttemptCount()).isEqualTo(3);
                })
                .verifyComplete();

        verify(notificationService, never()).notifyEscalation(any(), any(), anyCollection(), anyInt(), anyCollection());
        verify(attemptRepository).releaseClaim(idsCaptor.capture());
        assertThat(idsCaptor.getValue()).containsExactly("a3");
        assertThat(claimedStore).containsExactlyInAnyOrder("a1", "a2");
    }

    @Test
    void evaluate_shouldCountCurrentAttempt_whenNotYetVisibleInHistory() {
        SuspiciousAccessAttempt first = blocked("a1", "RU", Duration.ofHours(2));
        SuspiciousAccessAttempt second = blocked("a2", "RU", Duration.ofHours(1));
        SuspiciousAccessAttempt current = blocked("a3", "RU", Duration.ZERO);
        when(attemptRepository.findByUserSince(anyString(), any())).thenReturn(Flux.just(first, second));

        StepVerifier.create(detector.evaluate(current))
                .assertNext(decision -> {
                    assertThat(decision.isEscalated()).isTrue();
                    assertThat(decision.getAttemptCount()).isEqualTo(3);
                })
                .verifyComplete();
    }
}
