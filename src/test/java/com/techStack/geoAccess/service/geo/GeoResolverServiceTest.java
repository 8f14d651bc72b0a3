package com.techStack.geoAccess.service.geo;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import com.techStack.geoAccess.exception.service.LookupUnavailableException;
import com.techStack.geoAccess.models.geo.GeoRecord;
import com.techStack.geoAccess.models.geo.ThreatLevel;
import com.techStack.geoAccess.repository.GeoRecordRepository;
import com.techStack.geoAccess.repository.geo.GeoLookupProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

class GeoResolverServiceTest {

    private static final Instant NOW = Instant.parse("2024-10-01T10:00:00Z");

    @Mock
    private GeoLookupProvider provider;

    @Mock
    private GeoLookupCache cache;

    @Mock
    private GeoRecordRepository repository;

    private GeoSecurityProperties properties;
    private GeoResolverService resolver;

    private final GeoLookupResult germany = GeoLookupResult.builder()
            .countryCode("DE")
            .countryName("Germany")
            .city("Berlin")
            .isp("Example ISP")
            .build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new GeoSecurityProperties();
        resolver = new GeoResolverService(provider, cache, repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        when(cache.get(anyString())).thenReturn(Mono.empty());
        when(cache.put(anyString(), any())).thenReturn(Mono.empty());
        when(repository.upsert(anyString(), any(), any())).thenAnswer(invocation ->
                Mono.just(GeoRecord.fromLookup(invocation.getArgument(0), invocation.getArgument(1), NOW)
                        .toBuilder().accessCount(1).build()));
    }

    @Test
    void resolve_shouldQueryProviderAndCache_onMiss() {
        // Arrange
        when(provider.lookup("85.214.132.117")).thenReturn(Mono.just(germany));

        // Act & Assert
        StepVerifier.create(resolver.resolve(" 85.214.132.117 "))
                .assertNext(record -> {
                    assertThat(record.getIpAddress()).isEqualTo("85.214.132.117");
                    assertThat(record.getCountryCode()).isEqualTo("DE");
                    assertThat(record.getThreatLevel()).isEqualTo(ThreatLevel.LOW);
                    assertThat(record.getAccessCount()).isEqualTo(1);
                })
                .verifyComplete();

        verify(cache).put("85.214.132.117", germany);
        verify(repository).upsert("85.214.132.117", germany, NOW);
    }

    @Test
    void resolve_shouldUseCachedResult_withoutProviderCall() {
        when(cache.get("85.214.132.117")).thenReturn(Mono.just(germany));

        StepVerifier.create(resolver.resolve("85.214.132.117"))
                .assertNext(record -> assertThat(record.getCountryCode()).isEqualTo("DE"))
                .verifyComplete();

        verify(provider, never()).lookup(anyString());
        verify(repository).upsert(eq("85.214.132.117"), eq(germany), eq(NOW));
    }

    @Test
    void resolve_shouldPropagateProviderFailure() {
        when(provider.lookup("85.214.132.117"))
                .thenReturn(Mono.error(new LookupUnavailableException("Geolocation lookup timed out")));

        StepVerifier.create(resolver.resolve("85.214.132.117"))
                .expectError(LookupUnavailableException.class)
                .verify();

        verify(repository, never()).upsert(anyString(), any(), any());
    }

    @Test
    void resolve_shouldRejectNonAddress_withoutProviderCall() {
        StepVerifier.create(resolver.resolve("example.com"))
                .expectError(LookupUnavailableException.class)
                .verify();

        verify(provider, never()).lookup(anyString());
    }

    @Test
    void resolve_shouldFailForLocalAddress_whenNoLocalCountryConfigured() {
        StepVerifier.create(resolver.resolve("127.0.0.1"))
                .expectError(LookupUnavailableException.class)
                .verify();

        verify(provider, never()).lookup(anyString());
    }

    @Test
    void resolve_shouldMapLocalAddress_toConfiguredCountry() {
        properties.getLookup().setLocalAddressCountry("us");

        StepVerifier.create(resolver.resolve("10.1.2.3"))
                .assertNext(record -> {
                    assertThat(record.getCountryCode()).isEqualTo("US");
                    assertThat(record.getCountryName()).isEqualTo("United States");
                })
                .verifyComplete();

        verify(provider, never()).lookup(anyString());
    }

    @Test
    void resolve_shouldReturnLookup_whenRecordCannotBeStored() {
        when(provider.lookup("85.214.132.117")).thenReturn(Mono.just(germany));
        doReturn(Mono.error(new IllegalStateException("down"))).when(repository).upsert(anyString(), any(), any());

        StepVerifier.create(resolver.resolve("85.214.132.117"))
                .assertNext(record -> {
                    assertThat(record.getCountryCode()).isEqualTo("DE");
                    assertThat(record.getFirstSeen()).isEqualTo(NOW);
                })
                .verifyComplete();
    }

    @Test
    void purge_shouldEvictCacheAndDeleteRecord() {
        when(cache.evict("85.214.132.117")).thenReturn(Mono.empty());
        when(repository.delete("85.214.132.117")).thenReturn(Mono.just(true));

        StepVerifier.create(resolver.purge("85.214.132.117"))
                .expectNext(true)
                .verifyComplete();

        verify(cache).evict("85.214.132.117");
    }
}
