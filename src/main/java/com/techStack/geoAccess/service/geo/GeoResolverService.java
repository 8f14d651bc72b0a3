package com.techStack.geoAccess.service.geo;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import com.techStack.geoAccess.exception.service.LookupUnavailableException;
import com.techStack.geoAccess.models.geo.GeoRecord;
import com.techStack.geoAccess.repository.GeoRecordRepository;
import com.techStack.geoAccess.repository.geo.GeoLookupProvider;
import com.techStack.geoAccess.util.validation.CountryCodes;
import com.techStack.geoAccess.util.validation.HelperUtils;
import com.techStack.geoAccess.util.validation.IpAddressUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Resolves client addresses to a {@link GeoRecord}.
 *
 * <p>Every successful resolution is also a sighting: the stored record for the address is
 * created or its access count and last-seen time are bumped. A storage failure at that step
 * does not fail the resolution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeoResolverService {

    private final GeoLookupProvider provider;
    private final GeoLookupCache cache;
    private final GeoRecordRepository repository;
    private final GeoSecurityProperties properties;
    private final Clock clock;

    public Mono<GeoRecord> resolve(String rawIpAddress) {
        String ipAddress = IpAddressUtils.normalize(rawIpAddress);
        if (!IpAddressUtils.isValid(ipAddress)) {
            return Mono.error(new LookupUnavailableException("Not an IP address: " + rawIpAddress));
        }

        Mono<GeoLookupResult> lookup = IpAddressUtils.isLocal(ipAddress)
                ? resolveLocal(ipAddress)
                : cache.get(ipAddress)
                        .switchIfEmpty(Mono.defer(() -> provider.lookup(ipAddress)
                                .flatMap(result -> cache.put(ipAddress, result).thenReturn(result))));

        return lookup.flatMap(result -> recordSighting(ipAddress, result));
    }

    private Mono<GeoLookupResult> resolveLocal(String ipAddress) {
        String country = properties.getLookup().getLocalAddressCountry();
        if (StringUtils.isBlank(country)) {
            return Mono.error(new LookupUnavailableException("Local address " + ipAddress + " has no location"));
        }
        String code = CountryCodes.normalize(country);
        return Mono.just(GeoLookupResult.builder()
                .countryCode(code)
                .countryName(CountryCodes.displayName(code))
                .city("Local network")
                .organization("Local network")
                .build());
    }

    private Mono<GeoRecord> recordSighting(String ipAddress, GeoLookupResult result) {
        Instant now = clock.instant();
        return repository.upsert(ipAddress, result, now)
                .onErrorResume(e -> {
                    log.warn("Geo record for {} not persisted, using lookup result: {}", ipAddress, e.getMessage());
                    return Mono.just(GeoRecord.fromLookup(ipAddress, result, now));
                });
    }

    /* ===== Administration ===== */

    public Flux<GeoRecord> listRecords(int limit) {
        return repository.findRecent(HelperUtils.clampLimit(limit));
    }

    /** Deletes the stored record and drops the cached lookup. Emits whether a record existed. */
    public Mono<Boolean> purge(String rawIpAddress) {
        String ipAddress = IpAddressUtils.normalize(rawIpAddress);
        return cache.evict(ipAddress)
                .then(repository.delete(ipAddress))
                .doOnNext(existed -> log.info("Geo record for {} purged (existed={})", ipAddress, existed));
    }
}
