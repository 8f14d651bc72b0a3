package com.techStack.geoAccess.repository.geo;

import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import reactor.core.publisher.Mono;

/**
 * External source of IP geolocation. Implementations fail with
 * {@link com.techStack.geoAccess.exception.service.LookupUnavailableException}; they never
 * return an empty result for a failed lookup.
 */
public interface GeoLookupProvider {

    Mono<GeoLookupResult> lookup(String ipAddress);
}
