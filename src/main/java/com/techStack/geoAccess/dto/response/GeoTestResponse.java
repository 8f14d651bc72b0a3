package com.techStack.geoAccess.dto.response;

import com.techStack.geoAccess.models.geo.GeoRecord;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Result of an operator geolocation test: what the address resolves to and whether the current
 * policy would admit it.
 */
@Value
@Builder
public class GeoTestResponse {
    String ipAddress;
    boolean resolved;
    GeoRecord geo;
    boolean allowedByPolicy;
    Set<String> allowedCountries;
    String error;
}
