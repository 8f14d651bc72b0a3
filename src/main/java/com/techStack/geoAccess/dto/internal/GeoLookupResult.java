package com.techStack.geoAccess.dto.internal;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What the geolocation provider knows about an address. Cached as JSON in Redis.
 */
@Value
@Builder
@Jacksonized
public class GeoLookupResult {
    String countryCode;
    String countryName;
    String region;
    String city;
    String isp;
    String organization;
    Double latitude;
    Double longitude;
    boolean proxy;
    boolean vpn;
    boolean tor;
    boolean hosting;
}
