package com.techStack.geoAccess.models.geo;

import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Geolocation of one IP address plus how often and when it has been seen.
 * The IP address is the document id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GeoRecord {

    private String ipAddress;

    private String countryCode;
    private String countryName;
    private String region;
    private String city;
    private String isp;
    private String organization;
    private Double latitude;
    private Double longitude;

    private boolean proxy;
    private boolean vpn;
    private boolean tor;
    private boolean hosting;
    private ThreatLevel threatLevel;

    private Instant firstSeen;
    private Instant lastSeen;
    private long accessCount;

    public boolean isSuspicious() {
        return proxy || vpn || tor;
    }

    public int getThreatScore() {
        return threatLevel != null ? threatLevel.getScore() : ThreatLevel.LOW.getScore();
    }

    /**
     * A record for an address that has not been persisted (first sighting or storage failure).
     */
    public static GeoRecord fromLookup(String ipAddress, GeoLookupResult result, Instant seenAt) {
        return GeoRecord.builder()
                .ipAddress(ipAddress)
                .countryCode(result.getCountryCode())
                .countryName(result.getCountryName())
                .region(result.getRegion())
                .city(result.getCity())
                .isp(result.getIsp())
                .organization(result.getOrganization())
                .latitude(result.getLatitude())
                .longitude(result.getLongitude())
                .proxy(result.isProxy())
                .vpn(result.isVpn())
                .tor(result.isTor())
                .hosting(result.isHosting())
                .threatLevel(ThreatLevel.of(result.isProxy(), result.isVpn(), result.isTor(), result.isHosting()))
                .firstSeen(seenAt)
                .lastSeen(seenAt)
                .accessCount(0)
                .build();
    }
}
