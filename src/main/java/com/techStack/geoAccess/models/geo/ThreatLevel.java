package com.techStack.geoAccess.models.geo;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ThreatLevel {
    LOW(10),
    MEDIUM(40),
    HIGH(70),
    CRITICAL(95);

    private final int score;

    /**
     * Tor outranks any other anonymiser; hosting ranges alone are only a weak signal.
     */
    public static ThreatLevel of(boolean proxy, boolean vpn, boolean tor, boolean hosting) {
        if (tor) {
            return CRITICAL;
        }
        if (proxy || vpn) {
            return HIGH;
        }
        if (hosting) {
            return MEDIUM;
        }
        return LOW;
    }
}
