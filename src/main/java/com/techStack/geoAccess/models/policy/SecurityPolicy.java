package com.techStack.geoAccess.models.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The single security configuration record. Instances are immutable snapshots; every committed
 * change produces a new snapshot with a higher {@code version}.
 */
@Value
@Builder(toBuilder = true)
public class SecurityPolicy {

    String id;
    long version;

    String departmentName;
    String departmentAbbreviation;
    String timezone;

    String primaryCountry;
    String secondaryCountry;
    boolean enforcementEnabled;

    String adminEmail;
    String itEmail;
    String securityEmail;

    boolean setupCompleted;
    String setupCompletedBy;
    Instant setupCompletedAt;

    // Quick-glance history; the audit ledger is authoritative
    String previousPrimaryCountry;
    String previousSecondaryCountry;
    Instant primaryCountryChangedAt;
    String primaryCountryChangedBy;
    Instant secondaryCountryChangedAt;
    String secondaryCountryChangedBy;

    Instant createdAt;
    Instant updatedAt;
    String updatedBy;

    /**
     * Primary and secondary form an unordered set.
     */
    public Set<String> getAllowedCountries() {
        Set<String> allowed = new LinkedHashSet<>();
        if (StringUtils.isNotBlank(primaryCountry)) {
            allowed.add(primaryCountry);
        }
        if (StringUtils.isNotBlank(secondaryCountry)) {
            allowed.add(secondaryCountry);
        }
        return allowed;
    }

    public boolean isCountryAllowed(String countryCode) {
        return countryCode != null && getAllowedCountries().contains(countryCode.toUpperCase());
    }

    /** Audience for policy changes and escalations. */
    @JsonIgnore
    public List<String> getLeadershipRecipients() {
        return recipients(adminEmail, securityEmail);
    }

    /** Audience for integrity failures. */
    @JsonIgnore
    public List<String> getIntegrityRecipients() {
        return recipients(itEmail, securityEmail);
    }

    @JsonIgnore
    public List<String> getItRecipients() {
        return recipients(itEmail);
    }

    private static List<String> recipients(String... addresses) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String address : addresses) {
            if (StringUtils.isNotBlank(address)) {
                distinct.add(address.trim());
            }
        }
        return new ArrayList<>(distinct);
    }
}
