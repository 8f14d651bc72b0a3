package com.techStack.geoAccess.service.policy;

import com.techStack.geoAccess.dto.internal.AuditEntryDraft;
import com.techStack.geoAccess.models.policy.SecurityPolicy;
import com.techStack.geoAccess.util.validation.CountryCodes;
import com.techStack.geoAccess.util.validation.HelperUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules a policy must satisfy before it can be committed. Returns field errors; an empty map
 * means the candidate is acceptable.
 */
@Component
public class PolicyValidator {

    public Map<String, String> validate(SecurityPolicy candidate, List<AuditEntryDraft> changes, String justification) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (!CountryCodes.isValid(candidate.getPrimaryCountry())) {
            errors.put("primaryCountry", "Primary country must be an ISO 3166-1 alpha-2 code");
        }

        String secondary = candidate.getSecondaryCountry();
        if (secondary != null) {
            if (!CountryCodes.isValid(secondary)) {
                errors.put("secondaryCountry", "Secondary country must be an ISO 3166-1 alpha-2 code");
            } else if (secondary.equals(candidate.getPrimaryCountry())) {
                errors.put("secondaryCountry", "Secondary country must differ from the primary country");
            }
        }

        checkEmail(errors, "adminEmail", candidate.getAdminEmail());
        checkEmail(errors, "itEmail", candidate.getItEmail());
        checkEmail(errors, "securityEmail", candidate.getSecurityEmail());

        if (candidate.isEnforcementEnabled()) {
            if (StringUtils.isBlank(candidate.getItEmail())) {
                errors.putIfAbsent("itEmail", "IT contact is required while geo-enforcement is enabled");
            }
            if (StringUtils.isBlank(candidate.getSecurityEmail())) {
                errors.putIfAbsent("securityEmail", "Security contact is required while geo-enforcement is enabled");
            }
        }

        if (StringUtils.isNotBlank(candidate.getTimezone())) {
            try {
                ZoneId.of(candidate.getTimezone());
            } catch (DateTimeException e) {
                errors.put("timezone", "Unknown timezone: " + candidate.getTimezone());
            }
        }

        boolean countryChanged = changes.stream().anyMatch(change -> change.getChangeType().isCountryChange());
        if (countryChanged && StringUtils.isBlank(justification)) {
            errors.put("justification", "A justification is required when an allowed country changes");
        }

        return errors;
    }

    private static void checkEmail(Map<String, String> errors, String field, String value) {
        if (StringUtils.isNotBlank(value) && !HelperUtils.isValidEmail(value)) {
            errors.put(field, "Invalid email address");
        }
    }
}
