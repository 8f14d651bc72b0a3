package com.techStack.geoAccess.util.firebase;

import com.techStack.geoAccess.models.policy.SecurityPolicy;

import java.util.HashMap;
import java.util.Map;

import static com.techStack.geoAccess.util.firebase.FirestoreFields.*;

public final class PolicyDocumentMapper {

    private PolicyDocumentMapper() {}

    public static Map<String, Object> toMap(SecurityPolicy policy) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", policy.getId());
        data.put("version", policy.getVersion());
        data.put("departmentName", policy.getDepartmentName());
        data.put("departmentAbbreviation", policy.getDepartmentAbbreviation());
        data.put("timezone", policy.getTimezone());
        data.put("primaryCountry", policy.getPrimaryCountry());
        data.put("secondaryCountry", policy.getSecondaryCountry());
        data.put("enforcementEnabled", policy.isEnforcementEnabled());
        data.put("adminEmail", policy.getAdminEmail());
        data.put("itEmail", policy.getItEmail());
        data.put("securityEmail", policy.getSecurityEmail());
        data.put("setupCompleted", policy.isSetupCompleted());
        data.put("setupCompletedBy", policy.getSetupCompletedBy());
        putTimestamp(data, "setupCompletedAt", policy.getSetupCompletedAt());
        data.put("previousPrimaryCountry", policy.getPreviousPrimaryCountry());
        data.put("previousSecondaryCountry", policy.getPreviousSecondaryCountry());
        putTimestamp(data, "primaryCountryChangedAt", policy.getPrimaryCountryChangedAt());
        data.put("primaryCountryChangedBy", policy.getPrimaryCountryChangedBy());
        putTimestamp(data, "secondaryCountryChangedAt", policy.getSecondaryCountryChangedAt());
        data.put("secondaryCountryChangedBy", policy.getSecondaryCountryChangedBy());
        putTimestamp(data, "createdAt", policy.getCreatedAt());
        putTimestamp(data, "updatedAt", policy.getUpdatedAt());
        data.put("updatedBy", policy.getUpdatedBy());
        return data;
    }

    public static SecurityPolicy fromMap(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        return SecurityPolicy.builder()
                .id(getString(data, "id"))
                .version(getLong(data, "version"))
                .departmentName(getString(data, "departmentName"))
                .departmentAbbreviation(getString(data, "departmentAbbreviation"))
                .timezone(getString(data, "timezone"))
                .primaryCountry(getString(data, "primaryCountry"))
                .secondaryCountry(getString(data, "secondaryCountry"))
                .enforcementEnabled(getBoolean(data, "enforcementEnabled"))
                .adminEmail(getString(data, "adminEmail"))
                .itEmail(getString(data, "itEmail"))
                .securityEmail(getString(data, "securityEmail"))
                .setupCompleted(getBoolean(data, "setupCompleted"))
                .setupCompletedBy(getString(data, "setupCompletedBy"))
                .setupCompletedAt(getInstant(data, "setupCompletedAt"))
                .previousPrimaryCountry(getString(data, "previousPrimaryCountry"))
                .previousSecondaryCountry(getString(data, "previousSecondaryCountry"))
                .primaryCountryChangedAt(getInstant(data, "primaryCountryChangedAt"))
                .primaryCountryChangedBy(getString(data, "primaryCountryChangedBy"))
                .secondaryCountryChangedAt(getInstant(data, "secondaryCountryChangedAt"))
                .secondaryCountryChangedBy(getString(data, "secondaryCountryChangedBy"))
                .createdAt(getInstant(data, "createdAt"))
                .updatedAt(getInstant(data, "updatedAt"))
                .updatedBy(getString(data, "updatedBy"))
                .build();
    }
}
