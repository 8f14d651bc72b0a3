package com.techStack.geoAccess.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial policy change. A null field leaves the stored value unchanged; the secondary country
 * is removed with {@code clearSecondaryCountry}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyUpdateRequest {

    @Size(max = 200)
    private String departmentName;

    @Size(max = 20)
    private String departmentAbbreviation;

    @Size(max = 64)
    private String timezone;

    @Size(min = 2, max = 2)
    private String primaryCountry;

    @Size(min = 2, max = 2)
    private String secondaryCountry;

    private Boolean clearSecondaryCountry;

    private Boolean enforcementEnabled;

    private String adminEmail;
    private String itEmail;
    private String securityEmail;

    @Size(max = 2000)
    private String justification;
}
