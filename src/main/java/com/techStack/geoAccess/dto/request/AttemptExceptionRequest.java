package com.techStack.geoAccess.dto.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttemptExceptionRequest {

    @Size(max = 2000)
    private String reason;

    /** Window length; the configured default when absent. */
    @Positive
    private Integer durationDays;
}
