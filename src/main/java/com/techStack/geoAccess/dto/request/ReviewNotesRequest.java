package com.techStack.geoAccess.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reviewer notes for approvals, denials, revocations and attempt resolutions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewNotesRequest {

    @Size(max = 2000)
    private String notes;
}
