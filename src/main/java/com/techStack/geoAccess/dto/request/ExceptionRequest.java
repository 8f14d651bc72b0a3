package com.techStack.geoAccess.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExceptionRequest {

    @NotBlank
    @Size(min = 2, max = 2)
    private String destinationCountry;

    /** Defaults to now. */
    private Instant startsAt;

    @NotNull
    private Instant endsAt;

    @NotBlank
    @Size(max = 2000)
    private String reason;

    @Email
    private String contactEmail;
}
