package com.techStack.geoAccess.dto.internal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class EscalationDecision {
    boolean escalated;
    @Singular
    Set<EscalationReason> reasons;
    /** Blocked attempts by the user inside the rolling window, this one included. */
    int attemptCount;
    boolean notificationDelivered;
    @Singular
    List<String> markedAttemptIds;

    public static EscalationDecision none(int attemptCount) {
        return EscalationDecision.builder().escalated(false).attemptCount(attemptCount).build();
    }
}
