package com.techStack.geoAccess.dto.internal;

import com.techStack.geoAccess.models.access.AccessException;
import lombok.Value;

/**
 * Result of a conditional exception write.
 *
 * {@code applied} is false when the guard rejected the stored state; {@code exception} is then
 * the stored state, already rewritten to EXPIRED if the guard run found a stale approval.
 */
@Value
public class TransitionOutcome {
    AccessException exception;
    boolean applied;
}
