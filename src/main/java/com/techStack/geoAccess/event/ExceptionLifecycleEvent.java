package com.techStack.geoAccess.event;

import com.techStack.geoAccess.models.access.AccessException;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Published after an exception state change is committed.
 */
@Getter
public class ExceptionLifecycleEvent extends ApplicationEvent {

    public enum Action {
        REQUESTED,
        APPROVED,
        DENIED,
        REVOKED
    }

    private final AccessException exception;
    private final Action action;
    private final Instant eventTimestamp;

    public ExceptionLifecycleEvent(Object source, AccessException exception, Action action, Instant eventTimestamp) {
        super(source);
        this.exception = exception;
        this.action = action;
        this.eventTimestamp = eventTimestamp;
    }
}
