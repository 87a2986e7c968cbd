package com.changeguard.core.exception;

import com.changeguard.core.model.ChangeStatus;

/**
 * A requested lifecycle step is not allowed from the change's current status.
 */
public class IllegalTransitionException extends ChangeguardException {

    private final ChangeStatus from;

    public IllegalTransitionException(String changeId, ChangeStatus from, ChangeStatus to) {
        super("Change %s cannot move from %s to %s".formatted(changeId, from, to));
        this.from = from;
    }

    public IllegalTransitionException(String changeId, ChangeStatus from, String operation) {
        super("Change %s does not allow %s while %s".formatted(changeId, operation, from));
        this.from = from;
    }

    public ChangeStatus getFrom() {
        return from;
    }
}
