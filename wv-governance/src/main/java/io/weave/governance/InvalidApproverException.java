package io.weave.governance;

import io.weave.core.EventId;
import io.weave.core.WeaveException;

import java.util.Set;

/** An approval came from someone the yield does not require. */
public class InvalidApproverException extends WeaveException {
    private final EventId turnId;
    private final String approver;
    private final Set<String> requiredApprovers;

    public InvalidApproverException(EventId turnId, String approver, Set<String> requiredApprovers) {
        super("Approver '" + approver + "' is not required for " + turnId + "; required: " + requiredApprovers);
        this.turnId = turnId;
        this.approver = approver;
        this.requiredApprovers = Set.copyOf(requiredApprovers);
    }

    public EventId turnId() { return turnId; }

    public String approver() { return approver; }

    public Set<String> requiredApprovers() { return requiredApprovers; }
}
