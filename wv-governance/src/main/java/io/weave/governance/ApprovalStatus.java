package io.weave.governance;

public enum ApprovalStatus {
    PENDING, APPROVED, REJECTED, TIMEOUT;

    public boolean isTerminal() { return this != PENDING; }
}
