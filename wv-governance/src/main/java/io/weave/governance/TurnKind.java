package io.weave.governance;

/** Closed set of turn kinds with the governance predicates each implies. */
public enum TurnKind {
    SPEECH, ACTION, THOUGHT, YIELD, SILENCE;

    /** Visible to other agents; thoughts stay private. */
    public boolean isObservable() {
        return switch (this) {
            case THOUGHT -> false;
            case SPEECH, ACTION, YIELD, SILENCE -> true;
        };
    }

    /** Suspends the producer until resolved. */
    public boolean isBlocking() {
        return switch (this) {
            case YIELD -> true;
            case SPEECH, ACTION, THOUGHT, SILENCE -> false;
        };
    }

    /** Changes the world outside the conversation. */
    public boolean isEffectful() {
        return switch (this) {
            case ACTION -> true;
            case SPEECH, THOUGHT, YIELD, SILENCE -> false;
        };
    }

    public boolean requiresGovernance() {
        return switch (this) {
            case ACTION, YIELD -> true;
            case SPEECH, THOUGHT, SILENCE -> false;
        };
    }
}
