package io.weave.core;

import java.util.Set;

/**
 * Raised when inserting a node would make the dependency graph cyclic, or when a
 * node names itself as a dependency. The graph is left exactly as it was.
 */
public class CycleException extends WeaveException {
    private final EventId rejected;
    private final Set<EventId> dependencies;

    public CycleException(EventId rejected, Set<EventId> dependencies, String message) {
        super(message);
        this.rejected = rejected;
        this.dependencies = Set.copyOf(dependencies);
    }

    public EventId rejected() { return rejected; }

    public Set<EventId> dependencies() { return dependencies; }
}
