package jump.email.watch.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a watch record. Only STOPPED counts as inactive.
 */
public enum WatchState {
    PROVISIONING,
    ACTIVE,
    RENEWING,
    ERRORING,
    STOPPED;

    private static final Map<WatchState, Set<WatchState>> TRANSITIONS = new EnumMap<>(WatchState.class);

    static {
        TRANSITIONS.put(PROVISIONING, EnumSet.of(ACTIVE, ERRORING, STOPPED));
        TRANSITIONS.put(ACTIVE, EnumSet.of(RENEWING, ERRORING, STOPPED));
        TRANSITIONS.put(RENEWING, EnumSet.of(ACTIVE, ERRORING, STOPPED));
        TRANSITIONS.put(ERRORING, EnumSet.of(ACTIVE, RENEWING, ERRORING, STOPPED));
        TRANSITIONS.put(STOPPED, EnumSet.noneOf(WatchState.class));
    }

    public boolean canTransitionTo(WatchState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<WatchState> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isActive() {
        return this != STOPPED;
    }
}
