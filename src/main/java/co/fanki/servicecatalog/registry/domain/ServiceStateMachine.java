package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes the valid service state transitions.
 *
 * <pre>
 *   INACTIVE   → VALIDATING
 *   VALIDATING → ACTIVE, ERROR
 *   ACTIVE     → VALIDATING
 *   ERROR      → VALIDATING
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ServiceStateMachine {

    private static final Map<ServiceState, Set<ServiceState>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(ServiceState.class);
        TRANSITIONS.put(ServiceState.INACTIVE,   EnumSet.of(ServiceState.VALIDATING));
        TRANSITIONS.put(ServiceState.VALIDATING, EnumSet.of(ServiceState.ACTIVE, ServiceState.ERROR));
        TRANSITIONS.put(ServiceState.ACTIVE,     EnumSet.of(ServiceState.VALIDATING));
        TRANSITIONS.put(ServiceState.ERROR,      EnumSet.of(ServiceState.VALIDATING));
    }

    private ServiceStateMachine() {
    }

    /**
     * Validates a transition and returns the target state.
     *
     * @param from the current state
     * @param to the desired state
     * @return {@code to} when the transition is valid
     * @throws DomainException with code {@code SERVICE_INVALID_TRANSITION}
     *         when the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static ServiceState transition(final ServiceState from,
            final ServiceState to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        final Set<ServiceState> allowed = TRANSITIONS.getOrDefault(from,
                EnumSet.noneOf(ServiceState.class));
        if (!allowed.contains(to)) {
            throw new DomainException(
                    "Invalid transition: " + from + " → " + to,
                    "SERVICE_INVALID_TRANSITION");
        }
        return to;
    }

    /**
     * Checks a transition without throwing.
     *
     * @param from the current state
     * @param to the desired state
     * @return true if the transition is permitted
     */
    public static boolean canTransition(final ServiceState from,
            final ServiceState to) {
        return from != null && to != null
                && TRANSITIONS.getOrDefault(from,
                        EnumSet.noneOf(ServiceState.class)).contains(to);
    }

}
