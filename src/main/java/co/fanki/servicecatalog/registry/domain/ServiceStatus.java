package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.shared.Preconditions;

import java.time.Instant;
import java.util.List;

/**
 * Immutable status of a service at a point in time.
 *
 * @param state the lifecycle state
 * @param errorMessage the hard failure, only set in {@link ServiceState#ERROR}
 * @param warnings advisory findings of the last validation
 * @param lastChecked when the status was produced
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ServiceStatus(ServiceState state, String errorMessage,
        List<String> warnings, Instant lastChecked) {

    /**
     * Validates and freezes the status.
     */
    public ServiceStatus {
        Preconditions.requireNonNull(state, "State is required");
        Preconditions.requireNonNull(lastChecked, "Timestamp is required");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Creates a status without error or warnings.
     *
     * @param state the state
     * @return the status, stamped now
     */
    public static ServiceStatus of(final ServiceState state) {
        return new ServiceStatus(state, null, List.of(), Instant.now());
    }

    /**
     * Creates an active status.
     *
     * @param warnings the advisory findings
     * @return the status, stamped now
     */
    public static ServiceStatus active(final List<String> warnings) {
        return new ServiceStatus(ServiceState.ACTIVE, null, warnings,
                Instant.now());
    }

    /**
     * Creates an error status.
     *
     * @param message the hard failure
     * @param warnings the advisory findings
     * @return the status, stamped now
     */
    public static ServiceStatus error(final String message,
            final List<String> warnings) {
        Preconditions.requireNonBlank(message, "Error message is required");
        return new ServiceStatus(ServiceState.ERROR, message, warnings,
                Instant.now());
    }

    /** Checks whether the status carries warnings. */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

}
