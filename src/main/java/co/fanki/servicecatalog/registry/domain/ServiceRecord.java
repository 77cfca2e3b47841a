package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.dependency.domain.DependencySpec;
import co.fanki.servicecatalog.shared.Preconditions;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate root of a registered service: its current definition and the
 * status of its last validation.
 *
 * <p>Instances are not thread-safe. The registry owns the live instances
 * and only hands out copies; every state change goes through
 * {@link ServiceStateMachine}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ServiceRecord {

    private final String name;
    private ServiceDefinition definition;
    private ServiceStatus status;
    private final Instant createdAt;
    private Instant updatedAt;

    private ServiceRecord(final ServiceDefinition theDefinition,
            final ServiceStatus theStatus, final Instant theCreatedAt,
            final Instant theUpdatedAt) {
        this.definition = Preconditions.requireNonNull(theDefinition,
                "Service definition is required");
        this.name = theDefinition.name();
        this.status = theStatus;
        this.createdAt = theCreatedAt;
        this.updatedAt = theUpdatedAt;
    }

    /**
     * Creates a newly registered, not yet validated service.
     *
     * @param definition the parsed configuration
     * @return the record in {@link ServiceState#INACTIVE}
     */
    public static ServiceRecord register(final ServiceDefinition definition) {
        final Instant now = Instant.now();
        return new ServiceRecord(definition,
                ServiceStatus.of(ServiceState.INACTIVE), now, now);
    }

    /**
     * Replaces the configuration and resets the service to
     * {@link ServiceState#VALIDATING}.
     *
     * @param newDefinition the new configuration, same service name
     */
    public void updateDefinition(final ServiceDefinition newDefinition) {
        Preconditions.requireNonNull(newDefinition,
                "Service definition is required");
        Preconditions.require(name.equals(newDefinition.name()),
                "Definition belongs to service " + newDefinition.name()
                        + ", not " + name);
        this.definition = newDefinition;
        this.updatedAt = Instant.now();
        if (status.state() != ServiceState.VALIDATING) {
            ServiceStateMachine.transition(status.state(),
                    ServiceState.VALIDATING);
        }
        this.status = ServiceStatus.of(ServiceState.VALIDATING);
    }

    /**
     * Enters {@link ServiceState#VALIDATING}; a no-op when already there.
     */
    public void beginValidation() {
        if (status.state() == ServiceState.VALIDATING) {
            return;
        }
        ServiceStateMachine.transition(status.state(),
                ServiceState.VALIDATING);
        this.status = ServiceStatus.of(ServiceState.VALIDATING);
    }

    /**
     * Finishes validation successfully.
     *
     * @param warnings the advisory findings
     */
    public void markActive(final List<String> warnings) {
        ServiceStateMachine.transition(status.state(), ServiceState.ACTIVE);
        this.status = ServiceStatus.active(warnings);
    }

    /**
     * Finishes validation with a hard failure.
     *
     * @param message the failure
     * @param warnings the advisory findings
     */
    public void markError(final String message, final List<String> warnings) {
        ServiceStateMachine.transition(status.state(), ServiceState.ERROR);
        this.status = ServiceStatus.error(message, warnings);
    }

    /**
     * Returns a detached copy sharing the immutable definition.
     *
     * @return the copy
     */
    public ServiceRecord copy() {
        return new ServiceRecord(definition, status, createdAt, updatedAt);
    }

    /**
     * Takes the status of a copy validated elsewhere.
     *
     * @param validated a copy of this record
     * @return true if the status was taken, false if this record's
     *         definition changed since the copy was made
     */
    boolean adoptStatus(final ServiceRecord validated) {
        if (validated.definition != definition) {
            return false;
        }
        this.status = validated.status;
        return true;
    }

    // -- Accessors -----------------------------------------------------------

    public String name() {
        return name;
    }

    public ServiceDefinition definition() {
        return definition;
    }

    public String declaredVersion() {
        return definition.version();
    }

    public List<DependencySpec> dependencies() {
        return definition.dependencies();
    }

    public ServiceType serviceType() {
        return definition.serviceType();
    }

    public ServiceStatus status() {
        return status;
    }

    public ServiceState state() {
        return status.state();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

}
