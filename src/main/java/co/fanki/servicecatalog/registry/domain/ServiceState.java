package co.fanki.servicecatalog.registry.domain;

/**
 * Lifecycle state of a registered service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ServiceState {

    /** Registered, never validated. */
    INACTIVE,

    /** Configuration changed or a validation pass is running. */
    VALIDATING,

    /** Last validation passed, possibly with warnings. */
    ACTIVE,

    /** Last validation found a hard failure. */
    ERROR

}
