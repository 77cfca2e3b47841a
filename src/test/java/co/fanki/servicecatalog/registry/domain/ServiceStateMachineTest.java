package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.shared.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ServiceStateMachine}.
 *
 * <p>Verifies all valid transitions in the service state graph and that
 * invalid transitions are rejected with a {@link DomainException}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ServiceStateMachineTest {

    @Test
    void whenTransitioning_givenInactiveToValidating_shouldReturnValidating() {
        assertEquals(ServiceState.VALIDATING, ServiceStateMachine.transition(
                ServiceState.INACTIVE, ServiceState.VALIDATING));
    }

    @Test
    void whenTransitioning_givenValidatingToActive_shouldReturnActive() {
        assertEquals(ServiceState.ACTIVE, ServiceStateMachine.transition(
                ServiceState.VALIDATING, ServiceState.ACTIVE));
    }

    @Test
    void whenTransitioning_givenValidatingToError_shouldReturnError() {
        assertEquals(ServiceState.ERROR, ServiceStateMachine.transition(
                ServiceState.VALIDATING, ServiceState.ERROR));
    }

    @Test
    void whenTransitioning_givenActiveToValidating_shouldReturnValidating() {
        assertEquals(ServiceState.VALIDATING, ServiceStateMachine.transition(
                ServiceState.ACTIVE, ServiceState.VALIDATING));
    }

    @Test
    void whenTransitioning_givenErrorToValidating_shouldReturnValidating() {
        assertEquals(ServiceState.VALIDATING, ServiceStateMachine.transition(
                ServiceState.ERROR, ServiceState.VALIDATING));
    }

    @Test
    void whenTransitioning_givenInactiveToActive_shouldThrowDomainException() {
        final DomainException exception = assertThrows(DomainException.class,
                () -> ServiceStateMachine.transition(ServiceState.INACTIVE,
                        ServiceState.ACTIVE));
        assertEquals("SERVICE_INVALID_TRANSITION", exception.getErrorCode());
        assertEquals("Invalid transition: INACTIVE → ACTIVE",
                exception.getMessage());
    }

    @Test
    void whenTransitioning_givenActiveToError_shouldThrowDomainException() {
        assertThrows(DomainException.class,
                () -> ServiceStateMachine.transition(ServiceState.ACTIVE,
                        ServiceState.ERROR));
    }

    @Test
    void whenTransitioning_givenValidatingToValidating_shouldThrowDomainException() {
        assertThrows(DomainException.class,
                () -> ServiceStateMachine.transition(ServiceState.VALIDATING,
                        ServiceState.VALIDATING));
    }

    @Test
    void whenTransitioning_givenNullState_shouldThrowNullPointerException() {
        assertThrows(NullPointerException.class,
                () -> ServiceStateMachine.transition(null,
                        ServiceState.ACTIVE));
    }

    @Test
    void whenCheckingTransition_givenAnyPair_shouldNotThrow() {
        assertTrue(ServiceStateMachine.canTransition(ServiceState.ERROR,
                ServiceState.VALIDATING));
        assertFalse(ServiceStateMachine.canTransition(ServiceState.ERROR,
                ServiceState.ACTIVE));
        assertFalse(ServiceStateMachine.canTransition(null,
                ServiceState.ACTIVE));
    }

}
