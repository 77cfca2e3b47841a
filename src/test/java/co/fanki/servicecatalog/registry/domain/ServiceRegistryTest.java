package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ServiceRegistry}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ServiceRegistryTest {

    private ServiceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
    }

    private static ServiceDefinition definition(final String name) {
        return ServiceDefinition.of(name, "1.0.0", List.of());
    }

    @Test
    void whenRegistering_givenNewService_shouldStoreItInactive() {
        final ServiceRecord record = registry.register(definition("orders"));

        assertEquals(ServiceState.INACTIVE, record.state());
        assertTrue(registry.contains("orders"));
        assertEquals(1, registry.size());
    }

    @Test
    void whenRegistering_givenTakenName_shouldThrowDomainException() {
        registry.register(definition("orders"));

        final DomainException e = assertThrows(DomainException.class,
                () -> registry.register(definition("orders")));
        assertEquals("SERVICE_ALREADY_EXISTS", e.getErrorCode());
    }

    @Test
    void whenUpdating_givenUnknownService_shouldThrowServiceNotFound() {
        assertThrows(ServiceNotFoundException.class,
                () -> registry.update(definition("orders")));
    }

    @Test
    void whenRemoving_givenUnknownService_shouldThrowServiceNotFound() {
        assertThrows(ServiceNotFoundException.class,
                () -> registry.remove("orders"));
    }

    @Test
    void whenRemoving_givenRegisteredService_shouldForgetIt() {
        registry.register(definition("orders"));

        registry.remove("orders");

        assertFalse(registry.contains("orders"));
        assertTrue(registry.find("orders").isEmpty());
    }

    @Test
    void whenRemoving_givenRegisteredService_shouldReturnDetachedCopy() {
        registry.register(definition("orders"));

        final ServiceRecord removed = registry.remove("orders");
        removed.beginValidation();

        assertEquals("orders", removed.name());
        assertEquals(ServiceState.VALIDATING, removed.state());
    }

    @Test
    void whenRemovingIfUnchanged_givenSameGeneration_shouldRemove() {
        registry.register(definition("orders"));
        final long generation = registry.generation();

        assertTrue(registry.removeIfUnchanged("orders", generation).isPresent());
        assertFalse(registry.contains("orders"));
        assertTrue(registry.generation() > generation);
    }

    @Test
    void whenRemovingIfUnchanged_givenCatalogChanged_shouldKeepService() {
        registry.register(definition("orders"));
        final long generation = registry.generation();
        registry.register(definition("billing"));

        assertTrue(registry.removeIfUnchanged("orders", generation).isEmpty());
        assertTrue(registry.contains("orders"));
    }

    @Test
    void whenRemovingIfUnchanged_givenUnknownService_shouldThrowNotFound() {
        assertThrows(ServiceNotFoundException.class,
                () -> registry.removeIfUnchanged("orders",
                        registry.generation()));
    }

    @Test
    void whenApplyingStatuses_givenValidatedSnapshot_shouldKeepGeneration() {
        registry.register(definition("a"));
        final long generation = registry.generation();
        final List<ServiceRecord> snapshot = registry.snapshot();
        snapshot.get(0).beginValidation();
        snapshot.get(0).markActive(List.of());

        registry.applyStatuses(snapshot);

        assertEquals(generation, registry.generation());
    }

    @Test
    void whenRestoring_givenReplacement_shouldPutPreviousRecordBack() {
        registry.register(definition("a"));

        final ServiceRegistry.Replacement replacement = registry.replace(
                ServiceDefinition.of("a", "2.0.0", List.of()));

        assertEquals("1.0.0", replacement.previous().declaredVersion());
        assertEquals("2.0.0", replacement.current().declaredVersion());
        assertTrue(registry.restore(replacement));
        assertEquals("1.0.0", registry.get("a").declaredVersion());
        assertEquals(ServiceState.INACTIVE, registry.get("a").state());
    }

    @Test
    void whenRestoring_givenServiceUpdatedAgain_shouldKeepNewerRecord() {
        registry.register(definition("a"));
        final ServiceRegistry.Replacement replacement = registry.replace(
                ServiceDefinition.of("a", "2.0.0", List.of()));
        registry.update(ServiceDefinition.of("a", "3.0.0", List.of()));

        assertFalse(registry.restore(replacement));
        assertEquals("3.0.0", registry.get("a").declaredVersion());
    }

    @Test
    void whenListing_givenSeveralServices_shouldKeepRegistrationOrder() {
        registry.register(definition("c"));
        registry.register(definition("a"));
        registry.register(definition("b"));

        assertEquals(List.of("c", "a", "b"), registry.names());
        assertEquals(3, registry.definitions().size());
    }

    @Test
    void whenFinding_givenRegisteredService_shouldReturnDetachedCopy() {
        registry.register(definition("orders"));

        final ServiceRecord copy = registry.get("orders");
        copy.beginValidation();

        assertEquals(ServiceState.INACTIVE, registry.get("orders").state());
    }

    @Test
    void whenApplyingStatuses_givenValidatedSnapshot_shouldWriteThemBack() {
        registry.register(definition("a"));
        registry.register(definition("b"));
        final List<ServiceRecord> snapshot = registry.snapshot();
        for (final ServiceRecord record : snapshot) {
            record.beginValidation();
            record.markActive(List.of());
        }

        assertEquals(2, registry.applyStatuses(snapshot));
        assertEquals(ServiceState.ACTIVE, registry.get("a").state());
        assertEquals(ServiceState.ACTIVE, registry.get("b").state());
    }

    @Test
    void whenApplyingStatuses_givenServiceUpdatedMeanwhile_shouldSkipIt() {
        registry.register(definition("a"));
        registry.register(definition("b"));
        final List<ServiceRecord> snapshot = registry.snapshot();
        for (final ServiceRecord record : snapshot) {
            record.beginValidation();
            record.markActive(List.of());
        }

        registry.update(ServiceDefinition.of("a", "2.0.0", List.of()));
        registry.remove("b");

        assertEquals(0, registry.applyStatuses(snapshot));
        assertEquals(ServiceState.VALIDATING, registry.get("a").state());
    }

    @Test
    void whenAccessedConcurrently_givenReadersAndWriters_shouldStayConsistent()
            throws Exception {
        final int writers = 4;
        final int perWriter = 250;
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        final CountDownLatch start = new CountDownLatch(1);
        final List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                final int writer = w;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        registry.register(definition("s" + writer + "-" + i));
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 4; r++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        final List<ServiceRecord> snapshot = registry.snapshot();
                        assertEquals(snapshot.size(),
                                snapshot.stream().map(ServiceRecord::name)
                                        .distinct().count());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (final Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(writers * perWriter, registry.size());
    }

}
