package co.fanki.servicecatalog.registry.application;

import co.fanki.servicecatalog.registry.domain.ConfigurationStore;
import co.fanki.servicecatalog.registry.domain.ConfigurationStoreException;
import co.fanki.servicecatalog.registry.domain.ServiceDefinition;
import co.fanki.servicecatalog.registry.domain.ServiceDefinitionParser;
import co.fanki.servicecatalog.registry.domain.ServiceNotFoundException;
import co.fanki.servicecatalog.registry.domain.ServiceRecord;
import co.fanki.servicecatalog.registry.domain.ServiceRegistry;
import co.fanki.servicecatalog.shared.DomainException;
import co.fanki.servicecatalog.validation.application.ValidationOrchestrator;
import co.fanki.servicecatalog.validation.domain.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application service for service registration and catalog validation.
 *
 * <p>Keeps the registry and the configuration store in step: every
 * accepted configuration is both registered and persisted, and removal
 * drops both. Storage failures surface as {@link DomainException}s with
 * code {@code CONFIGURATION_STORE_FAILURE}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class CatalogService {

    private static final Logger LOG = LoggerFactory.getLogger(
            CatalogService.class);

    private final ServiceRegistry registry;

    private final ConfigurationStore store;

    private final ServiceDefinitionParser parser;

    private final ValidationOrchestrator orchestrator;

    /**
     * Creates a new CatalogService.
     *
     * @param theRegistry the service registry
     * @param theStore the configuration store
     * @param theParser the configuration parser
     * @param theOrchestrator the validation orchestrator
     */
    public CatalogService(final ServiceRegistry theRegistry,
            final ConfigurationStore theStore,
            final ServiceDefinitionParser theParser,
            final ValidationOrchestrator theOrchestrator) {
        this.registry = theRegistry;
        this.store = theStore;
        this.parser = theParser;
        this.orchestrator = theOrchestrator;
    }

    /**
     * Registers a new service from its configuration text.
     *
     * @param name the service name
     * @param text the JSON or YAML configuration
     * @return the registered record, in {@code INACTIVE}
     * @throws DomainException if the text cannot be parsed, the name is
     *         taken or the configuration cannot be stored
     */
    public ServiceRecord registerService(final String name,
            final String text) {
        LOG.info("Registering service: {}", name);
        final ServiceDefinition definition = parser.parse(name, text);
        final ServiceRecord record = registry.register(definition);

        try {
            store.save(name, text);
        } catch (final ConfigurationStoreException e) {
            registry.remove(name);
            throw storeFailure("store configuration of service " + name, e);
        }
        LOG.info("Service registered: {} {}", name, definition.version());
        return record;
    }

    /**
     * Replaces the configuration of a registered service.
     *
     * @param name the service name
     * @param text the new JSON or YAML configuration
     * @return the updated record, in {@code VALIDATING}
     * @throws ServiceNotFoundException if the service is not registered
     * @throws DomainException if the text cannot be parsed or the
     *         configuration cannot be stored; the previous configuration
     *         is then kept
     */
    public ServiceRecord updateService(final String name, final String text) {
        LOG.info("Updating service: {}", name);
        final ServiceDefinition definition = parser.parse(name, text);
        final ServiceRegistry.Replacement replacement =
                registry.replace(definition);

        try {
            store.save(name, text);
        } catch (final ConfigurationStoreException e) {
            registry.restore(replacement);
            throw storeFailure("store configuration of service " + name, e);
        }
        return replacement.current();
    }

    /**
     * Registers a service, or updates it when it is already registered.
     *
     * @param name the service name
     * @param text the JSON or YAML configuration
     * @return the resulting record
     */
    public ServiceRecord registerOrUpdateService(final String name,
            final String text) {
        return registry.contains(name)
                ? updateService(name, text)
                : registerService(name, text);
    }

    /**
     * Loads every stored configuration into the registry.
     *
     * <p>A configuration that cannot be read or parsed is logged and
     * skipped; the rest still load.</p>
     *
     * @return which services loaded and which were rejected
     */
    public LoadReport loadServices() {
        final List<String> names;
        try {
            names = store.list();
        } catch (final ConfigurationStoreException e) {
            throw storeFailure("list stored configurations", e);
        }
        LOG.info("Loading {} stored service configurations", names.size());

        final List<String> loaded = new ArrayList<>();
        final Map<String, String> rejected = new LinkedHashMap<>();
        for (final String name : names) {
            try {
                final ServiceDefinition definition =
                        parser.parse(name, store.load(name));
                if (registry.contains(name)) {
                    registry.update(definition);
                } else {
                    registry.register(definition);
                }
                loaded.add(name);
            } catch (final DomainException | ConfigurationStoreException e) {
                LOG.warn("Skipping configuration of service {}: {}", name,
                        e.getMessage());
                rejected.put(name, e.getMessage());
            }
        }
        LOG.info("Loaded {} services, {} rejected", loaded.size(),
                rejected.size());
        return new LoadReport(loaded, rejected);
    }

    /**
     * Removes a service from the registry and the store.
     *
     * @param name the service name
     * @return the removed record
     * @throws ServiceNotFoundException if the service is not registered
     */
    public ServiceRecord removeService(final String name) {
        final ServiceRecord removed = registry.remove(name);
        try {
            store.delete(name);
        } catch (final ConfigurationStoreException e) {
            throw storeFailure("delete configuration of service " + name, e);
        }
        LOG.info("Service removed: {}", name);
        return removed;
    }

    /**
     * Removes a service only if the catalog has not changed since
     * {@link #catalogGeneration()} returned {@code expectedGeneration}.
     *
     * @param name the service name
     * @param expectedGeneration the generation the removal was decided on
     * @return the removed record, or empty if the catalog changed
     * @throws ServiceNotFoundException if the service is not registered
     */
    public Optional<ServiceRecord> removeServiceIfUnchanged(final String name,
            final long expectedGeneration) {
        final Optional<ServiceRecord> removed =
                registry.removeIfUnchanged(name, expectedGeneration);
        if (removed.isPresent()) {
            try {
                store.delete(name);
            } catch (final ConfigurationStoreException e) {
                throw storeFailure("delete configuration of service " + name,
                        e);
            }
            LOG.info("Service removed: {}", name);
        }
        return removed;
    }

    /**
     * Returns the catalog generation; see {@link ServiceRegistry#generation()}.
     *
     * @return the current generation
     */
    public long catalogGeneration() {
        return registry.generation();
    }

    /**
     * Finds a service.
     *
     * @param name the service name
     * @return a copy of the record, if registered
     */
    public Optional<ServiceRecord> findService(final String name) {
        return registry.find(name);
    }

    /**
     * Finds a service, throwing if not registered.
     *
     * @param name the service name
     * @return a copy of the record
     * @throws ServiceNotFoundException if the service is not registered
     */
    public ServiceRecord getService(final String name) {
        return registry.get(name);
    }

    /**
     * Lists every registered service.
     *
     * @return copies of the records in registration order
     */
    public List<ServiceRecord> listServices() {
        return registry.snapshot();
    }

    /**
     * Validates the whole catalog and records each service's status.
     *
     * <p>The pass runs on a snapshot; statuses of services changed while it
     * ran are discarded.</p>
     *
     * @return the summary of the pass
     */
    public ValidationSummary validateAll() {
        final List<ServiceRecord> snapshot = registry.snapshot();
        final ValidationSummary summary =
                orchestrator.runCatalogValidation(snapshot);
        final int applied = registry.applyStatuses(snapshot);
        if (applied < snapshot.size()) {
            LOG.info("{} services changed during validation, statuses kept",
                    snapshot.size() - applied);
        }
        return summary;
    }

    private static DomainException storeFailure(final String action,
            final ConfigurationStoreException cause) {
        LOG.error("Failed to {}", action, cause);
        return new DomainException("Failed to " + action + ": "
                + cause.getMessage(), "CONFIGURATION_STORE_FAILURE", cause);
    }

}
