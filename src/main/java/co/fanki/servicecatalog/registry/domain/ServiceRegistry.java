package co.fanki.servicecatalog.registry.domain;

import co.fanki.servicecatalog.shared.DomainException;
import co.fanki.servicecatalog.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory registry of services, the only shared mutable state of the
 * catalog.
 *
 * <p>The service map is guarded by one read/write lock. Readers hold the
 * read lock only while copying records out; writers hold the write lock
 * only for the map mutation itself. Analyses and validation passes run on
 * the copies, never under the lock. The lock is never acquired twice by
 * the same call.</p>
 *
 * <p>Records are kept in registration order so that every snapshot, and
 * therefore every graph built from one, iterates deterministically.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ServiceRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(
            ServiceRegistry.class);

    private final Map<String, ServiceRecord> services = new LinkedHashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long generation;

    /**
     * Registers a new service in {@link ServiceState#INACTIVE}.
     *
     * @param definition the parsed configuration
     * @return a copy of the new record
     * @throws DomainException with code {@code SERVICE_ALREADY_EXISTS} if
     *         the name is taken
     */
    public ServiceRecord register(final ServiceDefinition definition) {
        Preconditions.requireNonNull(definition,
                "Service definition is required");
        final ServiceRecord record = ServiceRecord.register(definition);

        lock.writeLock().lock();
        try {
            if (services.containsKey(definition.name())) {
                throw new DomainException(
                        "Service already registered: " + definition.name(),
                        "SERVICE_ALREADY_EXISTS");
            }
            services.put(definition.name(), record);
            generation++;
            return record.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the configuration of a registered service, which goes back
     * to {@link ServiceState#VALIDATING}.
     *
     * @param definition the new configuration
     * @return a copy of the updated record
     * @throws ServiceNotFoundException if the service is not registered
     */
    public ServiceRecord update(final ServiceDefinition definition) {
        return replace(definition).current();
    }

    /**
     * Replaces the configuration of a registered service, keeping the
     * record as it was before so the change can be undone with
     * {@link #restore(Replacement)}.
     *
     * @param definition the new configuration
     * @return copies of the record before and after the change
     * @throws ServiceNotFoundException if the service is not registered
     */
    public Replacement replace(final ServiceDefinition definition) {
        Preconditions.requireNonNull(definition,
                "Service definition is required");

        lock.writeLock().lock();
        try {
            final ServiceRecord record = services.get(definition.name());
            if (record == null) {
                throw new ServiceNotFoundException(definition.name());
            }
            final ServiceRecord previous = record.copy();
            record.updateDefinition(definition);
            generation++;
            return new Replacement(previous, record.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Puts back the record a {@link #replace(ServiceDefinition)} replaced.
     *
     * <p>Nothing happens if the service was updated again or removed
     * after that replacement.</p>
     *
     * @param replacement the replacement to undo
     * @return true if the previous record is live again
     */
    public boolean restore(final Replacement replacement) {
        Preconditions.requireNonNull(replacement, "Replacement is required");
        final String name = replacement.previous().name();

        lock.writeLock().lock();
        try {
            final ServiceRecord live = services.get(name);
            if (live == null || live.definition()
                    != replacement.current().definition()) {
                LOG.debug("Not restoring service {}, changed meanwhile", name);
                return false;
            }
            services.put(name, replacement.previous().copy());
            generation++;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a service.
     *
     * @param name the service name
     * @return a copy of the removed record
     * @throws ServiceNotFoundException if the service is not registered
     */
    public ServiceRecord remove(final String name) {
        lock.writeLock().lock();
        try {
            final ServiceRecord removed = services.remove(name);
            if (removed == null) {
                throw new ServiceNotFoundException(name);
            }
            generation++;
            return removed.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a service only if the catalog has not changed since
     * {@link #generation()} returned {@code expectedGeneration}.
     *
     * @param name the service name
     * @param expectedGeneration the generation the caller's decision used
     * @return a copy of the removed record, or empty if the catalog changed
     * @throws ServiceNotFoundException if the service is not registered
     */
    public Optional<ServiceRecord> removeIfUnchanged(final String name,
            final long expectedGeneration) {
        lock.writeLock().lock();
        try {
            if (!services.containsKey(name)) {
                throw new ServiceNotFoundException(name);
            }
            if (generation != expectedGeneration) {
                return Optional.empty();
            }
            final ServiceRecord removed = services.remove(name);
            generation++;
            return Optional.of(removed.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the catalog generation, which changes whenever a service is
     * registered, updated or removed. Status write-backs do not change it.
     *
     * @return the current generation
     */
    public long generation() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds a service.
     *
     * @param name the service name
     * @return a copy of the record, if registered
     */
    public Optional<ServiceRecord> find(final String name) {
        lock.readLock().lock();
        try {
            final ServiceRecord record = services.get(name);
            return record == null ? Optional.empty()
                    : Optional.of(record.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a service, failing when it is not registered.
     *
     * @param name the service name
     * @return a copy of the record
     * @throws ServiceNotFoundException if the service is not registered
     */
    public ServiceRecord get(final String name) {
        return find(name).orElseThrow(() -> new ServiceNotFoundException(name));
    }

    /**
     * Checks whether a service is registered.
     *
     * @param name the service name
     * @return true if registered
     */
    public boolean contains(final String name) {
        lock.readLock().lock();
        try {
            return services.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the registered names in registration order.
     *
     * @return the names
     */
    public List<String> names() {
        lock.readLock().lock();
        try {
            return List.copyOf(services.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies every record out of the registry.
     *
     * @return detached copies in registration order
     */
    public List<ServiceRecord> snapshot() {
        lock.readLock().lock();
        try {
            final List<ServiceRecord> copies = new ArrayList<>(services.size());
            for (final ServiceRecord record : services.values()) {
                copies.add(record.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies the definitions of every record out of the registry.
     *
     * @return the definitions in registration order
     */
    public List<ServiceDefinition> definitions() {
        lock.readLock().lock();
        try {
            final List<ServiceDefinition> result =
                    new ArrayList<>(services.size());
            for (final ServiceRecord record : services.values()) {
                result.add(record.definition());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Writes back the statuses of snapshot copies validated off-lock.
     *
     * <p>A status is taken only if the live record still holds the
     * definition the copy was validated against; services updated or
     * removed in the meantime are skipped.</p>
     *
     * @param validated validated copies obtained from {@link #snapshot()}
     * @return the number of statuses written
     */
    public int applyStatuses(final List<ServiceRecord> validated) {
        Preconditions.requireNoNulls(validated, "Records are required");
        int applied = 0;

        lock.writeLock().lock();
        try {
            for (final ServiceRecord copy : validated) {
                final ServiceRecord live = services.get(copy.name());
                if (live != null && live.adoptStatus(copy)) {
                    applied++;
                } else {
                    LOG.debug("Skipping stale status of service {}",
                            copy.name());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return applied;
    }

    /** Returns the number of registered services. */
    public int size() {
        lock.readLock().lock();
        try {
            return services.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A configuration change: the record before and after it.
     *
     * @param previous copy of the record before the change
     * @param current copy of the record after the change
     */
    public record Replacement(ServiceRecord previous, ServiceRecord current) {
    }

}
