package co.fanki.servicecatalog.lifecycle.application;

import co.fanki.servicecatalog.dependency.application.DependencyService;
import co.fanki.servicecatalog.dependency.domain.CycleException;
import co.fanki.servicecatalog.dependency.domain.DependencyGraph;
import co.fanki.servicecatalog.dependency.domain.ImpactAnalyzer;
import co.fanki.servicecatalog.registry.application.CatalogService;
import co.fanki.servicecatalog.registry.domain.ServiceNotFoundException;
import co.fanki.servicecatalog.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Orders service starts and stops, and guards deletions.
 *
 * <p>Start order puts every dependency before its dependents; stop order
 * is its exact reverse. A service that others require cannot be deleted
 * unless the deletion is forced.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class LifecycleService {

    private static final Logger LOG = LoggerFactory.getLogger(
            LifecycleService.class);

    private final DependencyService dependencyService;

    private final CatalogService catalogService;

    /**
     * Creates a new LifecycleService.
     *
     * @param theDependencyService the dependency service
     * @param theCatalogService the catalog service
     */
    public LifecycleService(final DependencyService theDependencyService,
            final CatalogService theCatalogService) {
        this.dependencyService = theDependencyService;
        this.catalogService = theCatalogService;
    }

    /**
     * Returns the order in which to start the given services.
     *
     * @param roots the services to start; their dependencies are included
     * @return the names, dependencies first
     * @throws ServiceNotFoundException if a root is not registered
     * @throws CycleException if the services to start form a cycle
     */
    public List<String> startOrder(final List<String> roots) {
        final List<String> order = dependencyService.resolveOrder(roots);
        LOG.debug("Start order for {}: {}", roots, order);
        return order;
    }

    /**
     * Returns the order in which to stop the given services.
     *
     * @param roots the services to stop; their dependencies are included
     * @return the names, dependents first
     * @throws ServiceNotFoundException if a root is not registered
     * @throws CycleException if the services to stop form a cycle
     */
    public List<String> stopOrder(final List<String> roots) {
        final List<String> order = new ArrayList<>(
                dependencyService.resolveOrder(roots));
        Collections.reverse(order);
        LOG.debug("Stop order for {}: {}", roots, order);
        return Collections.unmodifiableList(order);
    }

    /**
     * Deletes a service from the catalog.
     *
     * <p>The decision is taken on a snapshot graph; the removal goes
     * through only if the catalog is still at the snapshot's generation,
     * otherwise the decision is taken again on a fresh snapshot.</p>
     *
     * @param name the service to delete
     * @param force whether to delete even if other services require it
     * @return the services the deletion affects
     * @throws ServiceNotFoundException if the service is not registered
     * @throws DomainException with code {@code SERVICE_DELETION_BLOCKED} if
     *         other services require it and {@code force} is false
     */
    public DeletionResult deleteService(final String name,
            final boolean force) {
        while (true) {
            final long generation = catalogService.catalogGeneration();
            final DependencyGraph graph = dependencyService.buildGraph();
            if (!graph.contains(name)) {
                throw new ServiceNotFoundException(name);
            }

            final List<String> broken =
                    ImpactAnalyzer.criticalImpact(graph, name);
            if (!broken.isEmpty() && !force) {
                throw new DomainException("Cannot delete service '" + name
                        + "': required by " + String.join(", ", broken),
                        "SERVICE_DELETION_BLOCKED");
            }
            final List<String> impacted = ImpactAnalyzer.findImpact(graph, name);

            if (catalogService.removeServiceIfUnchanged(name, generation)
                    .isEmpty()) {
                LOG.debug("Catalog changed while deleting {}, retrying", name);
                continue;
            }

            if (!broken.isEmpty()) {
                LOG.warn("Service {} force-deleted, breaking {}", name, broken);
            } else {
                LOG.info("Service {} deleted, {} dependents affected", name,
                        impacted.size());
            }
            return new DeletionResult(name, impacted, broken,
                    force && !broken.isEmpty());
        }
    }

}
