package co.fanki.servicecatalog.dependency.application;

import co.fanki.servicecatalog.dependency.domain.CycleDetector;
import co.fanki.servicecatalog.dependency.domain.CycleException;
import co.fanki.servicecatalog.dependency.domain.CycleInfo;
import co.fanki.servicecatalog.dependency.domain.DependencyFindings;
import co.fanki.servicecatalog.dependency.domain.DependencyGraph;
import co.fanki.servicecatalog.dependency.domain.DependencyResolver;
import co.fanki.servicecatalog.dependency.domain.DependencyValidator;
import co.fanki.servicecatalog.dependency.domain.ImpactAnalyzer;
import co.fanki.servicecatalog.dependency.domain.ImpactInfo;
import co.fanki.servicecatalog.registry.domain.ServiceDefinition;
import co.fanki.servicecatalog.registry.domain.ServiceNotFoundException;
import co.fanki.servicecatalog.registry.domain.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application service answering dependency questions about the catalog.
 *
 * <p>Every call builds a fresh graph from one registry snapshot and works
 * on it without holding any lock, so the answer is consistent with the
 * catalog as it was at the start of the call.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DependencyService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyService.class);

    private final ServiceRegistry registry;

    /**
     * Creates a new DependencyService.
     *
     * @param theRegistry the service registry
     */
    public DependencyService(final ServiceRegistry theRegistry) {
        this.registry = theRegistry;
    }

    /**
     * Builds the dependency graph of the registered services.
     *
     * @return a detached graph
     */
    public DependencyGraph buildGraph() {
        final DependencyGraph graph =
                DependencyGraph.of(registry.definitions());
        LOG.debug("Built dependency graph with {} services and {} edges",
                graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Looks for a dependency cycle in the catalog.
     *
     * @return one cycle, if any exists
     */
    public Optional<CycleInfo> checkCircularDependencies() {
        final Optional<CycleInfo> cycle = CycleDetector.detect(buildGraph());
        cycle.ifPresent(c -> LOG.warn("Circular dependency detected: {}",
                c.description()));
        return cycle;
    }

    /**
     * Returns the start order of the given services and everything they
     * transitively depend on.
     *
     * @param roots the services to start
     * @return the names, dependencies first
     * @throws ServiceNotFoundException if a root is not registered
     * @throws CycleException if the services to start form a cycle
     */
    public List<String> resolveOrder(final List<String> roots) {
        return DependencyResolver.resolveOrder(buildGraph(), roots);
    }

    /**
     * Returns every service that transitively depends on the target.
     *
     * @param name the changed service
     * @return the affected services, nearest first
     * @throws ServiceNotFoundException if the service is not registered
     */
    public List<String> analyzeImpact(final String name) {
        return ImpactAnalyzer.findImpact(graphContaining(name), name);
    }

    /**
     * Returns every service that transitively depends on the target, with
     * the dependency path of each.
     *
     * @param name the changed service
     * @return one entry per affected service, nearest first
     * @throws ServiceNotFoundException if the service is not registered
     */
    public List<ImpactInfo> analyzeImpactDetailed(final String name) {
        return ImpactAnalyzer.detailedImpact(graphContaining(name), name);
    }

    /**
     * Returns the services that would break without the target, reached
     * through required dependencies only.
     *
     * @param name the changed service
     * @return the critically affected services, nearest first
     * @throws ServiceNotFoundException if the service is not registered
     */
    public List<String> analyzeCriticalImpact(final String name) {
        return ImpactAnalyzer.criticalImpact(graphContaining(name), name);
    }

    /**
     * Applies the dependency policy to one service.
     *
     * @param name the service name
     * @return the hard errors and warnings found
     * @throws ServiceNotFoundException if the service is not registered
     */
    public DependencyFindings validateDependencies(final String name) {
        final Map<String, ServiceDefinition> catalog = catalog();
        final ServiceDefinition service = catalog.get(name);
        if (service == null) {
            throw new ServiceNotFoundException(name);
        }
        return DependencyValidator.validate(service, catalog);
    }

    /**
     * Applies the dependency policy to every service.
     *
     * @return the findings keyed by service name, in registration order
     */
    public Map<String, DependencyFindings> validateAllDependencies() {
        final Map<String, ServiceDefinition> catalog = catalog();
        final Map<String, DependencyFindings> result = new LinkedHashMap<>();
        for (final ServiceDefinition service : catalog.values()) {
            result.put(service.name(),
                    DependencyValidator.validate(service, catalog));
        }
        return result;
    }

    private DependencyGraph graphContaining(final String name) {
        final DependencyGraph graph = buildGraph();
        if (!graph.contains(name)) {
            throw new ServiceNotFoundException(name);
        }
        return graph;
    }

    private Map<String, ServiceDefinition> catalog() {
        final Map<String, ServiceDefinition> catalog = new LinkedHashMap<>();
        for (final ServiceDefinition definition : registry.definitions()) {
            catalog.put(definition.name(), definition);
        }
        return catalog;
    }

}
