package co.fanki.servicecatalog.validation.application;

import co.fanki.servicecatalog.dependency.domain.CycleDetector;
import co.fanki.servicecatalog.dependency.domain.CycleInfo;
import co.fanki.servicecatalog.dependency.domain.DependencyFindings;
import co.fanki.servicecatalog.dependency.domain.DependencyGraph;
import co.fanki.servicecatalog.dependency.domain.DependencyValidator;
import co.fanki.servicecatalog.dependency.domain.VersionCompatibility;
import co.fanki.servicecatalog.registry.domain.ServiceDefinition;
import co.fanki.servicecatalog.registry.domain.ServiceRecord;
import co.fanki.servicecatalog.shared.DomainException;
import co.fanki.servicecatalog.shared.Preconditions;
import co.fanki.servicecatalog.validation.domain.SchemaStructuralException;
import co.fanki.servicecatalog.validation.domain.ServiceTypeHeuristics;
import co.fanki.servicecatalog.validation.domain.StructuralValidator;
import co.fanki.servicecatalog.validation.domain.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs full catalog validation passes.
 *
 * <p>One pass:</p>
 * <ol>
 *   <li>Build the dependency graph from the given records</li>
 *   <li>Detect cycles; a cycle is a catalog-wide warning, and each
 *       participant gets a warning of its own</li>
 *   <li>Apply the dependency policy to each service; hard failures mark
 *       the service {@code ERROR} and skip the remaining checks</li>
 *   <li>Check the schema version, run the structural validator and the
 *       service type heuristics</li>
 *   <li>Move each service to {@code ACTIVE} or {@code ERROR} and assemble
 *       the summary</li>
 * </ol>
 *
 * <p>A failing service never aborts the pass. The records handed in are
 * updated in place, so callers pass registry snapshots, not live
 * records.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ValidationOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(
            ValidationOrchestrator.class);

    /** Version of the service schema this catalog validates against. */
    public static final String CURRENT_SCHEMA_VERSION = "1.0.0";

    private final StructuralValidator structuralValidator;

    /**
     * Creates a new ValidationOrchestrator.
     *
     * @param theStructuralValidator the payload shape validator
     */
    public ValidationOrchestrator(
            final StructuralValidator theStructuralValidator) {
        this.structuralValidator = Preconditions.requireNonNull(
                theStructuralValidator, "Structural validator is required");
    }

    /**
     * Validates every given service and drives its status.
     *
     * @param records the services to validate, updated in place
     * @return the summary of the pass
     */
    public ValidationSummary runCatalogValidation(
            final List<ServiceRecord> records) {
        Preconditions.requireNoNulls(records, "Records are required");
        LOG.debug("Validating {} services", records.size());

        final Map<String, ServiceDefinition> catalog = new LinkedHashMap<>();
        for (final ServiceRecord record : records) {
            catalog.put(record.name(), record.definition());
        }

        final DependencyGraph graph = DependencyGraph.of(catalog.values());
        final ValidationSummary.Builder summary = ValidationSummary.builder();
        final Map<String, List<String>> cycleWarnings =
                cycleWarnings(graph, summary);

        for (final ServiceRecord record : records) {
            final String name = record.name();
            record.beginValidation();

            final List<String> warnings = new ArrayList<>(
                    cycleWarnings.getOrDefault(name, List.of()));
            try {
                validateService(record.definition(), catalog, warnings);
                record.markActive(warnings);
                summary.success(name);
            } catch (final DomainException e) {
                LOG.warn("Service '{}' validation failed: {}", name,
                        e.getMessage());
                record.markError(e.getMessage(), warnings);
                summary.failure(name, e.getMessage());
            }
            for (final String warning : warnings) {
                LOG.debug("Service '{}' validation warning: {}", name,
                        warning);
            }
            summary.warnings(name, warnings);
        }

        final ValidationSummary result = summary.build();
        LOG.info("Validated {} services: {} successful, {} failed,"
                        + " {} warnings", result.totalCount(),
                result.successfulCount(), result.failedCount(),
                result.warningCount());
        return result;
    }

    private Map<String, List<String>> cycleWarnings(
            final DependencyGraph graph,
            final ValidationSummary.Builder summary) {
        final Optional<CycleInfo> cycle = CycleDetector.detect(graph);
        if (cycle.isEmpty()) {
            return Map.of();
        }
        final String description = cycle.get().description();
        LOG.warn("Circular dependency detected: {}", description);
        summary.warning(ValidationSummary.SYSTEM,
                "Circular dependency detected: " + description);

        final Map<String, List<String>> result = new HashMap<>();
        for (final String participant : cycle.get().participants()) {
            result.put(participant, List.of(
                    "Service participates in circular dependency: "
                            + description));
        }
        return result;
    }

    private void validateService(final ServiceDefinition service,
            final Map<String, ServiceDefinition> catalog,
            final List<String> warnings) {
        final DependencyFindings findings =
                DependencyValidator.validate(service, catalog);
        warnings.addAll(findings.warnings());
        findings.requireNoErrors();

        checkSchemaVersion(service, warnings);

        final List<String> violations;
        try {
            violations = structuralValidator.validate(service.payload());
        } catch (final RuntimeException e) {
            throw new SchemaStructuralException(
                    "Structural validation could not run: " + e.getMessage());
        }
        if (!violations.isEmpty()) {
            throw new SchemaStructuralException(violations);
        }

        warnings.addAll(ServiceTypeHeuristics.inspect(service));
    }

    private static void checkSchemaVersion(final ServiceDefinition service,
            final List<String> warnings) {
        final String schemaVersion = service.payload()
                .path("schema_version").asText(CURRENT_SCHEMA_VERSION);

        switch (VersionCompatibility.classify(schemaVersion,
                CURRENT_SCHEMA_VERSION)) {
            case MAJOR_INCOMPATIBLE -> throw new SchemaStructuralException(
                    "Schema version " + schemaVersion
                            + " is incompatible with current version "
                            + CURRENT_SCHEMA_VERSION);
            case MINOR_INCOMPATIBLE -> warnings.add(
                    "Minor schema version incompatibility: config version "
                            + schemaVersion + " vs current "
                            + CURRENT_SCHEMA_VERSION);
            default -> {
                // compatible
            }
        }
    }

}
