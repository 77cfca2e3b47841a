package co.fanki.servicecatalog.config;

import co.fanki.servicecatalog.dependency.application.DependencyService;
import co.fanki.servicecatalog.dependency.domain.CycleInfo;
import co.fanki.servicecatalog.dependency.domain.ImpactInfo;
import co.fanki.servicecatalog.lifecycle.application.DeletionResult;
import co.fanki.servicecatalog.lifecycle.application.LifecycleService;
import co.fanki.servicecatalog.registry.application.CatalogService;
import co.fanki.servicecatalog.registry.application.LoadReport;
import co.fanki.servicecatalog.registry.domain.ServiceRecord;
import co.fanki.servicecatalog.shared.DomainException;
import co.fanki.servicecatalog.validation.domain.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command line front end of the catalog.
 *
 * <p>Loads the stored configurations, runs one command and reports an
 * exit code: {@code 0} on success, {@code 1} when the command hit a hard
 * error, {@code 2} on a usage error. Disabled by setting
 * {@code catalog.cli.enabled} to {@code false}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(name = "catalog.cli.enabled", havingValue = "true",
        matchIfMissing = true)
public class CatalogCommandRunner implements ApplicationRunner,
        ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            CatalogCommandRunner.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = """
            Usage: service-catalog <command> [arguments]

            Commands:
              validate                  validate every registered service
              list                      list services and their status
              register <name> <file>    register or update a service
              cycles                    look for circular dependencies
              start-order <name>...     order in which to start services
              stop-order <name>...      order in which to stop services
              impact <name>             services affected by a change
              delete <name> [--force]   delete a service
            """;

    private final CatalogService catalogService;

    private final DependencyService dependencyService;

    private final LifecycleService lifecycleService;

    private final PrintStream out;

    private int exitCode = OK;

    /**
     * Creates a new CatalogCommandRunner printing to standard output.
     *
     * @param theCatalogService the catalog service
     * @param theDependencyService the dependency service
     * @param theLifecycleService the lifecycle service
     */
    @Autowired
    public CatalogCommandRunner(final CatalogService theCatalogService,
            final DependencyService theDependencyService,
            final LifecycleService theLifecycleService) {
        this(theCatalogService, theDependencyService, theLifecycleService,
                System.out);
    }

    CatalogCommandRunner(final CatalogService theCatalogService,
            final DependencyService theDependencyService,
            final LifecycleService theLifecycleService,
            final PrintStream theOut) {
        this.catalogService = theCatalogService;
        this.dependencyService = theDependencyService;
        this.lifecycleService = theLifecycleService;
        this.out = theOut;
    }

    @Override
    public void run(final ApplicationArguments args) {
        final List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            out.print(USAGE_TEXT);
            exitCode = USAGE;
            return;
        }

        final String command = words.get(0);
        final List<String> operands = words.subList(1, words.size());
        try {
            reportLoad(catalogService.loadServices());
            exitCode = switch (command) {
                case "validate" -> validate();
                case "list" -> list();
                case "register" -> register(operands);
                case "cycles" -> cycles();
                case "start-order" -> order(operands, false);
                case "stop-order" -> order(operands, true);
                case "impact" -> impact(operands);
                case "delete" -> delete(operands, args.containsOption("force"));
                default -> unknown(command);
            };
        } catch (final DomainException e) {
            LOG.debug("Command {} failed", command, e);
            out.println("Error [" + e.getErrorCode() + "]: " + e.getMessage());
            exitCode = FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // -- Commands -----------------------------------------------------------

    private int validate() {
        final ValidationSummary summary = catalogService.validateAll();
        for (final String service : summary.successful()) {
            out.println("OK     " + service);
        }
        for (final ValidationSummary.Failure failure : summary.failed()) {
            out.println("ERROR  " + failure.service() + ": "
                    + failure.reason());
        }
        for (final Map.Entry<String, List<String>> entry
                : summary.warnings().entrySet()) {
            for (final String warning : entry.getValue()) {
                out.println("WARN   " + entry.getKey() + ": " + warning);
            }
        }
        out.println(summary.successfulCount() + " valid, "
                + summary.failedCount() + " failed, "
                + summary.warningCount() + " warnings");
        return summary.isSuccessful() ? OK : FAILED;
    }

    private int list() {
        final List<ServiceRecord> services = catalogService.listServices();
        if (services.isEmpty()) {
            out.println("No services registered");
        }
        for (final ServiceRecord service : services) {
            out.println(service.name() + " " + service.declaredVersion()
                    + " [" + service.state() + "]");
        }
        return OK;
    }

    private int register(final List<String> operands) {
        if (operands.size() != 2) {
            return usage("register needs a service name and a file");
        }
        final String name = operands.get(0);
        final String text;
        try {
            text = Files.readString(Path.of(operands.get(1)));
        } catch (final IOException e) {
            LOG.debug("Cannot read {}", operands.get(1), e);
            out.println("Error: cannot read " + operands.get(1) + ": "
                    + e.getMessage());
            return FAILED;
        }

        catalogService.registerOrUpdateService(name, text);
        final ValidationSummary summary = catalogService.validateAll();
        for (final String warning : summary.warningsFor(name)) {
            out.println("WARN   " + warning);
        }
        final String failure = summary.failureOf(name);
        if (failure != null) {
            out.println("Registered " + name + " with errors: " + failure);
            return FAILED;
        }
        out.println("Registered " + name);
        return OK;
    }

    private int cycles() {
        final Optional<CycleInfo> cycle =
                dependencyService.checkCircularDependencies();
        if (cycle.isPresent()) {
            out.println("Circular dependency detected: "
                    + cycle.get().description());
        } else {
            out.println("No circular dependencies");
        }
        return OK;
    }

    private int order(final List<String> roots, final boolean stop) {
        final List<String> targets = roots.isEmpty()
                ? catalogService.listServices().stream()
                        .map(ServiceRecord::name).toList()
                : roots;
        final List<String> order = stop
                ? lifecycleService.stopOrder(targets)
                : lifecycleService.startOrder(targets);
        for (int i = 0; i < order.size(); i++) {
            out.println((i + 1) + ". " + order.get(i));
        }
        return OK;
    }

    private int impact(final List<String> operands) {
        if (operands.size() != 1) {
            return usage("impact needs a service name");
        }
        final List<ImpactInfo> impact =
                dependencyService.analyzeImpactDetailed(operands.get(0));
        if (impact.isEmpty()) {
            out.println("No services depend on " + operands.get(0));
        }
        for (final ImpactInfo info : impact) {
            out.println((info.transitivelyRequired() ? "REQUIRED " : "OPTIONAL ")
                    + info.service() + ": " + info.description());
        }
        return OK;
    }

    private int delete(final List<String> operands, final boolean force) {
        if (operands.size() != 1) {
            return usage("delete needs a service name");
        }
        final DeletionResult result =
                lifecycleService.deleteService(operands.get(0), force);
        out.println("Deleted " + result.service());
        if (!result.broken().isEmpty()) {
            out.println("Broken dependents: "
                    + String.join(", ", result.broken()));
        } else if (!result.impacted().isEmpty()) {
            out.println("Affected dependents: "
                    + String.join(", ", result.impacted()));
        }
        return OK;
    }

    private int unknown(final String command) {
        return usage("unknown command: " + command);
    }

    private int usage(final String problem) {
        out.println("Error: " + problem);
        out.print(USAGE_TEXT);
        return USAGE;
    }

    private void reportLoad(final LoadReport report) {
        for (final Map.Entry<String, String> rejected
                : report.rejected().entrySet()) {
            out.println("Skipped " + rejected.getKey() + ": "
                    + rejected.getValue());
        }
    }

}
