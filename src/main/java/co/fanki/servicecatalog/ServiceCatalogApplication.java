package co.fanki.servicecatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Service Catalog Application.
 *
 * <p>Keeps a catalog of service configurations, validates them, and
 * answers dependency questions: cycles, start and stop order, and the
 * impact of changing or deleting a service. Runs as a command line tool;
 * the exit code reflects the outcome of the command.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ServiceCatalogApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(ServiceCatalogApplication.class, args)));
    }

}
