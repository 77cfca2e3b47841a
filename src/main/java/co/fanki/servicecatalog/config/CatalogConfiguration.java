package co.fanki.servicecatalog.config;

import co.fanki.servicecatalog.registry.domain.ConfigurationStore;
import co.fanki.servicecatalog.registry.domain.FileConfigurationStore;
import co.fanki.servicecatalog.validation.domain.JsonSchemaStructuralValidator;
import co.fanki.servicecatalog.validation.domain.StructuralValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the catalog's storage and structural validation.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class CatalogConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            CatalogConfiguration.class);

    /**
     * Creates the file based configuration store.
     *
     * @param configDir the directory holding one file per service
     * @return the configuration store
     */
    @Bean
    public ConfigurationStore configurationStore(
            @Value("${catalog.config-dir:./config}") final String configDir) {
        final FileConfigurationStore store =
                new FileConfigurationStore(Path.of(configDir));
        LOG.info("Service configurations stored in {}",
                store.baseDirectory());
        return store;
    }

    /**
     * Creates the structural validator backed by the bundled service
     * schema.
     *
     * @return the structural validator
     */
    @Bean
    public StructuralValidator structuralValidator() {
        return new JsonSchemaStructuralValidator();
    }

}
