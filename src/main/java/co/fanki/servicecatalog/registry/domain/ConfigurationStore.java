package co.fanki.servicecatalog.registry.domain;

import java.util.List;

/**
 * Durable home of service configuration texts, keyed by service name.
 *
 * <p>Implementations raise {@link ConfigurationStoreException} on
 * storage failures.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ConfigurationStore {

    /**
     * Loads the configuration of a service.
     *
     * @param name the service name
     * @return the configuration text
     */
    String load(String name);

    /**
     * Saves the configuration of a service, replacing any previous one.
     *
     * @param name the service name
     * @param text the configuration text
     */
    void save(String name, String text);

    /**
     * Lists the names of every stored service.
     *
     * @return the names, sorted
     */
    List<String> list();

    /**
     * Deletes the configuration of a service; a no-op if none is stored.
     *
     * @param name the service name
     */
    void delete(String name);

}
