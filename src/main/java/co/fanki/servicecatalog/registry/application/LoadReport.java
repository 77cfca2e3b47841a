package co.fanki.servicecatalog.registry.application;

import java.util.List;
import java.util.Map;

/**
 * Outcome of loading stored configurations into the registry.
 *
 * @param loaded the services registered or updated, in load order
 * @param rejected the reason each skipped configuration was rejected
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LoadReport(List<String> loaded, Map<String, String> rejected) {

    public LoadReport {
        loaded = List.copyOf(loaded);
        rejected = Map.copyOf(rejected);
    }

    /** Returns true if any stored configuration was skipped. */
    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

}
