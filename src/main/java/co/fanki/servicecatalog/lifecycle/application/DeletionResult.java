package co.fanki.servicecatalog.lifecycle.application;

import java.util.List;

/**
 * Outcome of deleting a service.
 *
 * @param service the deleted service
 * @param impacted every service that depended on it, directly or not
 * @param broken the services that required it and are now broken
 * @param forced whether the deletion overrode required dependents
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DeletionResult(String service, List<String> impacted,
        List<String> broken, boolean forced) {

    public DeletionResult {
        impacted = List.copyOf(impacted);
        broken = List.copyOf(broken);
    }

}
