package co.fanki.servicecatalog.validation.domain;

import co.fanki.servicecatalog.shared.Preconditions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable outcome of one catalog validation pass.
 *
 * <p>Warnings are keyed by service name; catalog-wide warnings such as
 * cycles are filed under {@link #SYSTEM}. Build instances with
 * {@link #builder()}; a summary is never modified once built.</p>
 *
 * @param successful services without hard failures
 * @param failed service name and failure reason, in validation order
 * @param warnings advisory findings per service
 * @param timestamp when the pass finished
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ValidationSummary(
        Set<String> successful,
        List<Failure> failed,
        Map<String, List<String>> warnings,
        Instant timestamp) {

    /** Key of catalog-wide warnings. */
    public static final String SYSTEM = "system";

    /**
     * A service that failed validation.
     *
     * @param service the service name
     * @param reason the hard failure
     */
    public record Failure(String service, String reason) {}

    /**
     * Freezes the collections.
     */
    public ValidationSummary {
        successful = Collections.unmodifiableSet(
                new LinkedHashSet<>(successful));
        failed = List.copyOf(failed);
        final Map<String, List<String>> frozen = new LinkedHashMap<>();
        warnings.forEach((service, list) ->
                frozen.put(service, List.copyOf(list)));
        warnings = Collections.unmodifiableMap(frozen);
        Preconditions.requireNonNull(timestamp, "Timestamp is required");
    }

    /** Returns a builder for a new summary. */
    public static Builder builder() {
        return new Builder();
    }

    public int successfulCount() {
        return successful.size();
    }

    public int failedCount() {
        return failed.size();
    }

    /** Returns the total number of warnings, over all services. */
    public int warningCount() {
        int count = 0;
        for (final List<String> list : warnings.values()) {
            count += list.size();
        }
        return count;
    }

    public int totalCount() {
        return successfulCount() + failedCount();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /** Checks whether no service failed. Warnings do not count. */
    public boolean isSuccessful() {
        return failed.isEmpty();
    }

    /**
     * Returns the warnings of one service.
     *
     * @param service the service name, or {@link #SYSTEM}
     * @return the warnings, empty if none
     */
    public List<String> warningsFor(final String service) {
        return warnings.getOrDefault(service, List.of());
    }

    /**
     * Returns the failure reason of a service.
     *
     * @param service the service name
     * @return the reason, or null when the service did not fail
     */
    public String failureOf(final String service) {
        for (final Failure failure : failed) {
            if (failure.service().equals(service)) {
                return failure.reason();
            }
        }
        return null;
    }

    /**
     * Collects the results of a validation pass.
     */
    public static final class Builder {

        private final Set<String> successful = new LinkedHashSet<>();
        private final List<Failure> failed = new ArrayList<>();
        private final Map<String, List<String>> warnings =
                new LinkedHashMap<>();

        private Builder() {
        }

        public Builder success(final String service) {
            successful.add(Preconditions.requireNonBlank(service,
                    "Service is required"));
            return this;
        }

        public Builder failure(final String service, final String reason) {
            failed.add(new Failure(Preconditions.requireNonBlank(service,
                    "Service is required"), reason));
            return this;
        }

        public Builder warning(final String service, final String warning) {
            warnings.computeIfAbsent(service, k -> new ArrayList<>())
                    .add(warning);
            return this;
        }

        public Builder warnings(final String service,
                final List<String> serviceWarnings) {
            for (final String warning : serviceWarnings) {
                warning(service, warning);
            }
            return this;
        }

        public ValidationSummary build() {
            return new ValidationSummary(successful, failed, warnings,
                    Instant.now());
        }

    }

}
