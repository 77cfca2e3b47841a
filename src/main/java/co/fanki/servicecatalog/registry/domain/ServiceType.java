package co.fanki.servicecatalog.registry.domain;

import java.util.Locale;

/**
 * Kinds of services the catalog knows heuristics for.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ServiceType {

    /** HTTP/REST service. */
    REST("rest"),

    /** gRPC service. */
    GRPC("grpc"),

    /** GraphQL service. */
    GRAPHQL("graphql"),

    /** Event-driven service (topics, queues). */
    EVENT_DRIVEN("eventdriven"),

    /** Anything else, including unrecognized tags. */
    OTHER("other");

    private final String tag;

    ServiceType(final String theTag) {
        this.tag = theTag;
    }

    /**
     * Returns the tag used in configuration files.
     *
     * @return the lowercase tag
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a configuration tag, case-insensitively.
     *
     * <p>Unknown or missing tags resolve to {@link #OTHER}.</p>
     *
     * @param tag the tag, may be null
     * @return the service type
     */
    public static ServiceType fromTag(final String tag) {
        if (tag == null) {
            return OTHER;
        }
        final String normalized = tag.trim().toLowerCase(Locale.ROOT)
                .replace("_", "").replace("-", "");
        for (final ServiceType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }

}
