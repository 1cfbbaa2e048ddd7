package tech.gatekeeper.platform.audit;

import java.util.Locale;

/**
 * Where a permission decision came from.
 */
public enum DecisionSource {

    /** Served from the decision cache. */
    CACHE,

    /** Computed by the evaluator on a cache miss. */
    EVALUATOR,

    /** Computed by the evaluator because the cache failed. */
    FALLBACK;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
