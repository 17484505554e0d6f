package com.venturegate.boundary;

import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Request-scoped "parse once" memo, keyed by the identity of the row batch (never its content).
 * <p>
 * Create one per request with {@link #create()} and pass it through the calls that may see the
 * same batch more than once; pass {@link #disabled()} to always reparse. Not thread-safe and
 * not meant to be shared across requests. Dropping it never changes a result.
 */
public final class BoundaryParseMemo {

    private static final BoundaryParseMemo DISABLED = new BoundaryParseMemo(false);

    private final boolean enabled;
    private final Map<EntityKind, IdentityHashMap<List<?>, Entry>> entries = new EnumMap<>(EntityKind.class);
    private int hits;

    private BoundaryParseMemo(boolean enabled) {
        this.enabled = enabled;
    }

    public static BoundaryParseMemo create() {
        return new BoundaryParseMemo(true);
    }

    public static BoundaryParseMemo disabled() {
        return DISABLED;
    }

    @SuppressWarnings("unchecked")
    <T> List<T> computeIfAbsent(EntityKind kind, List<?> batch, BoundaryValidationPolicy policy,
                                Supplier<List<T>> parser) {
        if (!enabled) {
            return parser.get();
        }
        IdentityHashMap<List<?>, Entry> byBatch = entries.computeIfAbsent(kind, k -> new IdentityHashMap<>());
        Entry cached = byBatch.get(batch);
        if (cached != null && cached.policy().equals(policy)) {
            hits++;
            return (List<T>) cached.parsed();
        }
        List<T> parsed = parser.get();
        byBatch.put(batch, new Entry(policy, parsed));
        return parsed;
    }

    /** Number of lookups answered from the memo. */
    public int hits() {
        return hits;
    }

    public void clear() {
        entries.clear();
    }

    private record Entry(BoundaryValidationPolicy policy, List<?> parsed) {}
}
