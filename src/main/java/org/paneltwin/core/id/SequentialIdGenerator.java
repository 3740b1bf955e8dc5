package org.paneltwin.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Deterministic per-prefix counter: {@code PREFIX_1, PREFIX_2, ...}.
 *
 * <p>Unlike random ids this keeps snapshots and test expectations reproducible. Not
 * thread-safe; owned by a single twin.</p>
 */
public class SequentialIdGenerator implements IdGenerator {
    private static final char SEPARATOR = '_';

    // prefix -> highest sequence number issued or reserved
    private final Object2IntOpenHashMap<String> counters;

    public SequentialIdGenerator() {
        this.counters = new Object2IntOpenHashMap<>();
        this.counters.defaultReturnValue(0);
    }

    @Override
    public String next(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must be non-blank");
        }
        int sequence = counters.getInt(prefix) + 1;
        counters.put(prefix, sequence);
        return prefix + SEPARATOR + sequence;
    }

    @Override
    public void reserve(String id) {
        if (id == null) {
            return;
        }
        int split = id.lastIndexOf(SEPARATOR);
        if (split <= 0 || split == id.length() - 1) {
            return;
        }
        String prefix = id.substring(0, split);
        final int sequence;
        try {
            sequence = Integer.parseInt(id.substring(split + 1));
        } catch (NumberFormatException ex) {
            // Foreign ids without a numeric suffix cannot collide with generated ones.
            return;
        }
        if (sequence > counters.getInt(prefix)) {
            counters.put(prefix, sequence);
        }
    }

    @Override
    public void reset() {
        counters.clear();
    }
}
