package com.wechaty.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drain-once scratch buffer a plugin reports results through.
 *
 * <p>
 * Values written under the same key between two drains overwrite each other;
 * this is not a queue. {@link #take()} hands over everything written since the
 * previous take and leaves the buffer empty.
 * </p>
 */
public class PluginOutput {

    private Map<String, Object> values = new LinkedHashMap<>();

    public synchronized void put(String key, Object value) {
        values.put(key, value);
    }

    public synchronized void putAll(Map<String, ?> entries) {
        values.putAll(entries);
    }

    public synchronized boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Atomically return the buffered values and clear the buffer.
     */
    public synchronized Map<String, Object> take() {
        Map<String, Object> drained = Collections.unmodifiableMap(values);
        values = new LinkedHashMap<>();
        return drained;
    }
}
