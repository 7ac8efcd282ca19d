package io.concforge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thread-local key/value context that follows work into leaf tasks.
 *
 * <p>{@link ConcRuntime#runConc(Conc)} captures the caller's context once and installs it in every
 * leaf it spawns; each leaf's changes stay on that leaf's thread and are discarded when it
 * finishes.
 *
 * <p>The stored map is never mutated in place: {@link #put} and {@link #remove} replace it, which
 * makes capturing a snapshot free.
 */
public final class Context {

    private static final ThreadLocal<Map<String, Object>> LOCAL = new ThreadLocal<Map<String, Object>>();

    private Context() {
    }

    /**
     * Binds {@code key} on the current thread. A {@code null} value removes the key.
     */
    public static void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            remove(key);
            return;
        }
        Map<String, Object> next = new LinkedHashMap<String, Object>(current());
        next.put(key, value);
        LOCAL.set(Collections.unmodifiableMap(next));
    }

    @SuppressWarnings("unchecked")
    public static <T> T get(String key) {
        Objects.requireNonNull(key, "key");
        return (T) current().get(key);
    }

    public static void remove(String key) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> map = current();
        if (!map.containsKey(key)) {
            return;
        }
        Map<String, Object> next = new LinkedHashMap<String, Object>(map);
        next.remove(key);
        apply(Collections.unmodifiableMap(next));
    }

    public static void clear() {
        LOCAL.remove();
    }

    /**
     * Immutable view of the current thread's bindings.
     */
    public static Map<String, Object> snapshot() {
        return current();
    }

    static Map<String, Object> capture() {
        return current();
    }

    /**
     * Replaces the current bindings and returns the ones that were replaced.
     */
    static Map<String, Object> install(Map<String, Object> bindings) {
        Map<String, Object> previous = current();
        apply(bindings);
        return previous;
    }

    private static Map<String, Object> current() {
        Map<String, Object> map = LOCAL.get();
        return map == null ? Collections.<String, Object>emptyMap() : map;
    }

    private static void apply(Map<String, Object> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            LOCAL.remove();
        } else {
            LOCAL.set(bindings);
        }
    }
}
