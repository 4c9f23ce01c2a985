package com.github.rudygunawan.memoizor.listener;

import java.util.Collections;
import java.util.List;

/**
 * Immutable notification emitted by a memoizor engine. Fields that do not apply to the event type
 * are {@code null} (or empty, for {@link #getEvictedKeys()}).
 */
public class MemoizorEvent {
    private final EventType type;
    private final String name;
    private final Object key;
    private final Object value;
    private final List<Object> args;
    private final List<Object> evictedKeys;

    public MemoizorEvent(EventType type, String name, Object key, Object value, List<Object> args,
                         List<Object> evictedKeys) {
        this.type = type;
        this.name = name;
        this.key = key;
        this.value = value;
        this.args = args;
        this.evictedKeys = evictedKeys == null ? Collections.emptyList() : Collections.unmodifiableList(evictedKeys);
    }

    public static MemoizorEvent of(EventType type, String name) {
        return new MemoizorEvent(type, name, null, null, null, null);
    }

    public EventType getType() {
        return type;
    }

    /**
     * Returns the name of the memoized function that emitted this event.
     */
    public String getName() {
        return name;
    }

    public Object getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Returns the resolved argument list, or {@code null} when the operation was keyed directly.
     */
    public List<Object> getArgs() {
        return args;
    }

    public List<Object> getEvictedKeys() {
        return evictedKeys;
    }

    @Override
    public String toString() {
        return "MemoizorEvent{type=" + type + ", name=" + name + ", key=" + key + '}';
    }
}
