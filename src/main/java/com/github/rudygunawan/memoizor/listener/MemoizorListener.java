package com.github.rudygunawan.memoizor.listener;

/**
 * Receives the events a memoized function emits at each step of its lifecycle.
 *
 * <p>Listeners are called synchronously on the thread performing the operation, so they should be
 * fast. Exceptions thrown by a listener are logged and swallowed; the operation continues.
 * <pre>{@code
 * MemoizedFunction<User> users = Memoizor.newBuilder()
 *     .maxRecords(1000)
 *     .listener(event -> {
 *         if (event.getType() == EventType.OVERFLOW) {
 *             log.info("evicting " + event.getEvictedKeys());
 *         }
 *     })
 *     .build(inv -> repository.load(inv.arg(0)));
 * }</pre>
 */
@FunctionalInterface
public interface MemoizorListener {

    void onEvent(MemoizorEvent event);
}
