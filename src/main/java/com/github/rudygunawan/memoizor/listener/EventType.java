package com.github.rudygunawan.memoizor.listener;

/**
 * The points at which a memoizor engine notifies its listeners.
 */
public enum EventType {
    /** A lookup is about to reach the storage controller. Carries key and resolved args. */
    RETRIEVE,
    /** A lookup finished. Carries key, value (possibly {@code NOT_CACHED}) and resolved args. */
    RETRIEVED,
    /** A value is about to be stored. Carries key, value and resolved args. */
    SAVE,
    /** The record limit was exceeded. Carries the keys about to be evicted. */
    OVERFLOW,
    /** A key is about to be removed. Carries key and resolved args (if known). */
    DELETE,
    /** A key was removed. Carries key and the removed value (possibly {@code NOT_CACHED}). */
    DELETED,
    /** The store is about to be emptied. */
    EMPTY,
    /** Caching was switched on. */
    ENABLE,
    /** Caching was switched off. */
    DISABLE
}
