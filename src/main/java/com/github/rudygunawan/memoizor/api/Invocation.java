package com.github.rudygunawan.memoizor.api;

import java.util.Arrays;

/**
 * One call of a memoized function as seen by the original target: the bound receiver, if any, and
 * the arguments exactly as the caller passed them.
 */
public final class Invocation {
    private final Object receiver;
    private final Object[] args;

    public Invocation(Object receiver, Object[] args) {
        this.receiver = receiver;
        this.args = args == null ? new Object[0] : args.clone();
    }

    /**
     * Returns the receiver configured with {@code MemoizorBuilder.binding(Object)}, or {@code null}.
     */
    @SuppressWarnings("unchecked")
    public <T> T receiver() {
        return (T) receiver;
    }

    /**
     * Returns the argument at {@code index}.
     *
     * @throws IndexOutOfBoundsException if there is no such argument
     */
    @SuppressWarnings("unchecked")
    public <T> T arg(int index) {
        return (T) args[index];
    }

    public int argCount() {
        return args.length;
    }

    /**
     * Returns a copy of the argument array.
     */
    public Object[] args() {
        return args.clone();
    }

    @Override
    public String toString() {
        return "Invocation{receiver=" + receiver + ", args=" + Arrays.toString(args) + '}';
    }
}
