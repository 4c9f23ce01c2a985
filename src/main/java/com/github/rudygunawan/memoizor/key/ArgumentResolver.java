package com.github.rudygunawan.memoizor.key;

import com.github.rudygunawan.memoizor.api.ArgumentCoercer;
import com.github.rudygunawan.memoizor.model.MemoOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a raw argument array into the resolved list used for key derivation and storage.
 *
 * <p>Steps run in this order:
 * <ol>
 *   <li>truncate to {@code maxArgs} arguments
 *   <li>coerce each remaining argument
 *   <li>drop arguments whose position is listed in {@code ignoreArgs}
 * </ol>
 * Because truncation comes first, {@code maxArgs = 1} with {@code ignoreArgs = [0]} resolves every
 * call to the empty list, so all calls share one cache entry.
 */
public final class ArgumentResolver {

    private ArgumentResolver() {
    }

    /**
     * @param rawArgs the arguments as passed by the caller; {@code null} is treated as none
     * @param options the options to apply
     * @return an unmodifiable list, possibly containing nulls
     */
    public static List<Object> resolve(Object[] rawArgs, MemoOptions options) {
        Object[] args = rawArgs == null ? new Object[0] : rawArgs;
        int count = options.hasMaxArgs() ? Math.min(args.length, options.getMaxArgs()) : args.length;

        List<Object> resolved = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Object arg = coerce(args[i], i, options);
            if (!options.isIgnored(i)) {
                resolved.add(arg);
            }
        }
        return Collections.unmodifiableList(resolved);
    }

    private static Object coerce(Object arg, int index, MemoOptions options) {
        if (options.getCoercer() != null) {
            return options.getCoercer().coerce(arg, index);
        }
        List<ArgumentCoercer> coercers = options.getCoercers();
        if (coercers != null && index < coercers.size() && coercers.get(index) != null) {
            return coercers.get(index).coerce(arg, index);
        }
        return arg;
    }
}
