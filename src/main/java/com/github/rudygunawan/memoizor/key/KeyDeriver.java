package com.github.rudygunawan.memoizor.key;

import com.github.rudygunawan.memoizor.model.KeyMode;
import com.github.rudygunawan.memoizor.model.MemoOptions;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Derives cache keys from resolved argument lists.
 *
 * <ul>
 *   <li>{@link KeyMode#PRIMITIVE}: the arguments' string forms joined with {@code '\u0000'}
 *   <li>custom: the configured {@code KeyGenerator}'s result, used verbatim
 *   <li>{@link KeyMode#DEFAULT}: MD5 hex digest of the normalized signature (see
 *       {@link ArgumentNormalizer})
 * </ul>
 *
 * <p>Digests are memoized per deriver in a small LRU map, so bursts of identical calls hash once.
 */
public class KeyDeriver {
    static final String PRIMITIVE_SEPARATOR = "\u0000";
    private static final int MAX_MEMOIZED_HASHES = 1024;

    private final ArgumentNormalizer normalizer;
    private final Map<String, String> hashes = Collections.synchronizedMap(
            new LinkedHashMap<String, String>(64, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                    return size() > MAX_MEMOIZED_HASHES;
                }
            });

    public KeyDeriver() {
        this(new ArgumentNormalizer());
    }

    public KeyDeriver(ArgumentNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer cannot be null");
    }

    /**
     * @throws NullPointerException if a custom key generator returns null
     */
    public Object derive(List<Object> resolvedArgs, MemoOptions options) {
        if (options.getMode() == KeyMode.PRIMITIVE) {
            return primitiveKey(resolvedArgs);
        }
        if (options.getKeyGenerator() != null) {
            return Objects.requireNonNull(options.getKeyGenerator().generate(options.getUid(), resolvedArgs),
                    "keyGenerator returned a null key");
        }

        String signature = normalizer.normalize(options.getUid(), resolvedArgs);
        String hash = hashes.get(signature);
        if (hash == null) {
            hash = md5Hex(signature);
            hashes.put(signature, hash);
        }
        return hash;
    }

    /**
     * Forgets memoized digests.
     */
    public void reset() {
        hashes.clear();
    }

    static String primitiveKey(List<Object> resolvedArgs) {
        StringJoiner joiner = new StringJoiner(PRIMITIVE_SEPARATOR);
        for (Object arg : resolvedArgs) {
            joiner.add(String.valueOf(arg));
        }
        return joiner.toString();
    }

    static String md5Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
