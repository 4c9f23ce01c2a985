package com.github.rudygunawan.memoizor.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The {@code key|json} line file shared by the file-backed controllers. Not thread-safe; callers
 * serialize access.
 *
 * <p>Keys are written with {@code toString()}. The delimiter, line terminators and {@code '%'} are
 * percent-escaped ({@code a|b} becomes {@code a%7Cb}), so every record stays on one line and the
 * first delimiter always ends the key. Values are read back as {@code valueType}.
 */
final class StoreFile {
    static final char DELIMITER = '|';
    static final String LINE_SEPARATOR = System.lineSeparator();

    private static final char ESCAPE = '%';

    private final Path path;
    private final ObjectMapper mapper;
    private final JavaType valueType;

    StoreFile(Path path, ObjectMapper mapper, JavaType valueType) {
        this.path = path;
        this.mapper = mapper;
        this.valueType = valueType;
    }

    Path path() {
        return path;
    }

    /**
     * Reads every record. A key written more than once keeps its last value; lines without a
     * delimiter are skipped. Also terminates the last line if the file does not end with one, so the
     * next append starts on a fresh line.
     */
    Map<Object, Object> load() {
        Map<Object, Object> records = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            return records;
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            for (String line : content.split("\\R")) {
                int delimiter = line.indexOf(DELIMITER);
                if (delimiter < 0) {
                    continue;
                }
                String value = line.substring(delimiter + 1);
                records.put(decodeKey(line.substring(0, delimiter)),
                        value.isEmpty() ? null : mapper.readValue(value, valueType));
            }
            if (!content.isEmpty() && !content.endsWith("\n") && !content.endsWith("\r")) {
                Files.writeString(path, LINE_SEPARATOR, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load memoizor store " + path, e);
        }
        return records;
    }

    /**
     * Serializes one record. Fails before any I/O, so an unserializable value never leaves a partial
     * line behind.
     */
    String format(Object key, Object value) {
        try {
            return encodeKey(key) + DELIMITER + mapper.writeValueAsString(value) + LINE_SEPARATOR;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize value stored under " + key, e);
        }
    }

    void append(String line) {
        try {
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to memoizor store " + path, e);
        }
    }

    /**
     * Rewrites the file without any line for {@code key}.
     */
    void remove(Object key) {
        if (!Files.exists(path)) {
            return;
        }
        String encoded = encodeKey(key);
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            List<String> kept = lines.stream()
                    .filter(line -> !encoded.equals(keyPart(line)))
                    .collect(Collectors.toList());
            if (kept.size() == lines.size()) {
                return;
            }
            StringBuilder content = new StringBuilder();
            for (String line : kept) {
                content.append(line).append(LINE_SEPARATOR);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rewrite memoizor store " + path, e);
        }
    }

    void truncate() {
        try {
            Files.writeString(path, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to truncate memoizor store " + path, e);
        }
    }

    /**
     * Returns the encoded key of {@code line}, or {@code null} for a line without a delimiter.
     */
    private static String keyPart(String line) {
        int delimiter = line.indexOf(DELIMITER);
        return delimiter < 0 ? null : line.substring(0, delimiter);
    }

    static String encodeKey(Object key) {
        String text = String.valueOf(key);
        StringBuilder encoded = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean escape = c == ESCAPE || c == DELIMITER || isLineTerminator(c);
            if (escape && encoded == null) {
                encoded = new StringBuilder(text.length() + 8).append(text, 0, i);
            }
            if (escape) {
                encoded.append(ESCAPE)
                        .append(c > 0xFF ? String.format("u%04X", (int) c) : String.format("%02X", (int) c));
            } else if (encoded != null) {
                encoded.append(c);
            }
        }
        return encoded == null ? text : encoded.toString();
    }

    static String decodeKey(String encoded) {
        if (encoded.indexOf(ESCAPE) < 0) {
            return encoded;
        }
        StringBuilder key = new StringBuilder(encoded.length());
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c == ESCAPE && isHex(encoded, i + 1, 2)) {
                key.append((char) Integer.parseInt(encoded.substring(i + 1, i + 3), 16));
                i += 2;
            } else if (c == ESCAPE && i + 1 < encoded.length() && encoded.charAt(i + 1) == 'u'
                    && isHex(encoded, i + 2, 4)) {
                key.append((char) Integer.parseInt(encoded.substring(i + 2, i + 6), 16));
                i += 5;
            } else {
                key.append(c);
            }
        }
        return key.toString();
    }

    // Every single char \R matches
    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == 0x0B || c == '\f' || c == 0x85 || c == 0x2028 || c == 0x2029;
    }

    private static boolean isHex(String text, int from, int count) {
        if (from + count > text.length()) {
            return false;
        }
        for (int i = from; i < from + count; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
