package org.carball.relinfer.ddl;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * PostgreSQL identifier helpers.
 */
public final class SqlIdentifiers {

    public static final int POSTGRES_MAX_IDENTIFIER_LENGTH = 63;

    private SqlIdentifiers() {
    }

    /**
     * Double-quotes an identifier, doubling embedded quotes, so reserved words
     * and mixed case survive.
     */
    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String qualified(String schema, String table) {
        return schema == null || schema.isEmpty() ? quote(table) : quote(schema) + "." + quote(table);
    }

    /**
     * Lower-cases a generated identifier and trims it to the byte limit.
     */
    public static String generated(String identifier, int maxLength) {
        String lower = identifier.toLowerCase(Locale.ROOT);
        return truncate(lower, maxLength);
    }

    public static String truncate(String identifier, int maxLength) {
        if (identifier.getBytes(StandardCharsets.UTF_8).length <= maxLength) {
            return identifier;
        }
        StringBuilder sb = new StringBuilder();
        int bytes = 0;
        for (int i = 0; i < identifier.length(); ) {
            int codePoint = identifier.codePointAt(i);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > maxLength) {
                break;
            }
            sb.appendCodePoint(codePoint);
            bytes += size;
            i += Character.charCount(codePoint);
        }
        return sb.toString();
    }
}
