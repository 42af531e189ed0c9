package org.carball.relinfer.analyzer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * snake_case conversion, English singularization and edit-distance similarity
 * for table and column names.
 */
public final class NameNormalizer {

    private static final Map<String, String> IRREGULAR_PLURALS = Map.of(
            "people", "person",
            "children", "child",
            "men", "man",
            "women", "woman",
            "teeth", "tooth",
            "feet", "foot",
            "geese", "goose",
            "mice", "mouse",
            "criteria", "criterion");

    private NameNormalizer() {
        // Utility class - prevent instantiation
    }

    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        return name
                .replaceAll("[\\s\\-.]+", "_")
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replaceAll("([0-9])([A-Z])", "$1_$2")
                .replaceAll("([A-Za-z])([0-9])", "$1_$2")
                .replaceAll("([0-9])([A-Za-z])", "$1_$2")
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
                .replaceAll("[^a-zA-Z0-9_]", "_")
                .toLowerCase(Locale.ROOT)
                .replaceAll("_+", "_")
                .replaceAll("^_+|_+$", "");
    }

    public static String toSingular(String word) {
        if (word == null || word.length() <= 2) {
            return word;
        }

        String irregular = IRREGULAR_PLURALS.get(word);
        if (irregular != null) {
            return irregular;
        }

        if (word.endsWith("ies") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("ves")) {
            return word.substring(0, word.length() - 3) + "f";
        }
        if (word.endsWith("oes")
                || (word.endsWith("ses") && word.length() > 3)
                || word.endsWith("xes")
                || word.endsWith("ches")
                || word.endsWith("shes")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us")) {
            return word.substring(0, word.length() - 1);
        }

        return word;
    }

    /**
     * snake_case form with every word singularized: {@code "OrderItems"} becomes {@code "order_item"}.
     */
    public static String singularSnake(String name) {
        String snake = toSnakeCase(name);
        if (snake == null || snake.isEmpty()) {
            return snake;
        }
        return Arrays.stream(snake.split("_"))
                .map(NameNormalizer::toSingular)
                .collect(Collectors.joining("_"));
    }

    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Normalized similarity in [0, 1]: {@code (longer - distance) / longer}.
     */
    public static double similarity(String a, String b) {
        String longer = a.length() >= b.length() ? a : b;
        if (longer.isEmpty()) {
            return 1.0;
        }
        return (longer.length() - levenshtein(a, b)) / (double) longer.length();
    }
}
