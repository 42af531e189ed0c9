package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.model.candidate.NameMatch;
import org.carball.relinfer.model.candidate.NamingRule;
import org.carball.relinfer.model.dataset.Table;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Proposes a target table for a column from names alone. The rules are tried in
 * order: exact table name, key suffix, edit distance. A column never matches its
 * own table by exact name or edit distance; a key suffix may point at it.
 */
@Slf4j
public class NamingPatternMatcher {

    private static final List<String> KEY_SUFFIXES = List.of("_id", "_ids", "_ref", "_refs", "_key", "_keys");
    private static final double KEY_SUFFIX_SIMILARITY = 0.9;

    private final double similarityThreshold;

    public NamingPatternMatcher(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public Optional<NameMatch> match(String tableName, String columnName, List<Table> tables) {
        String column = NameNormalizer.singularSnake(columnName);
        if (column == null || column.isEmpty()) {
            return Optional.empty();
        }

        // 1. Column named after a table
        for (Table table : sortedByName(tables)) {
            if (!table.getName().equals(tableName) && column.equals(NameNormalizer.singularSnake(table.getName()))) {
                return found(columnName, new NameMatch(table.getName(), 1.0, NamingRule.EXACT_TABLE_NAME));
            }
        }

        // 2. <base>_id, <base>Id, <base>_ref, <base>_key
        String base = stripKeySuffix(NameNormalizer.toSnakeCase(columnName));
        if (base != null) {
            String singularBase = NameNormalizer.singularSnake(base);
            for (Table table : sortedByName(tables)) {
                if (singularBase.equals(NameNormalizer.singularSnake(table.getName()))) {
                    return found(columnName, new NameMatch(table.getName(), KEY_SUFFIX_SIMILARITY, NamingRule.KEY_SUFFIX));
                }
            }
        }

        // 3. Closest table name by edit distance
        String probe = base != null ? NameNormalizer.singularSnake(base) : column;
        NameMatch best = null;
        for (Table table : sortedByName(tables)) {
            if (table.getName().equals(tableName)) {
                continue;
            }
            double similarity = NameNormalizer.similarity(probe, NameNormalizer.singularSnake(table.getName()));
            if (similarity >= similarityThreshold && (best == null || similarity > best.similarity())) {
                best = new NameMatch(table.getName(), similarity, NamingRule.EDIT_DISTANCE);
            }
        }
        return best != null ? found(columnName, best) : Optional.empty();
    }

    private static String stripKeySuffix(String snakeColumn) {
        for (String suffix : KEY_SUFFIXES) {
            if (snakeColumn.endsWith(suffix) && snakeColumn.length() > suffix.length()) {
                return snakeColumn.substring(0, snakeColumn.length() - suffix.length());
            }
        }
        return null;
    }

    private static List<Table> sortedByName(List<Table> tables) {
        return tables.stream().sorted(Comparator.comparing(Table::getName)).toList();
    }

    private static Optional<NameMatch> found(String columnName, NameMatch match) {
        log.debug("Column '{}' matches table '{}' by {} ({})",
                columnName, match.targetTable(), match.rule().getDescription(), match.similarity());
        return Optional.of(match);
    }
}
