package org.carball.relinfer.ddl;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.analyzer.NameNormalizer;
import org.carball.relinfer.config.DdlOptions;
import org.carball.relinfer.model.dataset.ColumnShape;
import org.carball.relinfer.model.dataset.Table;
import org.carball.relinfer.model.proposal.RelationshipProposal;
import org.carball.relinfer.model.proposal.RelationshipType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.carball.relinfer.ddl.SqlIdentifiers.quote;

/**
 * Renders PostgreSQL statements that turn a raw link column into a foreign key
 * or a junction table. Backfills only copy values present in the target key
 * set, so the constraints hold on existing data. New key columns take the type
 * of the key they reference when the store declares one.
 */
@Slf4j
public class DdlPreviewGenerator {

    private final DdlOptions options;
    private final SqlPreviewValidator validator;

    public DdlPreviewGenerator(DdlOptions options) {
        this(options, new SqlPreviewValidator());
    }

    public DdlPreviewGenerator(DdlOptions options, SqlPreviewValidator validator) {
        this.options = options;
        this.validator = validator;
    }

    public DdlPreview generate(RelationshipProposal proposal, Table source, Table target,
                               ColumnShape shape, Collection<Table> allTables) {
        DdlPreview preview = switch (proposal.getRelationshipType()) {
            case ONE_TO_ONE, MANY_TO_ONE -> foreignKeyOnSource(proposal, source, target, shape);
            case ONE_TO_MANY -> foreignKeyOnTarget(proposal, source, target, shape);
            case MANY_TO_MANY -> junctionTable(proposal, source, target, shape, allTables);
        };

        List<String> unparsable = validator.validate(preview.statements());
        log.debug("Generated {} statements for {} ({} unparsable)",
                preview.statements().size(), proposal.key(), unparsable.size());
        return preview;
    }

    private DdlPreview foreignKeyOnSource(RelationshipProposal proposal, Table source, Table target, ColumnShape shape) {
        String rawColumn = proposal.getSourceField();
        String targetKey = target.getKeyColumn();
        String fkColumn = foreignKeyColumnName(source, target.getName());
        String sourceValue = shape.isArray() ? quote(rawColumn) + "[1]" : quote(rawColumn);

        List<String> statements = new ArrayList<>();
        statements.add("ALTER TABLE " + tableName(source)
                + " ADD COLUMN " + quote(fkColumn) + " " + keyType(target));
        if (options.isIncludeBackfill()) {
            statements.add("UPDATE " + tableName(source)
                    + " SET " + quote(fkColumn) + " = " + converted(sourceValue, target)
                    + " WHERE " + comparable(sourceValue, target)
                    + " IN (SELECT " + comparable(quote(targetKey), target) + " FROM " + tableName(target) + ")");
        }
        statements.add("ALTER TABLE " + tableName(source)
                + " ADD CONSTRAINT " + quote(constraintName("fk", source.getName(), fkColumn))
                + " FOREIGN KEY (" + quote(fkColumn) + ")"
                + " REFERENCES " + tableName(target) + " (" + quote(targetKey) + ")");
        boolean oneToOne = proposal.getRelationshipType() == RelationshipType.ONE_TO_ONE;
        if (oneToOne) {
            statements.add("ALTER TABLE " + tableName(source)
                    + " ADD CONSTRAINT " + quote(constraintName("uq", source.getName(), fkColumn))
                    + " UNIQUE (" + quote(fkColumn) + ")");
        }
        statements.add("ALTER TABLE " + tableName(source) + " DROP COLUMN " + quote(rawColumn));

        String action = String.format("Add %sforeign key column %s.%s referencing %s.%s, backfill it from %s%s and drop %s",
                oneToOne ? "unique " : "", source.getName(), fkColumn, target.getName(), targetKey, rawColumn,
                shape.isArray() ? " (first element)" : "", rawColumn);
        return new DdlPreview(action, List.copyOf(statements));
    }

    /**
     * Each target row is referenced by at most one source row, so the target
     * carries the foreign key back to the source.
     */
    private DdlPreview foreignKeyOnTarget(RelationshipProposal proposal, Table source, Table target, ColumnShape shape) {
        String rawColumn = proposal.getSourceField();
        String sourceKey = source.getKeyColumn();
        String fkColumn = foreignKeyColumnName(target, source.getName());
        String targetKey = comparable("t." + quote(target.getKeyColumn()), target);
        String match = shape.isArray()
                ? targetKey + " = ANY(" + comparableArray("s." + quote(rawColumn), target) + ")"
                : targetKey + " = " + comparable("s." + quote(rawColumn), target);

        List<String> statements = new ArrayList<>();
        statements.add("ALTER TABLE " + tableName(target)
                + " ADD COLUMN " + quote(fkColumn) + " " + keyType(source));
        if (options.isIncludeBackfill()) {
            statements.add("UPDATE " + tableName(target) + " t"
                    + " SET " + quote(fkColumn) + " = s." + quote(sourceKey)
                    + " FROM " + tableName(source) + " s"
                    + " WHERE " + match);
        }
        statements.add("ALTER TABLE " + tableName(target)
                + " ADD CONSTRAINT " + quote(constraintName("fk", target.getName(), fkColumn))
                + " FOREIGN KEY (" + quote(fkColumn) + ")"
                + " REFERENCES " + tableName(source) + " (" + quote(sourceKey) + ")");
        statements.add("ALTER TABLE " + tableName(source) + " DROP COLUMN " + quote(rawColumn));

        String action = String.format("Add foreign key column %s.%s referencing %s.%s, backfill it from %s.%s and drop %s.%s",
                target.getName(), fkColumn, source.getName(), sourceKey,
                source.getName(), rawColumn, source.getName(), rawColumn);
        return new DdlPreview(action, List.copyOf(statements));
    }

    private DdlPreview junctionTable(RelationshipProposal proposal, Table source, Table target,
                                     ColumnShape shape, Collection<Table> allTables) {
        String rawColumn = proposal.getSourceField();
        String junction = junctionTableName(source.getName(), target.getName(), allTables);
        String junctionTable = SqlIdentifiers.qualified(source.getSchema(), junction);
        String sourceColumn = generated(NameNormalizer.singularSnake(source.getName()) + options.getForeignKeySuffix());
        String targetColumn = generated(NameNormalizer.singularSnake(target.getName()) + options.getForeignKeySuffix());
        if (sourceColumn.equals(targetColumn)) {
            targetColumn = generated(options.getSelfReferencePrefix() + targetColumn);
        }

        String value = shape.isArray() ? "u.value" : "s." + quote(rawColumn);
        String from = shape.isArray()
                ? tableName(source) + " s CROSS JOIN LATERAL unnest(s." + quote(rawColumn) + ") AS u(value)"
                : tableName(source) + " s";

        List<String> statements = new ArrayList<>();
        statements.add("CREATE TABLE " + junctionTable + " ("
                + quote(sourceColumn) + " " + keyType(source) + " NOT NULL"
                + " REFERENCES " + tableName(source) + " (" + quote(source.getKeyColumn()) + ") ON DELETE CASCADE, "
                + quote(targetColumn) + " " + keyType(target) + " NOT NULL"
                + " REFERENCES " + tableName(target) + " (" + quote(target.getKeyColumn()) + ") ON DELETE CASCADE, "
                + "CONSTRAINT " + quote(constraintName("uq", junction, "pair"))
                + " UNIQUE (" + quote(sourceColumn) + ", " + quote(targetColumn) + "))");
        if (options.isIncludeBackfill()) {
            statements.add("INSERT INTO " + junctionTable + " (" + quote(sourceColumn) + ", " + quote(targetColumn) + ")"
                    + " SELECT DISTINCT s." + quote(source.getKeyColumn()) + ", " + converted(value, target)
                    + " FROM " + from
                    + " WHERE " + comparable(value, target)
                    + " IN (SELECT " + comparable(quote(target.getKeyColumn()), target) + " FROM " + tableName(target) + ")");
        }
        statements.add("ALTER TABLE " + tableName(source) + " DROP COLUMN " + quote(rawColumn));

        String action = String.format("Create junction table %s linking %s and %s, backfill it from %s.%s and drop %s.%s",
                junction, source.getName(), target.getName(),
                source.getName(), rawColumn, source.getName(), rawColumn);
        return new DdlPreview(action, List.copyOf(statements));
    }

    private static String tableName(Table table) {
        return SqlIdentifiers.qualified(table.getSchema(), table.getName());
    }

    /**
     * Type of a column referencing {@code referenced}: its key column's declared
     * type, or the configured default for untyped stores.
     */
    private String keyType(Table referenced) {
        return referenced.keyColumnType().orElse(options.getKeyColumnType());
    }

    // Raw link values and typed keys only compare reliably as text.
    private static String comparable(String expression, Table referenced) {
        return referenced.keyColumnType().isPresent() ? "CAST(" + expression + " AS TEXT)" : expression;
    }

    private static String comparableArray(String expression, Table referenced) {
        return referenced.keyColumnType().isPresent() ? "CAST(" + expression + " AS TEXT[])" : expression;
    }

    private static String converted(String expression, Table referenced) {
        return referenced.keyColumnType()
                .map(type -> "CAST(" + expression + " AS " + type + ")")
                .orElse(expression);
    }

    private String foreignKeyColumnName(Table owner, String referencedTable) {
        String name = generated(NameNormalizer.singularSnake(referencedTable) + options.getForeignKeySuffix());
        if (owner.hasColumn(name)) {
            name = generated(name + options.getCollisionSuffix());
        }
        return name;
    }

    private String junctionTableName(String source, String target, Collection<Table> allTables) {
        String name = generated(NameNormalizer.toSnakeCase(source) + "_" + NameNormalizer.toSnakeCase(target));
        String candidate = name;
        if (allTables.stream().anyMatch(t -> t.getName().equalsIgnoreCase(candidate))) {
            name = generated(name + options.getJunctionCollisionSuffix());
        }
        return name;
    }

    private String constraintName(String prefix, String table, String column) {
        return generated(prefix + "_" + NameNormalizer.toSnakeCase(table) + "_" + column);
    }

    private String generated(String identifier) {
        return SqlIdentifiers.generated(identifier, options.getMaxIdentifierLength());
    }
}
