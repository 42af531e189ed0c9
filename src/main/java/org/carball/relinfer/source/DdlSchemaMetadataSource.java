package org.carball.relinfer.source;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.ForeignKeyIndex;
import net.sf.jsqlparser.statement.create.table.Index;
import org.carball.relinfer.exception.ConfigurationException;
import org.carball.relinfer.model.candidate.LinkDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads declared links from the foreign keys of an existing DDL script.
 * A foreign key column holds one reference per row; when it is also unique,
 * each target row is referenced at most once.
 */
@Slf4j
public class DdlSchemaMetadataSource implements SchemaMetadataSource {

    private final String ddl;

    public DdlSchemaMetadataSource(String ddl) {
        this.ddl = ddl;
    }

    public static DdlSchemaMetadataSource fromFile(Path ddlFile) {
        try {
            return new DdlSchemaMetadataSource(Files.readString(ddlFile));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read DDL file " + ddlFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<LinkDescriptor> listDeclaredLinks() {
        List<LinkDescriptor> links = new ArrayList<>();

        try {
            Statements statements = CCJSqlParserUtil.parseStatements(ddl);
            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    extractLinks(createTable, links);
                }
            }
        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new ConfigurationException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        log.info("Extracted {} declared links from DDL", links.size());
        return links;
    }

    private void extractLinks(CreateTable createTable, List<LinkDescriptor> links) {
        String tableName = cleanIdentifier(createTable.getTable().getName());
        Set<String> notNullColumns = new HashSet<>();
        Set<String> uniqueColumns = new HashSet<>();

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                String columnName = cleanIdentifier(colDef.getColumnName());
                List<String> specs = colDef.getColumnSpecs() != null ? colDef.getColumnSpecs() : List.of();
                String joined = String.join(" ", specs).toUpperCase(Locale.ROOT);

                if (joined.contains("NOT NULL") || joined.contains("PRIMARY KEY")) {
                    notNullColumns.add(columnName.toLowerCase(Locale.ROOT));
                }
                if (joined.contains("UNIQUE")) {
                    uniqueColumns.add(columnName.toLowerCase(Locale.ROOT));
                }
            }
        }

        if (createTable.getIndexes() != null) {
            for (Index index : createTable.getIndexes()) {
                if ("UNIQUE".equalsIgnoreCase(index.getType()) && index.getColumnsNames().size() == 1) {
                    uniqueColumns.add(cleanIdentifier(index.getColumnsNames().get(0)).toLowerCase(Locale.ROOT));
                }
            }
        }

        // Inline column REFERENCES
        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                List<String> specs = colDef.getColumnSpecs();
                if (specs == null) {
                    continue;
                }
                for (int i = 0; i < specs.size() - 1; i++) {
                    if (specs.get(i).equalsIgnoreCase("REFERENCES")) {
                        String column = cleanIdentifier(colDef.getColumnName());
                        String target = cleanIdentifier(stripColumnList(specs.get(i + 1)));
                        links.add(toDescriptor(tableName, column, target, notNullColumns, uniqueColumns));
                        break;
                    }
                }
            }
        }

        // Table-level FOREIGN KEY constraints
        if (createTable.getIndexes() != null) {
            for (Index index : createTable.getIndexes()) {
                if (index instanceof ForeignKeyIndex fkIndex
                        && fkIndex.getTable() != null
                        && fkIndex.getColumnsNames() != null
                        && fkIndex.getColumnsNames().size() == 1) {
                    String column = cleanIdentifier(fkIndex.getColumnsNames().get(0));
                    String target = cleanIdentifier(fkIndex.getTable().getName());
                    links.add(toDescriptor(tableName, column, target, notNullColumns, uniqueColumns));
                } else if (index instanceof ForeignKeyIndex fkIndex) {
                    log.warn("Skipping composite foreign key {} on table {}", fkIndex.getName(), tableName);
                }
            }
        }
    }

    private LinkDescriptor toDescriptor(String table, String column, String target,
                                        Set<String> notNullColumns, Set<String> uniqueColumns) {
        String key = column.toLowerCase(Locale.ROOT);
        boolean unique = uniqueColumns.contains(key);
        log.debug("Declared link {}.{} -> {} (unique: {})", table, column, target, unique);
        return new LinkDescriptor(table, column, target,
                false, false, notNullColumns.contains(key),
                Boolean.TRUE, unique ? Boolean.TRUE : null);
    }

    private static String stripColumnList(String reference) {
        int paren = reference.indexOf('(');
        return paren >= 0 ? reference.substring(0, paren) : reference;
    }

    private static String cleanIdentifier(String identifier) {
        if (identifier == null) return null;
        return identifier.replaceAll("[\\[\\]`\"]", "");
    }
}
