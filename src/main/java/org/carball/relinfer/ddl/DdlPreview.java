package org.carball.relinfer.ddl;

import java.util.List;

/**
 * Statements proposed for one relationship, in execution order, without trailing semicolons.
 */
public record DdlPreview(String proposedAction, List<String> statements) {

    public String toSql() {
        StringBuilder sql = new StringBuilder();
        for (String statement : statements) {
            sql.append(statement).append(";\n");
        }
        return sql.toString();
    }
}
