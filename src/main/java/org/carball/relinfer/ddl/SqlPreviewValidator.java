package org.carball.relinfer.ddl;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses generated statements so malformed previews are noticed. Statements the
 * parser rejects are reported but kept.
 */
@Slf4j
public class SqlPreviewValidator {

    public List<String> validate(List<String> statements) {
        List<String> problems = new ArrayList<>();
        for (String statement : statements) {
            try {
                CCJSqlParserUtil.parse(statement);
            } catch (JSQLParserException e) {
                String firstLine = e.getMessage() != null ? e.getMessage().lines().findFirst().orElse("") : "";
                log.warn("Generated statement could not be parsed: {} ({})", statement, firstLine);
                problems.add(statement);
            }
        }
        return problems;
    }
}
