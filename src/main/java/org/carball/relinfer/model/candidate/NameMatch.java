package org.carball.relinfer.model.candidate;

public record NameMatch(String targetTable, double similarity, NamingRule rule) {
}
