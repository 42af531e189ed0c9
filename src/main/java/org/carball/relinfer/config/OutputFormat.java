package org.carball.relinfer.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
