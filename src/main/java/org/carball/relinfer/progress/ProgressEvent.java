package org.carball.relinfer.progress;

import java.time.Instant;

/**
 * One progress notification. {@code tableName} and {@code percentComplete} are optional.
 */
public record ProgressEvent(
        ProgressStage stage,
        String tableName,
        String message,
        Double percentComplete,
        Instant timestamp
) {

    public static ProgressEvent of(ProgressStage stage, String message) {
        return new ProgressEvent(stage, null, message, null, Instant.now());
    }

    public static ProgressEvent forTable(ProgressStage stage, String tableName, String message, Double percentComplete) {
        return new ProgressEvent(stage, tableName, message, percentComplete, Instant.now());
    }

    public static double percent(long done, long total) {
        return total == 0 ? 100.0 : Math.round(done * 1000.0 / total) / 10.0;
    }
}
