package org.carball.relinfer.progress;

/**
 * One-way progress callback. Implementations must return promptly; the engine
 * never waits for an acknowledgment.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NO_OP = event -> { };

    void report(ProgressEvent event);
}
