package org.carball.relinfer.progress;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingProgressSink implements ProgressSink {

    @Override
    public void report(ProgressEvent event) {
        if (event.percentComplete() != null) {
            log.info("[{}] {} ({}%)", event.stage().getDisplayName(), event.message(), event.percentComplete());
        } else {
            log.info("[{}] {}", event.stage().getDisplayName(), event.message());
        }
    }
}
