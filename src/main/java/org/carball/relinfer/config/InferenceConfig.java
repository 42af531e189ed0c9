package org.carball.relinfer.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class InferenceConfig {
    private Path snapshotFile;
    private Path linksFile;
    private Path ddlFile;
    private String outputFile = "relationship-report";
    private OutputFormat outputFormat = OutputFormat.BOTH;
    private String profileName;
    private Path thresholdsFile;
    private boolean verbose;
}
