package com.phillippitts.batchanalyzer.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where and how often run progress is checkpointed.
 */
@ConfigurationProperties(prefix = "batch.checkpoint")
@Validated
public class CheckpointProperties {

    /** Directory holding one JSON file per run token. */
    @NotBlank
    private String directory = ".batch-checkpoints";

    /** A checkpoint is written every N processed items. */
    @Min(value = 1, message = "Checkpoint interval must be at least 1")
    private int interval = 10;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getInterval() {
        return interval;
    }

    public void setInterval(int interval) {
        this.interval = interval;
    }
}
