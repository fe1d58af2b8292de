package de.bsommerfeld.upvision.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.upvision.core.util.StorageUtils;

import java.nio.file.Path;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    /** Directory scanned for checkpoint files. */
    @JsonProperty("checkpoint-dir")
    private String checkpointDir = StorageUtils.getModelsDir(StorageUtils.APP_NAME).toString();

    /** File extension of checkpoint files, including the dot. */
    @JsonProperty("checkpoint-extension")
    private String checkpointExtension = ".pth";

    /** Device used when none is requested explicitly: auto, cpu, cuda, gpu or cuda:N. */
    @JsonProperty("default-device")
    private String defaultDevice = "auto";

    /** Interval of the observer's event poll loop. */
    @JsonProperty("poll-interval-millis")
    private long pollIntervalMillis = 100;

    public String getCheckpointDir() {
        return checkpointDir;
    }

    public void setCheckpointDir(String checkpointDir) {
        this.checkpointDir = checkpointDir;
    }

    public Path checkpointDirectory() {
        return Path.of(checkpointDir);
    }

    public String getCheckpointExtension() {
        return checkpointExtension;
    }

    public void setCheckpointExtension(String checkpointExtension) {
        this.checkpointExtension = checkpointExtension;
    }

    public String getDefaultDevice() {
        return defaultDevice;
    }

    public void setDefaultDevice(String defaultDevice) {
        this.defaultDevice = defaultDevice;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public void setPollIntervalMillis(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
    }
}
