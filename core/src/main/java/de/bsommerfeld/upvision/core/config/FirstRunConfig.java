package de.bsommerfeld.upvision.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.upvision.core.util.StorageUtils;

import java.nio.file.Path;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FirstRunConfig {

    @JsonProperty("enabled")
    private boolean enabled = true;

    /** Image processed by the self-check on the first start. */
    @JsonProperty("sample-image")
    private String sampleImage = StorageUtils.getAssetsDir(StorageUtils.APP_NAME)
            .resolve("sample.jpg").toString();

    /** Marker file name, resolved against the application data directory. */
    @JsonProperty("sentinel-file")
    private String sentinelFile = ".first_run_complete";

    @JsonProperty("shutdown-delay-millis")
    private long shutdownDelayMillis = 1500;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSampleImage() {
        return sampleImage;
    }

    public void setSampleImage(String sampleImage) {
        this.sampleImage = sampleImage;
    }

    public Path sampleImagePath() {
        return Path.of(sampleImage);
    }

    public String getSentinelFile() {
        return sentinelFile;
    }

    public void setSentinelFile(String sentinelFile) {
        this.sentinelFile = sentinelFile;
    }

    public long getShutdownDelayMillis() {
        return shutdownDelayMillis;
    }

    public void setShutdownDelayMillis(long shutdownDelayMillis) {
        this.shutdownDelayMillis = shutdownDelayMillis;
    }
}
