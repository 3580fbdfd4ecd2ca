package de.bsommerfeld.feedsim.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.feedsim.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

public class DatabaseConfig {

    /** SQLite file; empty means {@code <app data>/feedsim.db}. */
    @JsonProperty("path")
    private String path = "";

    @JsonProperty("busy-timeout-ms")
    private int busyTimeoutMs = 5000;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public Path resolvePath() {
        if (path == null || path.isBlank()) {
            return StorageUtils.getDefaultDatabaseFile();
        }
        return Paths.get(path);
    }
}
