package io.fedfetch.http.error;

import java.io.IOException;

/**
 * Base class for failures surfaced by the download client.
 * <p>
 * The category classifies the failure for the orchestration layer so it can decide
 * between retrying the job at a higher level and aborting it.
 */
public class DownloadException extends IOException {

    private final String category;
    private final String level;

    public DownloadException(String message, String category) {
        this(message, category, "Error", null);
    }

    public DownloadException(String message, String category, Throwable cause) {
        this(message, category, "Error", cause);
    }

    protected DownloadException(String message, String category, String level, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.level = level;
    }

    public String getCategory() {
        return category;
    }

    public String getLevel() {
        return level;
    }
}
