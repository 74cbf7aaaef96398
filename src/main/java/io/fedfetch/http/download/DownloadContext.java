package io.fedfetch.http.download;

import java.time.Instant;

/**
 * Per-call metadata that travels with a download but is not part of the request itself.
 */
public class DownloadContext {

    private static final DownloadContext EMPTY = new DownloadContext(null, null);

    private final String requestId;
    private final Instant deadline;

    /**
     * @param requestId correlation id added to HTTP(S) URLs and the logging MDC, may be null
     * @param deadline no retry backoff is started that would end after this instant, may be null
     */
    public DownloadContext(String requestId, Instant deadline) {
        this.requestId = requestId;
        this.deadline = deadline;
    }

    public static DownloadContext empty() {
        return EMPTY;
    }

    public static DownloadContext withRequestId(String requestId) {
        return new DownloadContext(requestId, null);
    }

    public String getRequestId() {
        return requestId;
    }

    public Instant getDeadline() {
        return deadline;
    }

    @Override
    public String toString() {
        return String.format("DownloadContext{requestId=%s, deadline=%s}", requestId, deadline);
    }
}
