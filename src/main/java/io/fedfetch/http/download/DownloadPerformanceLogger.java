package io.fedfetch.http.download;

import io.fedfetch.http.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the timing record of each completed download to a dedicated logger so it can be
 * routed to a metrics pipeline separately from the application log.
 */
final class DownloadPerformanceLogger {

    static final String LOGGER_NAME = "io.fedfetch.http.download.performance";

    private static final Logger perfLog = LoggerFactory.getLogger(LOGGER_NAME);

    private DownloadPerformanceLogger() {
    }

    /**
     * @param url the redacted URL; only its host and path are logged
     */
    static void logDownloadEnd(String url, long durationMs, long size) {
        String[] hostAndPath = UrlUtils.hostAndPath(url);
        perfLog.info("timing.download.end durationMs={} host={} path={} size={}",
            durationMs, hostAndPath[0], hostAndPath[1], size);
    }
}
