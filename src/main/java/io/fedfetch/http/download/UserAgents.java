package io.fedfetch.http.download;

import io.fedfetch.http.config.DownloadClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Builds the User-Agent header sent with downloads.
 */
public final class UserAgents {

    private static final Logger log = LoggerFactory.getLogger(UserAgents.class);

    static final String LIBRARY_NAME = "fedfetch-http";
    private static final String VERSION_RESOURCE = "/fedfetch-http-version.properties";
    private static final String UNKNOWN_VERSION = "unknown";

    private static final String VERSION = loadVersion();

    private UserAgents() {
    }

    /**
     * Composes {@code <user.agent> fedfetch-http/<version>}, an optional extra component,
     * and {@code (<app.name>)} when an application name is configured.
     *
     * @param extra additional product token, may be null
     */
    public static String build(DownloadClientConfig config, String extra) {
        StringBuilder userAgent = new StringBuilder(config.getUserAgent())
            .append(' ').append(LIBRARY_NAME).append('/').append(VERSION);

        if (extra != null && !extra.trim().isEmpty()) {
            userAgent.append(' ').append(extra.trim());
        }

        String appName = config.getAppName();
        if (appName != null && !appName.trim().isEmpty()) {
            userAgent.append(" (").append(appName.trim()).append(')');
        }

        return userAgent.toString();
    }

    public static String version() {
        return VERSION;
    }

    private static String loadVersion() {
        try (InputStream in = UserAgents.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in == null) {
                return UNKNOWN_VERSION;
            }
            Properties properties = new Properties();
            properties.load(in);
            String version = properties.getProperty("version", UNKNOWN_VERSION).trim();
            // unfiltered resource when running from an IDE
            return version.isEmpty() || version.startsWith("${") ? UNKNOWN_VERSION : version;
        } catch (IOException e) {
            log.warn("Unable to read {}: {}", VERSION_RESOURCE, e.getMessage());
            return UNKNOWN_VERSION;
        }
    }
}
