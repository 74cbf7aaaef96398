package io.fedfetch.http.util;

import okhttp3.HttpUrl;
import okio.ByteString;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL helpers shared by the downloader and the file retriever.
 */
public final class UrlUtils {

    public static final String REQUEST_ID_PARAMETER = "A-api-request-uuid";

    private static final Pattern HOST_AND_PATH = Pattern.compile(".*://([^/]+)(.*)");

    private UrlUtils() {
    }

    public static boolean isHttp(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public static boolean isFileUrl(String url) {
        return url != null && url.startsWith("file://");
    }

    public static boolean isS3Url(String url) {
        return url != null && url.startsWith("s3://");
    }

    /**
     * Replaces {@code localhost} in the URL, for local development against containers.
     */
    public static String localhostUrl(String url, String localHostname) {
        if (url == null || localHostname == null || localHostname.isEmpty()) {
            return url;
        }
        return url.replace("localhost", localHostname);
    }

    /**
     * Adds or replaces the request id query parameter of an HTTP(S) URL. Other URLs and a
     * null request id leave the URL untouched.
     */
    public static String withRequestId(String url, String requestId) {
        if (requestId == null || !isHttp(url)) {
            return url;
        }
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            return url;
        }
        return parsed.newBuilder()
            .setQueryParameter(REQUEST_ID_PARAMETER, requestId)
            .build()
            .toString();
    }

    /**
     * Splits a URL into host and path for telemetry. Never fails: unparseable URLs
     * yield host {@code Unknown} and an empty path.
     *
     * @return a two element array of host and path (including the query)
     */
    public static String[] hostAndPath(String url) {
        if (url != null) {
            Matcher matcher = HOST_AND_PATH.matcher(url);
            if (matcher.matches()) {
                return new String[] {matcher.group(1), matcher.group(2)};
            }
        }
        return new String[] {"Unknown", ""};
    }

    /**
     * A stable local file name for a URL: the hex SHA-256 of the URL followed by the
     * extension of the last path segment, if any.
     */
    public static String hashedFilename(String url) {
        return ByteString.encodeUtf8(url).sha256().hex() + extension(url);
    }

    static String extension(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        if (path == null) {
            return "";
        }
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot <= 0 || dot == lastSegment.length() - 1) {
            return "";
        }
        return lastSegment.substring(dot);
    }

}
