package io.fedfetch.http.util;

import okhttp3.HttpUrl;

import java.util.Locale;
import java.util.Set;

/**
 * Masks secrets in URLs before they are logged.
 */
public final class CredentialRedactor {

    private static final String MASK = "****";

    private static final Set<String> SENSITIVE_EXACT = Set.of(
        "code", "sig", "signature", "x-amz-signature", "x-amz-credential", "x-amz-security-token",
        "x-goog-signature", "awsaccesskeyid"
    );

    private static final String[] SENSITIVE_FRAGMENTS = {"token", "secret", "password", "key", "auth"};

    private CredentialRedactor() {
    }

    /**
     * Returns the URL with user info and the values of sensitive query parameters masked.
     * Strings that are not HTTP(S) URLs are returned unchanged.
     */
    public static String redactUrl(String url) {
        if (url == null) {
            return null;
        }
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            return url;
        }
        return redactUrl(parsed);
    }

    public static String redactUrl(HttpUrl url) {
        HttpUrl.Builder builder = url.newBuilder();
        if (!url.username().isEmpty() || !url.password().isEmpty()) {
            builder.username("").password("");
        }
        for (String name : url.queryParameterNames()) {
            if (isSensitiveParameter(name)) {
                builder.setQueryParameter(name, MASK);
            }
        }
        return builder.build().toString();
    }

    public static boolean isSensitiveParameter(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (SENSITIVE_EXACT.contains(lower)) {
            return true;
        }
        for (String fragment : SENSITIVE_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
