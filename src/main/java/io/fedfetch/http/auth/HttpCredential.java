package io.fedfetch.http.auth;

/**
 * A credential that can be presented in an HTTP Authorization header.
 * <p>
 * Implementations must never expose the secret through {@link #toString()} so that a
 * credential can be passed to a logger by mistake without leaking.
 */
public interface HttpCredential {

    /**
     * @return the complete Authorization header value, e.g. {@code Bearer abc}
     */
    String authorizationHeaderValue();

    /**
     * @return the authentication scheme(s) of this credential, safe to log
     */
    String scheme();
}
