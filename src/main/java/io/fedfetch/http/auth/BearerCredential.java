package io.fedfetch.http.auth;

/**
 * A bearer token issued to a user or an application.
 */
public class BearerCredential implements HttpCredential {

    private final String token;

    public BearerCredential(String token) {
        if (token == null || token.trim().isEmpty()) {
            throw new IllegalArgumentException("Bearer token must not be null or empty");
        }
        this.token = token.trim();
    }

    @Override
    public String authorizationHeaderValue() {
        return "Bearer " + token;
    }

    @Override
    public String scheme() {
        return "Bearer";
    }

    @Override
    public String toString() {
        return "BearerCredential{token=****}";
    }
}
