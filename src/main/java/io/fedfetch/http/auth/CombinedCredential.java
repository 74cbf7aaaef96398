package io.fedfetch.http.auth;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Several credentials presented in one Authorization header, separated by a comma.
 * The identity provider reads the application's Basic credentials and a user's bearer
 * token from the same header during the authorization step.
 */
public class CombinedCredential implements HttpCredential {

    private final List<HttpCredential> parts;

    public CombinedCredential(HttpCredential... parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("At least one credential is required");
        }
        this.parts = List.of(parts);
    }

    @Override
    public String authorizationHeaderValue() {
        return parts.stream()
            .map(HttpCredential::authorizationHeaderValue)
            .collect(Collectors.joining(", "));
    }

    @Override
    public String scheme() {
        return parts.stream()
            .map(HttpCredential::scheme)
            .collect(Collectors.joining("+"));
    }

    @Override
    public String toString() {
        return "CombinedCredential{" + scheme() + "}";
    }
}
