package io.fedfetch.http.auth;

import okhttp3.Credentials;

/**
 * Client id and secret of the calling application, sent with the Basic scheme.
 */
public class BasicCredential implements HttpCredential {

    private final String username;
    private final String headerValue;

    public BasicCredential(String username, String password) {
        if (username == null || password == null) {
            throw new IllegalArgumentException("Username and password must not be null for Basic authentication");
        }
        this.username = username;
        this.headerValue = Credentials.basic(username, password);
    }

    @Override
    public String authorizationHeaderValue() {
        return headerValue;
    }

    @Override
    public String scheme() {
        return "Basic";
    }

    public String getUsername() {
        return username;
    }

    @Override
    public String toString() {
        return "BasicCredential{username=" + username + ", password=****}";
    }
}
