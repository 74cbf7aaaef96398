package io.fedfetch.http.error;

/**
 * The user credential could not be exchanged for an application token. This is never
 * retried by the exchange itself.
 */
public class TokenExchangeException extends DownloadException {

    public TokenExchangeException(String message) {
        super(message, "Authorization");
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(message, "Authorization", cause);
    }
}
