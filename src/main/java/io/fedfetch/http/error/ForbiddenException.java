package io.fedfetch.http.error;

/**
 * The data could not be accessed with the supplied credential, either because it was
 * rejected or because the user still has to accept a usage agreement.
 */
public class ForbiddenException extends DownloadException {

    public ForbiddenException(String message) {
        super(message, "Forbidden");
    }
}
