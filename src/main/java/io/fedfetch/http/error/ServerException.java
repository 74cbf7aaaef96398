package io.fedfetch.http.error;

/**
 * The download failed with a transient error and all retries were exhausted.
 */
public class ServerException extends DownloadException {

    private final int statusCode;

    public ServerException(String message, int statusCode) {
        super(message, "Server");
        this.statusCode = statusCode;
    }

    /**
     * @return the last HTTP status received, or -1 if the last attempt failed in transport
     */
    public int getStatusCode() {
        return statusCode;
    }
}
