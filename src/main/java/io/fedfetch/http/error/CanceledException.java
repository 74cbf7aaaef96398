package io.fedfetch.http.error;

/**
 * The download was canceled by interrupting the thread that performs it.
 */
public class CanceledException extends DownloadException {

    public CanceledException(String message) {
        super(message, "Canceled");
    }

    public CanceledException(String message, Throwable cause) {
        super(message, "Canceled", cause);
    }
}
