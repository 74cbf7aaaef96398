package io.fedfetch.http.download;

import io.fedfetch.http.error.DownloadException;
import io.fedfetch.http.error.ForbiddenException;
import io.fedfetch.http.error.ServerException;

import java.util.Objects;

/**
 * Classified result of one {@link AuthenticatedDownloader#download} call.
 * <p>
 * The failure types are mutually exclusive: a consent requirement is never reported as
 * forbidden, and a server failure is reported only after the retry policy is used up.
 */
public class DownloadOutcome {

    public enum Type {
        SUCCESS,
        FORBIDDEN,
        CONSENT_REQUIRED,
        SERVER_FAILURE
    }

    private final Type type;
    private final long bytesWritten;
    private final long durationMs;
    private final String message;
    private final String resolutionUrl;
    private final int statusCode;

    private DownloadOutcome(Type type, long bytesWritten, long durationMs, String message,
                            String resolutionUrl, int statusCode) {
        this.type = type;
        this.bytesWritten = bytesWritten;
        this.durationMs = durationMs;
        this.message = message;
        this.resolutionUrl = resolutionUrl;
        this.statusCode = statusCode;
    }

    public static DownloadOutcome success(long bytesWritten, long durationMs) {
        return new DownloadOutcome(Type.SUCCESS, bytesWritten, durationMs, null, null, 200);
    }

    public static DownloadOutcome forbidden(String message, int statusCode) {
        return new DownloadOutcome(Type.FORBIDDEN, 0, 0, message, null, statusCode);
    }

    public static DownloadOutcome consentRequired(String message, String resolutionUrl, int statusCode) {
        return new DownloadOutcome(Type.CONSENT_REQUIRED, 0, 0, message,
            Objects.requireNonNull(resolutionUrl, "resolutionUrl"), statusCode);
    }

    /**
     * @param statusCode the last HTTP status, or -1 if the last attempt failed in transport
     */
    public static DownloadOutcome serverFailure(String message, int statusCode) {
        return new DownloadOutcome(Type.SERVER_FAILURE, 0, 0, message, null, statusCode);
    }

    public Type getType() {
        return type;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    public long getDurationMs() {
        return durationMs;
    }

    /**
     * @return the user-visible failure message, null on success
     */
    public String getMessage() {
        return message;
    }

    /**
     * @return the page where the usage agreement can be accepted, only for {@link Type#CONSENT_REQUIRED}
     */
    public String getResolutionUrl() {
        return resolutionUrl;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Converts a failure into the matching exception.
     * <p>
     * A consent requirement is raised as a {@link ForbiddenException} whose message carries
     * the resolution URL.
     *
     * @return this outcome if it is a success
     */
    public DownloadOutcome orThrow() throws DownloadException {
        switch (type) {
            case SUCCESS:
                return this;

            case FORBIDDEN:
            case CONSENT_REQUIRED:
                throw new ForbiddenException(message);

            case SERVER_FAILURE:
                throw new ServerException(message, statusCode);

            default:
                throw new IllegalStateException("Unknown outcome type: " + type);
        }
    }

    @Override
    public String toString() {
        if (type == Type.SUCCESS) {
            return String.format("DownloadOutcome{SUCCESS, bytes=%d, durationMs=%d}", bytesWritten, durationMs);
        }
        return String.format("DownloadOutcome{%s, status=%d, message='%s'}", type, statusCode, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        DownloadOutcome that = (DownloadOutcome) o;

        if (bytesWritten != that.bytesWritten) return false;
        if (durationMs != that.durationMs) return false;
        if (statusCode != that.statusCode) return false;
        if (type != that.type) return false;
        if (!Objects.equals(message, that.message)) return false;
        return Objects.equals(resolutionUrl, that.resolutionUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, bytesWritten, durationMs, message, resolutionUrl, statusCode);
    }
}
