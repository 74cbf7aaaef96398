package io.fedfetch.http.error;

import java.util.Objects;

/**
 * A usage agreement the user must accept before the data is released.
 */
public class ConsentRequirement {

    private final String message;
    private final String resolutionUrl;

    public ConsentRequirement(String message, String resolutionUrl) {
        this.message = Objects.requireNonNull(message, "message");
        this.resolutionUrl = Objects.requireNonNull(resolutionUrl, "resolutionUrl");
    }

    public String getMessage() {
        return message;
    }

    public String getResolutionUrl() {
        return resolutionUrl;
    }

    @Override
    public String toString() {
        return message;
    }
}
