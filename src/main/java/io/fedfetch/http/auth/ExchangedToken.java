package io.fedfetch.http.auth;

import java.util.Objects;

/**
 * An application-usable token obtained for a user credential.
 */
public final class ExchangedToken {

    private final String value;
    private final String sourceCredential;

    public ExchangedToken(String value, String sourceCredential) {
        this.value = Objects.requireNonNull(value, "value");
        this.sourceCredential = Objects.requireNonNull(sourceCredential, "sourceCredential");
    }

    public String getValue() {
        return value;
    }

    public String getSourceCredential() {
        return sourceCredential;
    }

    public BearerCredential asCredential() {
        return new BearerCredential(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExchangedToken)) {
            return false;
        }
        ExchangedToken that = (ExchangedToken) o;
        return value.equals(that.value) && sourceCredential.equals(that.sourceCredential);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, sourceCredential);
    }

    @Override
    public String toString() {
        return "ExchangedToken{value=****}";
    }
}
