package io.fedfetch.http.client;

import okhttp3.Response;

import java.io.Closeable;

/**
 * Terminal state of one {@link RetryingRequestExecutor#execute} call.
 * <p>
 * A successful result owns the open {@link Response}; the caller streams its body and
 * closes the result. Failure results carry the last status and a bounded copy of the
 * last response body instead.
 */
public class ExecutionResult implements Closeable {

    public enum State {
        /** 2xx response. */
        SUCCESS,
        /** 401 or 403, never retried. */
        PERMANENT_FAILURE,
        /** A failure body asking the user to accept a usage agreement, never retried. */
        CONSENT_REQUIRED,
        /** Transient failures on every attempt. */
        EXHAUSTED_RETRIES
    }

    private final State state;
    private final Response response;
    private final int statusCode;
    private final String body;
    private final Exception lastError;
    private final int attempts;
    private final String requestUrl;

    private ExecutionResult(State state, Response response, int statusCode, String body,
                            Exception lastError, int attempts, String requestUrl) {
        this.state = state;
        this.response = response;
        this.statusCode = statusCode;
        this.body = body;
        this.lastError = lastError;
        this.attempts = attempts;
        this.requestUrl = requestUrl;
    }

    static ExecutionResult success(Response response, int attempts, String requestUrl) {
        return new ExecutionResult(State.SUCCESS, response, response.code(), null, null, attempts, requestUrl);
    }

    static ExecutionResult permanentFailure(int statusCode, String body, int attempts, String requestUrl) {
        return new ExecutionResult(State.PERMANENT_FAILURE, null, statusCode, body, null, attempts, requestUrl);
    }

    static ExecutionResult consentRequired(int statusCode, String body, int attempts, String requestUrl) {
        return new ExecutionResult(State.CONSENT_REQUIRED, null, statusCode, body, null, attempts, requestUrl);
    }

    static ExecutionResult exhausted(int statusCode, String body, Exception lastError, int attempts,
                                     String requestUrl) {
        return new ExecutionResult(State.EXHAUSTED_RETRIES, null, statusCode, body, lastError, attempts, requestUrl);
    }

    public State getState() {
        return state;
    }

    public boolean isSuccess() {
        return state == State.SUCCESS;
    }

    /**
     * @return the open response of a successful execution, null otherwise
     */
    public Response getResponse() {
        return response;
    }

    /**
     * @return the last HTTP status, or -1 if the last attempt failed before a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the (possibly truncated) body of the last failed response, or null
     */
    public String getBody() {
        return body;
    }

    /**
     * @return the transport error of the last attempt, or null if it produced a response
     */
    public Exception getLastError() {
        return lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return the URL the attempts were sent to, after any long-URL rewrite
     */
    public String getRequestUrl() {
        return requestUrl;
    }

    @Override
    public void close() {
        if (response != null) {
            response.close();
        }
    }

    @Override
    public String toString() {
        return String.format("ExecutionResult{state=%s, status=%d, attempts=%d}", state, statusCode, attempts);
    }
}
