package io.fedfetch.http.client;

import io.fedfetch.http.auth.HttpCredential;
import io.fedfetch.http.config.RetryPolicy;
import io.fedfetch.http.error.CanceledException;
import io.fedfetch.http.error.ConsentErrorTranslator;
import io.fedfetch.http.util.CredentialRedactor;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Sends a GET or form-encoded POST and retries transient failures with exponential backoff.
 * <p>
 * Classification of each attempt:
 * <ul>
 *   <li>2xx: success, the open response is returned.</li>
 *   <li>A failure body asking for consent to a usage agreement: returned without retry.</li>
 *   <li>401 or 403: permanent failure, returned without retry.</li>
 *   <li>Any other status, or a transport error including a read timeout: retried until
 *       {@link RetryPolicy#getMaxAttempts()} attempts have been made.</li>
 * </ul>
 * Each call gets its own cookie jar, shared by its attempts and redirect hops and dropped
 * when the call returns. Attempts are strictly sequential. The backoff sleep blocks the calling thread and ends
 * early with a {@link CanceledException} when the thread is interrupted.
 */
public class RetryingRequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingRequestExecutor.class);

    static final MediaType FORM_URLENCODED = MediaType.get("application/x-www-form-urlencoded");

    // Enough for any error document; data bodies are never read on the failure path
    private static final long MAX_FAILURE_BODY_BYTES = 64 * 1024;

    private final OkHttpClient httpClient;
    private final ConsentErrorTranslator consentErrorTranslator;
    private final int postUrlLength;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryingRequestExecutor(OkHttpClient httpClient, int postUrlLength) {
        this(httpClient, postUrlLength, new ConsentErrorTranslator(), Sleeper.SYSTEM, Clock.systemUTC());
    }

    public RetryingRequestExecutor(OkHttpClient httpClient, int postUrlLength,
                                   ConsentErrorTranslator consentErrorTranslator, Sleeper sleeper, Clock clock) {
        if (postUrlLength < 1) {
            throw new IllegalArgumentException("postUrlLength must be positive, was " + postUrlLength);
        }
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.postUrlLength = postUrlLength;
        this.consentErrorTranslator = Objects.requireNonNull(consentErrorTranslator, "consentErrorTranslator");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ExecutionResult execute(String url, HttpCredential credential, String formEncodedBody,
                                   RetryPolicy retryPolicy) throws CanceledException {
        return execute(url, credential, formEncodedBody, retryPolicy, null, null);
    }

    /**
     * Executes the request until it succeeds, fails permanently, or the retry policy is used up.
     *
     * @param url the target URL
     * @param credential the credential to present where the header policy allows it, may be null
     * @param formEncodedBody form-encoded parameters; null sends a GET
     * @param retryPolicy bounds on attempts and backoff
     * @param userAgent value of the User-Agent header, may be null
     * @param deadline no backoff is started that would end after this instant, may be null
     * @return the classified result; close it to release a successful response
     * @throws CanceledException if the calling thread is interrupted
     */
    public ExecutionResult execute(String url, HttpCredential credential, String formEncodedBody,
                                   RetryPolicy retryPolicy, String userAgent, Instant deadline)
            throws CanceledException {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        HttpUrl target = url == null ? null : HttpUrl.parse(url);
        if (target == null) {
            throw new IllegalArgumentException("Not an HTTP(S) URL: " + CredentialRedactor.redactUrl(url));
        }

        String body = formEncodedBody;
        if (body == null && url.length() > postUrlLength) {
            String query = target.encodedQuery();
            body = query != null ? query : "";
            target = target.newBuilder().query(null).fragment(null).build();
            log.info("URL longer than {} characters, sending its query string as a POST body to {}",
                postUrlLength, CredentialRedactor.redactUrl(target));
        }

        String safeUrl = CredentialRedactor.redactUrl(target);
        String method = body == null ? "GET" : "POST";
        int maxAttempts = retryPolicy.getMaxAttempts();

        // cookies live for this call only, across its retries and redirect hops
        OkHttpClient callClient = httpClient.newBuilder()
            .cookieJar(new InMemoryCookieJar())
            .build();

        int lastStatus = -1;
        String lastBody = null;
        Exception lastError = null;

        for (int attempt = 1; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CanceledException("Download of " + safeUrl + " canceled before attempt " + attempt);
            }

            Request request = buildRequest(target, credential, body, userAgent);
            long startNanos = System.nanoTime();

            try {
                Response response = callClient.newCall(request).execute();
                long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;

                if (response.isSuccessful()) {
                    log.info("Attempt {}/{}: {} {} -> {} in {}ms",
                        attempt, maxAttempts, method, safeUrl, response.code(), elapsedMs);
                    return ExecutionResult.success(response, attempt, target.toString());
                }

                lastStatus = response.code();
                lastBody = readFailureBody(response);
                lastError = null;

                if (consentErrorTranslator.isConsentError(lastBody)) {
                    log.info("Attempt {}/{}: {} {} -> {}: agreement acceptance required, will not retry",
                        attempt, maxAttempts, method, safeUrl, lastStatus);
                    return ExecutionResult.consentRequired(lastStatus, lastBody, attempt, target.toString());
                }

                if (lastStatus == 401 || lastStatus == 403) {
                    log.info("Attempt {}/{}: {} {} -> {}: Forbidden, will not retry",
                        attempt, maxAttempts, method, safeUrl, lastStatus);
                    return ExecutionResult.permanentFailure(lastStatus, lastBody, attempt, target.toString());
                }

                log.warn("Attempt {}/{}: {} {} -> {} in {}ms",
                    attempt, maxAttempts, method, safeUrl, lastStatus, elapsedMs);

            } catch (IOException e) {
                if (isCancellation(e)) {
                    throw new CanceledException("Download of " + safeUrl + " canceled during attempt " + attempt, e);
                }
                lastStatus = -1;
                lastBody = null;
                lastError = e;
                log.warn("Attempt {}/{}: {} {} failed: {}",
                    attempt, maxAttempts, method, safeUrl, e.toString());
            }

            if (attempt >= maxAttempts) {
                log.error("All retries exhausted for downloading {} after {} attempts", safeUrl, attempt);
                return ExecutionResult.exhausted(lastStatus, lastBody, lastError, attempt, target.toString());
            }

            Duration delay = retryPolicy.delay(attempt);
            if (deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
                log.error("Not retrying {}: next attempt would start after the deadline {}", safeUrl, deadline);
                return ExecutionResult.exhausted(lastStatus, lastBody, lastError, attempt, target.toString());
            }

            log.debug("Retrying {} in {}ms (attempt {} of {})", safeUrl, delay.toMillis(), attempt + 1, maxAttempts);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CanceledException("Download of " + safeUrl + " canceled while waiting to retry", e);
            }
        }
    }

    private Request buildRequest(HttpUrl target, HttpCredential credential, String body, String userAgent) {
        Request.Builder requestBuilder = new Request.Builder()
            .url(target)
            .tag(HttpCredential.class, credential);

        if (body == null) {
            requestBuilder.get();
        } else {
            // byte[] keeps the content type free of a charset parameter
            requestBuilder.post(RequestBody.create(body.getBytes(StandardCharsets.UTF_8), FORM_URLENCODED));
        }

        if (userAgent != null) {
            requestBuilder.header("User-Agent", userAgent);
        }

        return requestBuilder.build();
    }

    private String readFailureBody(Response response) {
        try (Response closing = response) {
            return closing.peekBody(MAX_FAILURE_BODY_BYTES).string();
        } catch (IOException e) {
            log.debug("Unable to read failure body with status {}: {}", response.code(), e.toString());
            return null;
        }
    }

    private static boolean isCancellation(IOException e) {
        return e instanceof InterruptedIOException
            && !(e instanceof SocketTimeoutException)
            && Thread.currentThread().isInterrupted();
    }
}
