package io.fedfetch.http.download;

import io.fedfetch.http.auth.CredentialHeaderPolicy;
import io.fedfetch.http.auth.CredentialResolver;
import io.fedfetch.http.auth.HttpCredential;
import io.fedfetch.http.auth.TokenExchanger;
import io.fedfetch.http.client.ExecutionResult;
import io.fedfetch.http.client.HttpClientFactory;
import io.fedfetch.http.client.RetryingRequestExecutor;
import io.fedfetch.http.config.DownloadClientConfig;
import io.fedfetch.http.config.RetryPolicy;
import io.fedfetch.http.error.CanceledException;
import io.fedfetch.http.error.ConsentErrorTranslator;
import io.fedfetch.http.error.ConsentRequirement;
import io.fedfetch.http.util.CredentialRedactor;
import io.fedfetch.http.util.FormEncoding;
import io.fedfetch.http.util.UrlUtils;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Retrieves an HTTP(S) resource into a {@link DownloadSink} on behalf of a user.
 * <p>
 * The credential is resolved first (direct bearer, token exchange, or the application's
 * Basic credentials), the request is executed with retries, and the result is reduced to
 * a {@link DownloadOutcome}. Configuration and token exchange problems are thrown instead,
 * since no request can meaningfully be made.
 * <p>
 * Instances are thread-safe and hold no per-download state.
 */
public class AuthenticatedDownloader {

    private static final Logger log = LoggerFactory.getLogger(AuthenticatedDownloader.class);

    static final String MDC_REQUEST_ID = "requestId";

    // Smallest buffer used when the response announces its length
    private static final int MIN_BUFFER_SIZE = 8 * 1024;

    private final CredentialResolver credentialResolver;
    private final RetryingRequestExecutor executor;
    private final ConsentErrorTranslator consentErrorTranslator;
    private final RetryPolicy retryPolicy;
    private final int bufferSize;

    public AuthenticatedDownloader(DownloadClientConfig config, CredentialResolver credentialResolver,
                                   RetryingRequestExecutor executor, ConsentErrorTranslator consentErrorTranslator) {
        this(credentialResolver, executor, consentErrorTranslator, config.getRetryPolicy(),
            config.getDownloadBufferSizeBytes());
    }

    public AuthenticatedDownloader(CredentialResolver credentialResolver, RetryingRequestExecutor executor,
                                   ConsentErrorTranslator consentErrorTranslator, RetryPolicy retryPolicy,
                                   int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive, was " + bufferSize);
        }
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.consentErrorTranslator = Objects.requireNonNull(consentErrorTranslator, "consentErrorTranslator");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.bufferSize = bufferSize;
    }

    /**
     * Wires a downloader with its own HTTP client from configuration.
     */
    public static AuthenticatedDownloader fromConfig(DownloadClientConfig config) {
        CredentialHeaderPolicy policy = CredentialHeaderPolicy.fromConfig(config);
        OkHttpClient httpClient = HttpClientFactory.create(config, policy);

        TokenExchanger tokenExchanger = config.getAuthMode() == DownloadClientConfig.AuthMode.TOKEN_EXCHANGE
            ? TokenExchanger.fromConfig(config, httpClient)
            : null;

        log.debug("Creating downloader with auth mode {}, {} and {} trusted host(s)",
            config.getAuthMode(), config.getRetryPolicy(), config.getTrustedHosts().size());

        return new AuthenticatedDownloader(config,
            CredentialResolver.fromConfig(config, tokenExchanger),
            new RetryingRequestExecutor(httpClient, config.getPostUrlLength()),
            new ConsentErrorTranslator());
    }

    public DownloadOutcome download(String url, String credential, String data, DownloadSink sink,
                                    String userAgent) throws IOException {
        return download(url, credential, data, sink, userAgent, DownloadContext.empty());
    }

    public DownloadOutcome download(String url, String credential, Map<String, String> data, DownloadSink sink,
                                    String userAgent, DownloadContext context) throws IOException {
        return download(url, credential, FormEncoding.encode(data), sink, userAgent, context);
    }

    /**
     * Downloads {@code url} into {@code sink}.
     *
     * @param credential the user's access token, or null to use fallback authentication
     * @param data form-encoded parameters sent as a POST body, or null for a GET
     * @param userAgent value of the User-Agent header, may be null
     * @return the classified outcome; never null
     * @throws org.apache.kafka.common.config.ConfigException if there is no credential and
     *         fallback authentication is disabled
     * @throws io.fedfetch.http.error.TokenExchangeException if the credential cannot be exchanged
     * @throws CanceledException if the calling thread is interrupted
     * @throws IOException if writing to the sink or reading the response body fails
     */
    public DownloadOutcome download(String url, String credential, String data, DownloadSink sink,
                                    String userAgent, DownloadContext context) throws IOException {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(sink, "sink");
        DownloadContext downloadContext = context != null ? context : DownloadContext.empty();

        String requestId = downloadContext.getRequestId();
        String targetUrl = requestId != null ? UrlUtils.withRequestId(url, requestId) : url;

        if (requestId != null) {
            MDC.put(MDC_REQUEST_ID, requestId);
        }
        try {
            HttpCredential resolvedCredential = credentialResolver.resolve(credential);
            return execute(targetUrl, resolvedCredential, data, sink, userAgent, downloadContext);
        } finally {
            if (requestId != null) {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
    }

    private DownloadOutcome execute(String targetUrl, HttpCredential credential, String data, DownloadSink sink,
                                    String userAgent, DownloadContext context) throws IOException {
        String safeUrl = CredentialRedactor.redactUrl(targetUrl);
        log.info("timing.download.start {}", safeUrl);
        long startNanos = System.nanoTime();

        try (ExecutionResult result = executor.execute(targetUrl, credential, data, retryPolicy, userAgent,
                context.getDeadline())) {
            switch (result.getState()) {
                case SUCCESS:
                    long size = stream(result.getResponse(), sink, safeUrl);
                    long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
                    DownloadPerformanceLogger.logDownloadEnd(safeUrl, durationMs, size);
                    return DownloadOutcome.success(size, durationMs);

                case CONSENT_REQUIRED:
                case PERMANENT_FAILURE:
                    return consentOutcome(result)
                        .orElseGet(() -> DownloadOutcome.forbidden(
                            "Forbidden: Unable to download " + safeUrl + ". Will not retry.",
                            result.getStatusCode()));

                case EXHAUSTED_RETRIES:
                    return consentOutcome(result)
                        .orElseGet(() -> DownloadOutcome.serverFailure(serverFailureMessage(safeUrl, result),
                            result.getStatusCode()));

                default:
                    throw new IllegalStateException("Unknown execution state: " + result.getState());
            }
        }
    }

    private Optional<DownloadOutcome> consentOutcome(ExecutionResult result) {
        Optional<ConsentRequirement> consent = consentErrorTranslator.tryTranslate(result.getBody());
        if (consent.isEmpty()) {
            return Optional.empty();
        }
        log.warn("Download requires accepting the usage agreement at {}", consent.get().getResolutionUrl());
        return Optional.of(DownloadOutcome.consentRequired(consent.get().getMessage(),
            consent.get().getResolutionUrl(), result.getStatusCode()));
    }

    private String serverFailureMessage(String safeUrl, ExecutionResult result) {
        StringBuilder message = new StringBuilder("Unable to download ").append(safeUrl)
            .append(" after ").append(result.getAttempts())
            .append(result.getAttempts() == 1 ? " attempt" : " attempts");
        if (result.getStatusCode() > 0) {
            message.append(": HTTP ").append(result.getStatusCode());
        } else if (result.getLastError() != null) {
            message.append(": ").append(result.getLastError().getMessage());
        }
        return message.toString();
    }

    private long stream(Response response, DownloadSink sink, String safeUrl) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return 0;
        }

        long contentLength = body.contentLength();
        int size = contentLength >= 0
            ? (int) Math.min(bufferSize, Math.max(MIN_BUFFER_SIZE, contentLength))
            : bufferSize;
        byte[] buffer = new byte[size];

        long total = 0;
        try (InputStream in = body.byteStream()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                sink.write(buffer, 0, read);
                total += read;
            }
        } catch (InterruptedIOException e) {
            if (!(e instanceof SocketTimeoutException) && Thread.currentThread().isInterrupted()) {
                throw new CanceledException("Download of " + safeUrl + " canceled after " + total + " bytes", e);
            }
            throw e;
        }
        return total;
    }
}
