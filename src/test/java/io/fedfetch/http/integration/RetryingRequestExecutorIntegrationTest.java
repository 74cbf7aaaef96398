package io.fedfetch.http.integration;

import io.fedfetch.http.auth.BearerCredential;
import io.fedfetch.http.auth.CredentialHeaderInterceptor;
import io.fedfetch.http.auth.CredentialHeaderPolicy;
import io.fedfetch.http.auth.TrustedHostSet;
import io.fedfetch.http.client.ExecutionResult;
import io.fedfetch.http.client.RetryingRequestExecutor;
import io.fedfetch.http.config.RetryPolicy;
import io.fedfetch.http.error.CanceledException;
import io.fedfetch.http.error.ConsentErrorTranslator;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the retry state machine against a real HTTP server. Backoff sleeps are
 * recorded instead of performed.
 */
class RetryingRequestExecutorIntegrationTest {

    private static final RetryPolicy FIVE_ATTEMPTS = new RetryPolicy(5, 2.5, 90);

    private MockWebServer mockWebServer;
    private OkHttpClient httpClient;
    private List<Duration> sleeps;
    private RetryingRequestExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        CredentialHeaderPolicy policy = new CredentialHeaderPolicy(
            TrustedHostSet.of(mockWebServer.url("/").host()), List.of("X-Amz-Signature"));
        httpClient = new OkHttpClient.Builder()
            .readTimeout(500, TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .addNetworkInterceptor(new CredentialHeaderInterceptor(policy))
            .build();

        sleeps = new ArrayList<>();
        executor = newExecutor(2000);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private RetryingRequestExecutor newExecutor(int postUrlLength) {
        return new RetryingRequestExecutor(httpClient, postUrlLength, new ConsentErrorTranslator(),
            sleeps::add, Clock.systemUTC());
    }

    @Test
    @DisplayName("Should retry server errors and return the eventual success")
    void shouldRetryUntilSuccess() throws Exception {
        // Given
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("payload"));
        String url = mockWebServer.url("/data/granule.nc").toString();

        // When
        try (ExecutionResult result = executor.execute(url, new BearerCredential("user-token"), null, FIVE_ATTEMPTS)) {

            // Then
            assertThat(result.getState()).isEqualTo(ExecutionResult.State.SUCCESS);
            assertThat(result.getAttempts()).isEqualTo(3);
            assertThat(result.getResponse().body().string()).isEqualTo("payload");
        }

        assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
        for (int i = 0; i < 3; i++) {
            RecordedRequest request = mockWebServer.takeRequest();
            assertThat(request.getMethod()).isEqualTo("GET");
            assertThat(request.getPath()).isEqualTo("/data/granule.nc");
            assertThat(request.getHeader("Authorization")).isEqualTo("Bearer user-token");
        }
        assertThat(sleeps).containsExactly(Duration.ofMillis(2500), Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should not retry 401 responses")
    void shouldNotRetryUnauthorized() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401).setBody("Unauthorized"));

        try (ExecutionResult result = executor.execute(mockWebServer.url("/data").toString(),
                new BearerCredential("user-token"), null, FIVE_ATTEMPTS)) {
            assertThat(result.getState()).isEqualTo(ExecutionResult.State.PERMANENT_FAILURE);
            assertThat(result.getStatusCode()).isEqualTo(401);
            assertThat(result.getBody()).isEqualTo("Unauthorized");
            assertThat(result.getResponse()).isNull();
        }

        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should return consent errors without retrying, whatever the status")
    void shouldNotRetryConsentErrors() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(400)
            .setBody("{\"error_description\":\"EULA\",\"resolution_url\":\"https://example.com/approve\"}"));

        try (ExecutionResult result = executor.execute(mockWebServer.url("/data").toString(),
                new BearerCredential("user-token"), null, FIVE_ATTEMPTS)) {
            assertThat(result.getState()).isEqualTo(ExecutionResult.State.CONSENT_REQUIRED);
            assertThat(result.getBody()).contains("resolution_url");
        }

        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should give up after the configured number of attempts")
    void shouldExhaustRetries() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        }

        try (ExecutionResult result = executor.execute(mockWebServer.url("/data").toString(),
                new BearerCredential("user-token"), null, new RetryPolicy(3, 2.5, 90))) {
            assertThat(result.getState()).isEqualTo(ExecutionResult.State.EXHAUSTED_RETRIES);
            assertThat(result.getStatusCode()).isEqualTo(503);
            assertThat(result.getBody()).isEqualTo("busy");
            assertThat(result.getAttempts()).isEqualTo(3);
        }

        assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("Should send a long URL's query string as a form-encoded POST body, once")
    void shouldRewriteLongUrlAsPost() throws Exception {
        // Given
        executor = newExecutor(100);
        StringBuilder query = new StringBuilder("subset=lat%280%3A10%29");
        for (int i = 0; i < 20; i++) {
            query.append("&granuleId=G").append(i);
        }
        String url = mockWebServer.url("/ogc/coverages").toString() + "?" + query;
        mockWebServer.enqueue(new MockResponse().setResponseCode(502));
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        // When
        try (ExecutionResult result = executor.execute(url, new BearerCredential("user-token"), null, FIVE_ATTEMPTS)) {
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRequestUrl()).doesNotContain("?");
        }

        // Then: both attempts are the rewritten POST
        for (int i = 0; i < 2; i++) {
            RecordedRequest request = mockWebServer.takeRequest();
            assertThat(request.getMethod()).isEqualTo("POST");
            assertThat(request.getPath()).isEqualTo("/ogc/coverages");
            assertThat(request.getHeader("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
            assertThat(request.getBody().readUtf8()).isEqualTo(query.toString());
        }
    }

    @Test
    @DisplayName("Should POST an explicit form body and send the user agent")
    void shouldPostExplicitBody() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));

        try (ExecutionResult result = executor.execute(mockWebServer.url("/data?format=nc").toString(),
                new BearerCredential("user-token"), "a=1&b=2", FIVE_ATTEMPTS, "fedfetch-test/1.0", null)) {
            assertThat(result.isSuccess()).isTrue();
        }

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/data?format=nc");
        assertThat(request.getBody().readUtf8()).isEqualTo("a=1&b=2");
        assertThat(request.getHeader("User-Agent")).isEqualTo("fedfetch-test/1.0");
    }

    @Test
    @DisplayName("Should retry dropped connections and read timeouts")
    void shouldRetryTransportFailures() throws Exception {
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("late"));

        try (ExecutionResult result = executor.execute(mockWebServer.url("/data").toString(),
                new BearerCredential("user-token"), null, FIVE_ATTEMPTS)) {
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getAttempts()).isEqualTo(3);
        }
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("Should report the transport error when every attempt times out")
    void shouldExhaustOnTimeouts() throws Exception {
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        try (ExecutionResult result = executor.execute(mockWebServer.url("/data").toString(),
                new BearerCredential("user-token"), null, new RetryPolicy(2, 1, 1))) {
            assertThat(result.getState()).isEqualTo(ExecutionResult.State.EXHAUSTED_RETRIES);
            assertThat(result.getStatusCode()).isEqualTo(-1);
            assertThat(result.getLastError()).isInstanceOf(SocketTimeoutException.class);
        }
    }

    @Test
    @DisplayName("Should cancel when interrupted during the backoff sleep")
    void shouldCancelDuringBackoff() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));
        RetryingRequestExecutor interrupting = new RetryingRequestExecutor(httpClient, 2000,
            new ConsentErrorTranslator(), duration -> {
                throw new InterruptedException("shutdown");
            }, Clock.systemUTC());

        try {
            assertThatThrownBy(() -> interrupting.execute(mockWebServer.url("/data").toString(),
                    new BearerCredential("user-token"), null, FIVE_ATTEMPTS))
                .isInstanceOf(CanceledException.class)
                .hasMessageContaining("canceled while waiting to retry")
                .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not start a backoff that would end after the deadline")
    void shouldRespectDeadline() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));
        Instant deadline = Instant.now().plusSeconds(1);

        try (ExecutionResult result = executor.execute(mockWebServer.url("/data").toString(),
                new BearerCredential("user-token"), null, FIVE_ATTEMPTS, null, deadline)) {
            assertThat(result.getState()).isEqualTo(ExecutionResult.State.EXHAUSTED_RETRIES);
            assertThat(result.getAttempts()).isEqualTo(1);
        }

        assertThat(sleeps).isEmpty();
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not send credentials to pre-signed URLs on the trusted host")
    void shouldNotSendCredentialsToPreSignedUrls() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));

        try (ExecutionResult result = executor.execute(
                mockWebServer.url("/bucket/key.nc?X-Amz-Signature=abc").toString(),
                new BearerCredential("user-token"), null, FIVE_ATTEMPTS)) {
            assertThat(result.isSuccess()).isTrue();
        }

        assertThat(mockWebServer.takeRequest().getHeader("Authorization")).isNull();
    }
}
