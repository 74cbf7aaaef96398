package io.fedfetch.http.unit;

import io.fedfetch.http.auth.CredentialHeaderPolicy;
import io.fedfetch.http.client.HttpClientFactory;
import io.fedfetch.http.config.DownloadClientConfig;
import okhttp3.CookieJar;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HTTP Client Factory Unit Tests")
class HttpClientFactoryTest {

    private static OkHttpClient create(Map<String, String> configMap) {
        DownloadClientConfig config = new DownloadClientConfig(configMap);
        return HttpClientFactory.create(config, CredentialHeaderPolicy.fromConfig(config));
    }

    private static Response proxyChallenge(Request request) {
        return new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(407)
            .message("Proxy Authentication Required")
            .build();
    }

    @Test
    @DisplayName("Should build a cookie-less client with timeouts from configuration")
    void shouldApplyTimeouts() {
        OkHttpClient client = create(Map.of(
            DownloadClientConfig.CONNECTION_TIMEOUT_MS, "1500",
            DownloadClientConfig.REQUEST_TIMEOUT_MS, "4500"));

        assertThat(client.connectTimeoutMillis()).isEqualTo(1500);
        assertThat(client.readTimeoutMillis()).isEqualTo(4500);
        assertThat(client.retryOnConnectionFailure()).isFalse();
        assertThat(client.followRedirects()).isTrue();
        assertThat(client.cookieJar()).isSameAs(CookieJar.NO_COOKIES);
        assertThat(client.networkInterceptors()).hasSize(1);
        assertThat(client.proxy()).isNull();
    }

    @Test
    @DisplayName("Should route through an authenticated proxy")
    void shouldConfigureAuthenticatedProxy() throws Exception {
        // Given
        Map<String, String> configMap = new HashMap<>();
        configMap.put(DownloadClientConfig.HTTP_PROXY_HOST, "127.0.0.1");
        configMap.put(DownloadClientConfig.HTTP_PROXY_PORT, "3128");
        configMap.put(DownloadClientConfig.HTTP_PROXY_USER, "proxy-user");
        configMap.put(DownloadClientConfig.HTTP_PROXY_PASSWORD, "proxy-pass");

        // When
        OkHttpClient client = create(configMap);

        // Then
        assertThat(client.proxy()).isEqualTo(new Proxy(Proxy.Type.HTTP, new InetSocketAddress("127.0.0.1", 3128)));

        Request request = new Request.Builder().url("https://data.example.com/file.nc").build();
        Request authenticated = client.proxyAuthenticator().authenticate(null, proxyChallenge(request));
        assertThat(authenticated).isNotNull();
        assertThat(authenticated.header("Proxy-Authorization"))
            .isEqualTo(Credentials.basic("proxy-user", "proxy-pass"));

        // a second challenge means the credentials were rejected
        assertThat(client.proxyAuthenticator().authenticate(null, proxyChallenge(authenticated))).isNull();
    }

    @Test
    @DisplayName("Should not authenticate to a proxy without credentials")
    void shouldConfigureAnonymousProxy() throws Exception {
        OkHttpClient client = create(Map.of(
            DownloadClientConfig.HTTP_PROXY_HOST, "127.0.0.1",
            DownloadClientConfig.HTTP_PROXY_PORT, "8080"));

        assertThat(client.proxy()).isEqualTo(new Proxy(Proxy.Type.HTTP, new InetSocketAddress("127.0.0.1", 8080)));

        Request request = new Request.Builder().url("https://data.example.com/file.nc").build();
        assertThat(client.proxyAuthenticator().authenticate(null, proxyChallenge(request))).isNull();
    }
}
