package io.fedfetch.http.client;

import io.fedfetch.http.auth.CredentialHeaderInterceptor;
import io.fedfetch.http.auth.CredentialHeaderPolicy;
import io.fedfetch.http.config.DownloadClientConfig;
import okhttp3.Authenticator;
import okhttp3.CookieJar;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.concurrent.TimeUnit;

/**
 * Builds the OkHttpClient shared by all downloads of a process.
 * <p>
 * The shared client keeps no cookies. {@link RetryingRequestExecutor} derives a client
 * with its own {@link InMemoryCookieJar} for each call, so session cookies never outlive
 * the download that received them.
 */
public final class HttpClientFactory {

    private static final Logger log = LoggerFactory.getLogger(HttpClientFactory.class);

    static final String PROXY_AUTHORIZATION = "Proxy-Authorization";

    private HttpClientFactory() {
    }

    public static OkHttpClient create(DownloadClientConfig config, CredentialHeaderPolicy policy) {
        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
            .connectTimeout(config.getConnectionTimeoutMs(), TimeUnit.MILLISECONDS)
            .readTimeout(config.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
            .writeTimeout(config.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .followRedirects(true)
            .followSslRedirects(true)
            .cookieJar(CookieJar.NO_COOKIES)
            .addNetworkInterceptor(new CredentialHeaderInterceptor(policy));

        configureProxy(clientBuilder, config);

        log.debug("Built HTTP client with connect timeout {}ms, read timeout {}ms, trusted hosts {}",
            config.getConnectionTimeoutMs(), config.getRequestTimeoutMs(), policy.getTrustedHosts());

        return clientBuilder.build();
    }

    /**
     * Routes downloads through the configured HTTP proxy, if any.
     */
    private static void configureProxy(OkHttpClient.Builder clientBuilder, DownloadClientConfig config) {
        String proxyHost = config.getHttpProxyHost();
        Integer proxyPort = config.getHttpProxyPort();
        if (proxyHost == null || proxyPort == null) {
            return;
        }

        clientBuilder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort)));

        String proxyUser = config.getHttpProxyUser();
        String proxyPassword = config.getHttpProxyPassword();
        if (proxyUser != null && proxyPassword != null) {
            clientBuilder.proxyAuthenticator(proxyAuthenticator(Credentials.basic(proxyUser, proxyPassword)));
        }

        log.debug("Downloads go through proxy {}:{} ({})", proxyHost, proxyPort,
            proxyUser != null ? "authenticated" : "anonymous");
    }

    private static Authenticator proxyAuthenticator(String proxyCredential) {
        return (route, response) -> {
            // the proxy already rejected these credentials
            if (response.request().header(PROXY_AUTHORIZATION) != null) {
                log.warn("Proxy rejected the configured credentials with status {}", response.code());
                return null;
            }
            return response.request().newBuilder()
                .header(PROXY_AUTHORIZATION, proxyCredential)
                .build();
        };
    }
}
