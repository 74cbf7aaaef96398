package io.fedfetch.http.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fedfetch.http.config.DownloadClientConfig;
import io.fedfetch.http.error.TokenExchangeException;
import okhttp3.CookieJar;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Exchanges a user's access token for a token issued to this application, using the
 * authorization-code flow of the identity provider:
 * <ol>
 *   <li>GET the authorization endpoint with the application's Basic credentials and the
 *       user's bearer token in one header; the provider answers with a redirect whose {@code Location}
 *       carries a {@code code} parameter.</li>
 *   <li>POST the code to the token endpoint with the application's Basic credentials and
 *       read {@code access_token} from the JSON response.</li>
 * </ol>
 * Redirects are never followed so that {@code Location} can be read, and no cookies are sent. Results are cached for
 * the lifetime of the process, keyed by the user token, without eviction; concurrent callers
 * with the same user token share one exchange. Failed exchanges are not cached.
 */
public class TokenExchanger {

    private static final Logger log = LoggerFactory.getLogger(TokenExchanger.class);

    private final OkHttpClient httpClient;
    private final HttpUrl authorizeUrl;
    private final HttpUrl tokenUrl;
    private final String clientId;
    private final String redirectUri;
    private final String tokenProperty;
    private final BasicCredential applicationCredential;
    private final ObjectMapper objectMapper;

    private final ConcurrentMap<String, CompletableFuture<ExchangedToken>> tokens = new ConcurrentHashMap<>();

    public TokenExchanger(OkHttpClient httpClient, String authorizeUrl, String tokenUrl, String clientId,
                          String redirectUri, String tokenProperty, BasicCredential applicationCredential) {
        if (clientId == null || clientId.trim().isEmpty()) {
            throw new IllegalArgumentException("Client id must not be null or empty");
        }
        if (redirectUri == null || redirectUri.trim().isEmpty()) {
            throw new IllegalArgumentException("Redirect URI must not be null or empty");
        }
        this.authorizeUrl = parseEndpoint(authorizeUrl, "authorization");
        this.tokenUrl = parseEndpoint(tokenUrl, "token");
        this.clientId = clientId.trim();
        this.redirectUri = redirectUri.trim();
        this.tokenProperty = tokenProperty != null ? tokenProperty.trim() : "access_token";
        this.applicationCredential = applicationCredential;
        this.objectMapper = new ObjectMapper();

        this.httpClient = httpClient.newBuilder()
            .cookieJar(CookieJar.NO_COOKIES)
            .followRedirects(false)
            .followSslRedirects(false)
            .build();

        log.debug("Initialized TokenExchanger for authorization endpoint {} and token endpoint {}",
            this.authorizeUrl.host(), this.tokenUrl.host());
    }

    public static TokenExchanger fromConfig(DownloadClientConfig config, OkHttpClient httpClient) {
        return new TokenExchanger(
            httpClient,
            config.getOauthAuthorizeUrl(),
            config.getOauthTokenUrl(),
            config.getAppClientId(),
            config.getOauthRedirectUri(),
            config.getOauthTokenProperty(),
            new BasicCredential(config.getAppUsername(), config.getAppPassword()));
    }

    /**
     * Returns the application token for the given user token, exchanging it on first use.
     *
     * @throws TokenExchangeException if the provider does not answer with the expected
     *         redirect or token response, or the calling thread is interrupted while waiting
     */
    public ExchangedToken exchange(String userCredential) throws TokenExchangeException {
        if (userCredential == null || userCredential.isEmpty()) {
            throw new IllegalArgumentException("User credential must not be null or empty");
        }

        CompletableFuture<ExchangedToken> pending = new CompletableFuture<>();
        CompletableFuture<ExchangedToken> existing = tokens.putIfAbsent(userCredential, pending);
        if (existing != null) {
            log.trace("Using cached or in-flight token exchange");
            return await(existing);
        }

        try {
            ExchangedToken token = requestToken(userCredential);
            pending.complete(token);
            return token;
        } catch (TokenExchangeException | RuntimeException e) {
            tokens.remove(userCredential, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Number of cached or in-flight exchanges.
     */
    public int cachedTokenCount() {
        return tokens.size();
    }

    private ExchangedToken await(CompletableFuture<ExchangedToken> future) throws TokenExchangeException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenExchangeException("Interrupted while waiting for a token exchange", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TokenExchangeException) {
                throw new TokenExchangeException(cause.getMessage(), cause);
            }
            throw new TokenExchangeException("Unable to acquire authorization: " + cause.getMessage(), cause);
        }
    }

    private ExchangedToken requestToken(String userCredential) throws TokenExchangeException {
        log.debug("Exchanging user token at {}", authorizeUrl.host());
        String code = requestAuthorizationCode(userCredential);
        String accessToken = redeemAuthorizationCode(code);
        log.info("Acquired application token from {}", tokenUrl.host());
        return new ExchangedToken(accessToken, userCredential);
    }

    private String requestAuthorizationCode(String userCredential) throws TokenExchangeException {
        HttpUrl url = authorizeUrl.newBuilder()
            .addQueryParameter("response_type", "code")
            .addQueryParameter("client_id", clientId)
            .addQueryParameter("redirect_uri", redirectUri)
            .build();

        HttpCredential credential = new CombinedCredential(applicationCredential, new BearerCredential(userCredential));
        Request request = new Request.Builder()
            .url(url)
            .get()
            .tag(HttpCredential.class, credential)
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String location = response.header("Location");
            if (!response.isRedirect() || location == null) {
                throw new TokenExchangeException("Unable to acquire authorization code from user access token: "
                    + "expected a redirect from " + authorizeUrl.host() + " but received status " + response.code());
            }

            HttpUrl redirect = response.request().url().resolve(location);
            String code = redirect != null ? redirect.queryParameter("code") : null;
            if (code == null || code.isEmpty()) {
                throw new TokenExchangeException(
                    "Unable to acquire authorization code from user access token: no code in redirect");
            }
            return code;
        } catch (IOException e) {
            if (e instanceof TokenExchangeException) {
                throw (TokenExchangeException) e;
            }
            throw new TokenExchangeException("Unable to acquire authorization code from user access token: "
                + e.getMessage(), e);
        }
    }

    private String redeemAuthorizationCode(String code) throws TokenExchangeException {
        FormBody body = new FormBody.Builder()
            .add("grant_type", "authorization_code")
            .add("code", code)
            .add("redirect_uri", redirectUri)
            .build();

        Request request = new Request.Builder()
            .url(tokenUrl)
            .post(body)
            .tag(HttpCredential.class, applicationCredential)
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String content = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new TokenExchangeException("Unable to acquire authorization: token request failed with status "
                    + response.code());
            }
            return extractToken(content);
        } catch (IOException e) {
            if (e instanceof TokenExchangeException) {
                throw (TokenExchangeException) e;
            }
            throw new TokenExchangeException("Unable to acquire authorization: " + e.getMessage(), e);
        }
    }

    private String extractToken(String content) throws TokenExchangeException {
        JsonNode tokenResponse;
        try {
            tokenResponse = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new TokenExchangeException("Unable to acquire authorization: token response is not JSON", e);
        }

        JsonNode tokenNode = tokenResponse != null ? tokenResponse.get(tokenProperty) : null;
        if (tokenNode == null || tokenNode.isNull() || !tokenNode.isValueNode()) {
            throw new TokenExchangeException(
                "Unable to acquire authorization: access token not found in response. Expected property: " + tokenProperty);
        }

        String accessToken = tokenNode.asText();
        if (accessToken.isEmpty()) {
            throw new TokenExchangeException("Unable to acquire authorization: access token is empty");
        }
        return accessToken;
    }

    private static HttpUrl parseEndpoint(String url, String name) {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid " + name + " endpoint URL: " + url);
        }
        return parsed;
    }
}
