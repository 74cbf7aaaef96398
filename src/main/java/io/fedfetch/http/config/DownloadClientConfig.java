package io.fedfetch.http.config;

import io.fedfetch.http.auth.TrustedHostSet;
import okhttp3.HttpUrl;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Configuration for the authenticated download client.
 * Defines all configuration properties and their validation rules.
 */
public class DownloadClientConfig extends AbstractConfig {

    private static final Logger log = LoggerFactory.getLogger(DownloadClientConfig.class);

    // Credential placement
    public static final String TRUSTED_HOSTS = "trusted.hosts";
    public static final String SIGNED_URL_QUERY_PARAMETERS = "signed.url.query.parameters";

    // Application identity
    public static final String APP_CLIENT_ID = "app.client.id";
    public static final String APP_USERNAME = "app.username";
    public static final String APP_PASSWORD = "app.password";
    public static final String APP_NAME = "app.name";

    // Authentication mode
    public static final String AUTH_MODE = "auth.mode";
    public static final String OAUTH_AUTHORIZE_URL = "oauth.authorize.url";
    public static final String OAUTH_TOKEN_URL = "oauth.token.url";
    public static final String OAUTH_REDIRECT_URI = "oauth.redirect.uri";
    public static final String OAUTH_TOKEN_PROPERTY = "oauth.token.property";
    public static final String FALLBACK_AUTH_ENABLED = "fallback.auth.enabled";

    // Retry Configuration
    public static final String RETRY_MAX_ATTEMPTS = "retry.max.attempts";
    public static final String RETRY_BASE_DELAY_SECONDS = "retry.base.delay.seconds";
    public static final String RETRY_MAX_DELAY_SECONDS = "retry.max.delay.seconds";

    // Request shaping
    public static final String POST_URL_LENGTH = "post.url.length";
    public static final String REQUEST_TIMEOUT_MS = "request.timeout.ms";
    public static final String CONNECTION_TIMEOUT_MS = "connection.timeout.ms";
    public static final String DOWNLOAD_BUFFER_SIZE_BYTES = "download.buffer.size.bytes";
    public static final String USER_AGENT = "user.agent";
    public static final String LOCAL_HOSTNAME = "local.hostname";

    // Proxy Configuration
    public static final String HTTP_PROXY_HOST = "http.proxy.host";
    public static final String HTTP_PROXY_PORT = "http.proxy.port";
    public static final String HTTP_PROXY_USER = "http.proxy.user";
    public static final String HTTP_PROXY_PASSWORD = "http.proxy.password";

    public static final String DEFAULT_SIGNED_URL_QUERY_PARAMETERS =
        "X-Amz-Signature,X-Amz-Credential,X-Amz-Security-Token,Signature,AWSAccessKeyId,X-Goog-Signature,sig";

    public enum AuthMode {
        DIRECT_BEARER, TOKEN_EXCHANGE
    }

    private static final ConfigDef CONFIG_DEF = createConfigDef();

    public DownloadClientConfig(Map<String, String> props) {
        super(CONFIG_DEF, props);
        validateConfig();
    }

    public static ConfigDef configDef() {
        return CONFIG_DEF;
    }

    private static ConfigDef createConfigDef() {
        ConfigDef configDef = new ConfigDef();

        configDef.define(
            TRUSTED_HOSTS,
            ConfigDef.Type.LIST,
            "",
            ConfigDef.Importance.HIGH,
            "Host names that may receive credentials. Entries match the full host name; "
                + "an entry of the form *.example.com matches any subdomain of example.com"
        );

        configDef.define(
            SIGNED_URL_QUERY_PARAMETERS,
            ConfigDef.Type.LIST,
            DEFAULT_SIGNED_URL_QUERY_PARAMETERS,
            ConfigDef.Importance.LOW,
            "Query parameter names (case-insensitive) that mark a URL as pre-signed. "
                + "Credentials are never attached to such URLs"
        );

        configDef.define(
            APP_CLIENT_ID,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.MEDIUM,
            "The client id of the application registered with the identity provider"
        );

        configDef.define(
            APP_USERNAME,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.MEDIUM,
            "The application username used for Basic authentication"
        );

        configDef.define(
            APP_PASSWORD,
            ConfigDef.Type.PASSWORD,
            null,
            ConfigDef.Importance.MEDIUM,
            "The application password used for Basic authentication"
        );

        configDef.define(
            APP_NAME,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.LOW,
            "A name for the calling service, appended to the user agent"
        );

        configDef.define(
            AUTH_MODE,
            ConfigDef.Type.STRING,
            AuthMode.DIRECT_BEARER.name(),
            ConfigDef.ValidString.in(AuthMode.DIRECT_BEARER.name(), AuthMode.TOKEN_EXCHANGE.name()),
            ConfigDef.Importance.HIGH,
            "DIRECT_BEARER sends the caller's credential as is. TOKEN_EXCHANGE first exchanges "
                + "it for an application-scoped token through the authorization-code flow"
        );

        configDef.define(
            OAUTH_AUTHORIZE_URL,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.MEDIUM,
            "The authorization endpoint of the identity provider"
        );

        configDef.define(
            OAUTH_TOKEN_URL,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.MEDIUM,
            "The token endpoint of the identity provider"
        );

        configDef.define(
            OAUTH_REDIRECT_URI,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.MEDIUM,
            "A redirect URI registered for the application. It is never followed"
        );

        configDef.define(
            OAUTH_TOKEN_PROPERTY,
            ConfigDef.Type.STRING,
            "access_token",
            ConfigDef.Importance.LOW,
            "The name of the property containing the token in the token endpoint response"
        );

        configDef.define(
            FALLBACK_AUTH_ENABLED,
            ConfigDef.Type.BOOLEAN,
            false,
            ConfigDef.Importance.MEDIUM,
            "Download with the application Basic credentials when no user credential is supplied"
        );

        configDef.define(
            RETRY_MAX_ATTEMPTS,
            ConfigDef.Type.INT,
            5,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.MEDIUM,
            "Total number of attempts for a download, including the first"
        );

        configDef.define(
            RETRY_BASE_DELAY_SECONDS,
            ConfigDef.Type.DOUBLE,
            2.5,
            ConfigDef.Range.atLeast(0.0),
            ConfigDef.Importance.LOW,
            "Delay after the first failed attempt. Doubles with every further failure"
        );

        configDef.define(
            RETRY_MAX_DELAY_SECONDS,
            ConfigDef.Type.DOUBLE,
            90.0,
            ConfigDef.Range.atLeast(0.0),
            ConfigDef.Importance.LOW,
            "Upper bound for the delay between two attempts"
        );

        configDef.define(
            POST_URL_LENGTH,
            ConfigDef.Type.INT,
            2000,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.LOW,
            "URLs longer than this are sent as a form-encoded POST of their query string"
        );

        configDef.define(
            REQUEST_TIMEOUT_MS,
            ConfigDef.Type.INT,
            60000,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.LOW,
            "Socket read timeout for a single attempt. This is not a limit on the whole transfer"
        );

        configDef.define(
            CONNECTION_TIMEOUT_MS,
            ConfigDef.Type.INT,
            30000,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.LOW,
            "Connect timeout for a single attempt"
        );

        configDef.define(
            DOWNLOAD_BUFFER_SIZE_BYTES,
            ConfigDef.Type.INT,
            16 * 1024 * 1024,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.LOW,
            "Size of the buffer used to stream a response body into the destination"
        );

        configDef.define(
            USER_AGENT,
            ConfigDef.Type.STRING,
            "fedfetch (unknown version)",
            ConfigDef.Importance.LOW,
            "The user agent of the calling platform"
        );

        configDef.define(
            LOCAL_HOSTNAME,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.LOW,
            "Replaces localhost in download URLs. Used for local development"
        );

        // Proxy Configuration
        configDef.define(
            HTTP_PROXY_HOST,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.LOW,
            "The host of the HTTP proxy"
        );

        configDef.define(
            HTTP_PROXY_PORT,
            ConfigDef.Type.INT,
            null,
            ConfigDef.Importance.LOW,
            "The port of the HTTP proxy"
        );

        configDef.define(
            HTTP_PROXY_USER,
            ConfigDef.Type.STRING,
            null,
            ConfigDef.Importance.LOW,
            "The username for proxy authentication"
        );

        configDef.define(
            HTTP_PROXY_PASSWORD,
            ConfigDef.Type.PASSWORD,
            null,
            ConfigDef.Importance.LOW,
            "The password for proxy authentication"
        );

        return configDef;
    }

    private void validateConfig() {
        log.debug("Validating DownloadClientConfig");

        validateAuthenticationConfig();
        validateRetryConfig();

        log.debug("DownloadClientConfig validation completed");
    }

    private void validateAuthenticationConfig() {
        if (getAuthMode() == AuthMode.TOKEN_EXCHANGE) {
            if (getOauthAuthorizeUrl() == null || getOauthTokenUrl() == null || getOauthRedirectUri() == null) {
                throw new ConfigException(
                    "oauth.authorize.url, oauth.token.url and oauth.redirect.uri must be set for TOKEN_EXCHANGE auth");
            }
            if (getAppClientId() == null || getAppUsername() == null || getAppPassword() == null) {
                throw new ConfigException(
                    "app.client.id, app.username and app.password must be set for TOKEN_EXCHANGE auth");
            }
            validateOauthEndpointTrusted(OAUTH_AUTHORIZE_URL);
            validateOauthEndpointTrusted(OAUTH_TOKEN_URL);
        }

        if (isFallbackAuthEnabled() && (getAppUsername() == null || getAppPassword() == null)) {
            throw new ConfigException("app.username and app.password must be set when fallback.auth.enabled is true");
        }

        if (getTrustedHosts().isEmpty()) {
            log.warn("No trusted hosts configured; credentials will not be sent to any host");
        }
    }

    // both exchange steps carry credentials, which are only ever sent to trusted hosts
    private void validateOauthEndpointTrusted(String name) {
        String value = getString(name);
        HttpUrl url = HttpUrl.parse(value.trim());
        if (url == null) {
            throw new ConfigException(name, value, "must be an HTTP(S) URL");
        }
        TrustedHostSet trustedHosts;
        try {
            trustedHosts = TrustedHostSet.of(getTrustedHosts());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(TRUSTED_HOSTS, getTrustedHosts(), e.getMessage());
        }
        if (!trustedHosts.contains(url.host())) {
            throw new ConfigException(name, value, "host " + url.host() + " must be listed in " + TRUSTED_HOSTS);
        }
    }

    private void validateRetryConfig() {
        if (getRetryMaxDelaySeconds() < getRetryBaseDelaySeconds()) {
            throw new ConfigException(RETRY_MAX_DELAY_SECONDS, getRetryMaxDelaySeconds(),
                "must not be smaller than " + RETRY_BASE_DELAY_SECONDS);
        }
    }

    /**
     * Builds the retry policy described by the retry.* properties.
     */
    public RetryPolicy getRetryPolicy() {
        return new RetryPolicy(getRetryMaxAttempts(), getRetryBaseDelaySeconds(), getRetryMaxDelaySeconds());
    }

    // Getter methods
    public List<String> getTrustedHosts() {
        return getList(TRUSTED_HOSTS);
    }

    public List<String> getSignedUrlQueryParameters() {
        return getList(SIGNED_URL_QUERY_PARAMETERS);
    }

    public String getAppClientId() {
        return getString(APP_CLIENT_ID);
    }

    public String getAppUsername() {
        return getString(APP_USERNAME);
    }

    public String getAppPassword() {
        return getPassword(APP_PASSWORD) != null ? getPassword(APP_PASSWORD).value() : null;
    }

    public String getAppName() {
        return getString(APP_NAME);
    }

    public AuthMode getAuthMode() {
        return AuthMode.valueOf(getString(AUTH_MODE));
    }

    public String getOauthAuthorizeUrl() {
        return getString(OAUTH_AUTHORIZE_URL);
    }

    public String getOauthTokenUrl() {
        return getString(OAUTH_TOKEN_URL);
    }

    public String getOauthRedirectUri() {
        return getString(OAUTH_REDIRECT_URI);
    }

    public String getOauthTokenProperty() {
        return getString(OAUTH_TOKEN_PROPERTY);
    }

    public boolean isFallbackAuthEnabled() {
        return getBoolean(FALLBACK_AUTH_ENABLED);
    }

    public int getRetryMaxAttempts() {
        return getInt(RETRY_MAX_ATTEMPTS);
    }

    public double getRetryBaseDelaySeconds() {
        return getDouble(RETRY_BASE_DELAY_SECONDS);
    }

    public double getRetryMaxDelaySeconds() {
        return getDouble(RETRY_MAX_DELAY_SECONDS);
    }

    public int getPostUrlLength() {
        return getInt(POST_URL_LENGTH);
    }

    public int getRequestTimeoutMs() {
        return getInt(REQUEST_TIMEOUT_MS);
    }

    public int getConnectionTimeoutMs() {
        return getInt(CONNECTION_TIMEOUT_MS);
    }

    public int getDownloadBufferSizeBytes() {
        return getInt(DOWNLOAD_BUFFER_SIZE_BYTES);
    }

    public String getUserAgent() {
        return getString(USER_AGENT);
    }

    public String getLocalHostname() {
        return getString(LOCAL_HOSTNAME);
    }

    public String getHttpProxyHost() {
        return getString(HTTP_PROXY_HOST);
    }

    public Integer getHttpProxyPort() {
        return getInt(HTTP_PROXY_PORT);
    }

    public String getHttpProxyUser() {
        return getString(HTTP_PROXY_USER);
    }

    public String getHttpProxyPassword() {
        return getPassword(HTTP_PROXY_PASSWORD) != null ? getPassword(HTTP_PROXY_PASSWORD).value() : null;
    }
}
