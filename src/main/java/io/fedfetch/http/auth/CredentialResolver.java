package io.fedfetch.http.auth;

import io.fedfetch.http.config.DownloadClientConfig;
import io.fedfetch.http.error.TokenExchangeException;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the credential a download is performed with.
 * <ul>
 *   <li>With a user credential and {@code DIRECT_BEARER}, the credential is sent as is.</li>
 *   <li>With a user credential and {@code TOKEN_EXCHANGE}, it is first exchanged for an
 *       application token.</li>
 *   <li>Without one, the application's Basic credentials are used if fallback
 *       authentication is enabled.</li>
 * </ul>
 * Anything else is a configuration error: unauthenticated downloads are never attempted.
 */
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final DownloadClientConfig.AuthMode authMode;
    private final TokenExchanger tokenExchanger;
    private final BasicCredential fallbackCredential;

    /**
     * @param tokenExchanger required for {@code TOKEN_EXCHANGE}, ignored otherwise
     * @param fallbackCredential the application credentials, or null if fallback is disabled
     */
    public CredentialResolver(DownloadClientConfig.AuthMode authMode, TokenExchanger tokenExchanger,
                              BasicCredential fallbackCredential) {
        if (authMode == DownloadClientConfig.AuthMode.TOKEN_EXCHANGE && tokenExchanger == null) {
            throw new ConfigException("A token exchanger is required for TOKEN_EXCHANGE auth");
        }
        this.authMode = authMode;
        this.tokenExchanger = tokenExchanger;
        this.fallbackCredential = fallbackCredential;
    }

    public static CredentialResolver fromConfig(DownloadClientConfig config, TokenExchanger tokenExchanger) {
        BasicCredential fallback = config.isFallbackAuthEnabled()
            ? new BasicCredential(config.getAppUsername(), config.getAppPassword())
            : null;
        return new CredentialResolver(config.getAuthMode(), tokenExchanger, fallback);
    }

    /**
     * @param userCredential the caller's credential, may be null
     * @return the credential to download with, never null
     * @throws ConfigException if there is no user credential and fallback is disabled
     * @throws TokenExchangeException if the user credential cannot be exchanged
     */
    public HttpCredential resolve(String userCredential) throws TokenExchangeException {
        if (userCredential != null) {
            switch (authMode) {
                case DIRECT_BEARER:
                    return new BearerCredential(userCredential);

                case TOKEN_EXCHANGE:
                    return tokenExchanger.exchange(userCredential).asCredential();

                default:
                    throw new IllegalArgumentException("Unsupported auth mode: " + authMode);
            }
        }

        if (fallbackCredential != null) {
            log.warn("No user access token supplied; fallback authentication enabled, using application credentials");
            return fallbackCredential;
        }

        throw new ConfigException("Unable to download: missing user access token and fallback authentication is not enabled");
    }

    public DownloadClientConfig.AuthMode getAuthMode() {
        return authMode;
    }
}
