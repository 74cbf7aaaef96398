package io.fedfetch.http.auth;

import io.fedfetch.http.config.DownloadClientConfig;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides for every outgoing request, including each redirect hop, whether the
 * Authorization header carries the active credential or is removed.
 * <p>
 * A credential is attached only when the target host is trusted and the URL is not
 * pre-signed. In every other case an existing Authorization header is stripped, because
 * HTTP clients copy headers forward when following a redirect.
 */
public class CredentialHeaderPolicy {

    private static final Logger log = LoggerFactory.getLogger(CredentialHeaderPolicy.class);

    public static final String AUTHORIZATION = "Authorization";

    private final TrustedHostSet trustedHosts;
    private final Set<String> signatureParameters;

    public CredentialHeaderPolicy(TrustedHostSet trustedHosts, Collection<String> signatureParameters) {
        this.trustedHosts = trustedHosts;
        this.signatureParameters = signatureParameters.stream()
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    public static CredentialHeaderPolicy fromConfig(DownloadClientConfig config) {
        return new CredentialHeaderPolicy(
            TrustedHostSet.of(config.getTrustedHosts()),
            config.getSignedUrlQueryParameters());
    }

    public boolean shouldAttachCredential(String targetUrl) {
        HttpUrl url = targetUrl == null ? null : HttpUrl.parse(targetUrl);
        return url != null && shouldAttachCredential(url);
    }

    public boolean shouldAttachCredential(HttpUrl targetUrl) {
        return trustedHosts.contains(targetUrl.host()) && !isPreSigned(targetUrl);
    }

    /**
     * A URL is pre-signed when its query carries one of the signature parameters. A bearer
     * header on such a URL invalidates the signature.
     */
    public boolean isPreSigned(HttpUrl targetUrl) {
        if (targetUrl.querySize() == 0) {
            return false;
        }
        for (String name : targetUrl.queryParameterNames()) {
            if (signatureParameters.contains(name.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the request with its Authorization header set or removed according to this
     * policy.
     *
     * @param request the request about to be sent
     * @param credential the active credential, or null if there is none
     */
    public Request apply(Request request, HttpCredential credential) {
        Request.Builder builder = request.newBuilder();
        apply(builder, request.url(), credential);
        return builder.build();
    }

    public void apply(Request.Builder builder, HttpUrl targetUrl, HttpCredential credential) {
        if (credential != null && shouldAttachCredential(targetUrl)) {
            builder.header(AUTHORIZATION, credential.authorizationHeaderValue());
            log.trace("Attached {} credential for host {}", credential.scheme(), targetUrl.host());
        } else {
            builder.removeHeader(AUTHORIZATION);
            log.trace("No credential for host {}", targetUrl.host());
        }
    }

    public TrustedHostSet getTrustedHosts() {
        return trustedHosts;
    }
}
