package io.fedfetch.http.unit;

import io.fedfetch.http.auth.BasicCredential;
import io.fedfetch.http.auth.BearerCredential;
import io.fedfetch.http.auth.CombinedCredential;
import io.fedfetch.http.auth.CredentialHeaderPolicy;
import io.fedfetch.http.auth.TrustedHostSet;
import io.fedfetch.http.config.DownloadClientConfig;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Credential Header Policy Unit Tests")
class CredentialHeaderPolicyTest {

    private CredentialHeaderPolicy policy;

    @BeforeEach
    void setUp() {
        DownloadClientConfig config = new DownloadClientConfig(Map.of(
            DownloadClientConfig.TRUSTED_HOSTS, "urs.example.com,*.data.example.com"));
        policy = CredentialHeaderPolicy.fromConfig(config);
    }

    @Test
    @DisplayName("Should attach credentials only to trusted hosts")
    void shouldAttachOnlyToTrustedHosts() {
        assertThat(policy.shouldAttachCredential("https://urs.example.com/oauth/authorize")).isTrue();
        assertThat(policy.shouldAttachCredential("https://archive.data.example.com/granule.nc")).isTrue();

        assertThat(policy.shouldAttachCredential("https://example.org/file")).isFalse();
        assertThat(policy.shouldAttachCredential("https://urs.example.com.attacker.net/steal")).isFalse();
        assertThat(policy.shouldAttachCredential("https://attacker.net/urs.example.com")).isFalse();
        assertThat(policy.shouldAttachCredential("not a url")).isFalse();
        assertThat(policy.shouldAttachCredential((String) null)).isFalse();
    }

    @Test
    @DisplayName("Should never attach credentials to pre-signed URLs, even on trusted hosts")
    void shouldNotAttachToPreSignedUrls() {
        assertThat(policy.shouldAttachCredential(
            "https://urs.example.com/file?X-Amz-Algorithm=AWS4&X-Amz-Signature=abc123")).isFalse();
        assertThat(policy.shouldAttachCredential(
            "https://archive.data.example.com/file?x-amz-signature=abc123")).isFalse();
        assertThat(policy.shouldAttachCredential(
            "https://archive.data.example.com/file?Signature=s&Expires=1")).isFalse();

        assertThat(policy.isPreSigned(HttpUrl.get("https://archive.data.example.com/file?format=nc"))).isFalse();
    }

    @Test
    @DisplayName("Should set a bearer header for trusted hosts")
    void shouldSetBearerHeader() {
        Request request = new Request.Builder().url("https://urs.example.com/api").build();

        Request applied = policy.apply(request, new BearerCredential("user-token"));

        assertThat(applied.header(CredentialHeaderPolicy.AUTHORIZATION)).isEqualTo("Bearer user-token");
    }

    @Test
    @DisplayName("Should remove an existing Authorization header for untrusted hosts")
    void shouldStripHeaderForUntrustedHost() {
        Request request = new Request.Builder()
            .url("https://bucket.s3.amazonaws.com/granule.nc")
            .header(CredentialHeaderPolicy.AUTHORIZATION, "Bearer copied-forward")
            .build();

        Request applied = policy.apply(request, new BearerCredential("user-token"));

        assertThat(applied.header(CredentialHeaderPolicy.AUTHORIZATION)).isNull();
    }

    @Test
    @DisplayName("Should remove an existing Authorization header when there is no credential")
    void shouldStripHeaderWithoutCredential() {
        Request request = new Request.Builder()
            .url("https://urs.example.com/api")
            .header(CredentialHeaderPolicy.AUTHORIZATION, "Bearer stale")
            .build();

        assertThat(policy.apply(request, null).header(CredentialHeaderPolicy.AUTHORIZATION)).isNull();
    }

    @Test
    @DisplayName("Should combine Basic and bearer credentials in one header, Basic first")
    void shouldCombineCredentials() {
        Request request = new Request.Builder().url("https://urs.example.com/oauth/authorize").build();
        CombinedCredential combined = new CombinedCredential(
            new BasicCredential("app", "secret"), new BearerCredential("user-token"));

        Request applied = policy.apply(request, combined);

        assertThat(applied.header(CredentialHeaderPolicy.AUTHORIZATION))
            .isEqualTo("Basic YXBwOnNlY3JldA==, Bearer user-token");
        assertThat(combined.scheme()).isEqualTo("Basic+Bearer");
    }

    @Test
    @DisplayName("Should trust nothing when no hosts are configured")
    void shouldTrustNothingByDefault() {
        CredentialHeaderPolicy empty = new CredentialHeaderPolicy(TrustedHostSet.of(List.of()), List.of("sig"));

        assertThat(empty.shouldAttachCredential("https://urs.example.com/api")).isFalse();
    }

    @Test
    @DisplayName("Should mask credentials in toString")
    void shouldMaskCredentials() {
        assertThat(new BearerCredential("user-token").toString()).doesNotContain("user-token");
        assertThat(new BasicCredential("app", "secret").toString()).doesNotContain("secret");
    }
}
