package io.fedfetch.http.auth;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/**
 * Network interceptor that applies the {@link CredentialHeaderPolicy} to every request
 * that goes on the wire, redirect hops included. The active credential travels with the
 * request as a {@code HttpCredential} tag, which OkHttp copies onto follow-up requests.
 */
public class CredentialHeaderInterceptor implements Interceptor {

    private final CredentialHeaderPolicy policy;

    public CredentialHeaderInterceptor(CredentialHeaderPolicy policy) {
        this.policy = policy;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        HttpCredential credential = request.tag(HttpCredential.class);
        return chain.proceed(policy.apply(request, credential));
    }
}
