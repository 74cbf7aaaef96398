package io.fedfetch.http.client;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps the cookies of a single download call. Data hosts behind the identity provider
 * set a session cookie during the redirect round trip and expect it back on the final hop.
 */
public class InMemoryCookieJar implements CookieJar {

    private final List<Cookie> cookies = new ArrayList<>();

    @Override
    public synchronized void saveFromResponse(HttpUrl url, List<Cookie> responseCookies) {
        for (Cookie cookie : responseCookies) {
            cookies.removeIf(existing -> existing.name().equals(cookie.name())
                && existing.domain().equals(cookie.domain())
                && existing.path().equals(cookie.path()));
            cookies.add(cookie);
        }
    }

    @Override
    public synchronized List<Cookie> loadForRequest(HttpUrl url) {
        long now = System.currentTimeMillis();
        List<Cookie> matching = new ArrayList<>();
        Iterator<Cookie> iterator = cookies.iterator();
        while (iterator.hasNext()) {
            Cookie cookie = iterator.next();
            if (cookie.expiresAt() < now) {
                iterator.remove();
            } else if (cookie.matches(url)) {
                matching.add(cookie);
            }
        }
        return matching;
    }

    public synchronized int size() {
        return cookies.size();
    }
}
