package io.fedfetch.http.auth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hosts that belong to the identity provider and may therefore receive credentials.
 * <p>
 * An entry is either a full host name, matched exactly, or {@code *.domain}, which matches
 * any host ending in {@code .domain} on a label boundary (but not {@code domain} itself).
 * Matching is case-insensitive and ignores a trailing dot. Substring containment never
 * matches: {@code urs.example.com.attacker.net} is not trusted by {@code urs.example.com}.
 */
public final class TrustedHostSet {

    private final Set<String> exactHosts;
    private final List<String> wildcardSuffixes;

    private TrustedHostSet(Set<String> exactHosts, List<String> wildcardSuffixes) {
        this.exactHosts = Collections.unmodifiableSet(exactHosts);
        this.wildcardSuffixes = Collections.unmodifiableList(wildcardSuffixes);
    }

    public static TrustedHostSet of(String... entries) {
        return of(List.of(entries));
    }

    public static TrustedHostSet of(Collection<String> entries) {
        Set<String> exact = new LinkedHashSet<>();
        List<String> wildcards = new ArrayList<>();

        for (String entry : entries) {
            String normalized = normalize(entry);
            if (normalized.isEmpty()) {
                continue;
            }
            if (normalized.startsWith("*.")) {
                String suffix = normalized.substring(1);
                if (suffix.length() < 2 || suffix.indexOf('*') >= 0) {
                    throw new IllegalArgumentException("Invalid trusted host pattern: " + entry);
                }
                wildcards.add(suffix);
            } else if (normalized.indexOf('*') >= 0) {
                throw new IllegalArgumentException("Wildcards are only allowed as the first label: " + entry);
            } else {
                exact.add(normalized);
            }
        }

        return new TrustedHostSet(exact, wildcards);
    }

    public boolean contains(String host) {
        if (host == null) {
            return false;
        }
        String normalized = normalize(host);
        if (normalized.isEmpty()) {
            return false;
        }
        if (exactHosts.contains(normalized)) {
            return true;
        }
        for (String suffix : wildcardSuffixes) {
            // suffix starts with '.', so a match is always anchored on a label boundary
            if (normalized.endsWith(suffix) && normalized.length() > suffix.length()) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return exactHosts.isEmpty() && wildcardSuffixes.isEmpty();
    }

    private static String normalize(String host) {
        String trimmed = host == null ? "" : host.trim().toLowerCase(Locale.ROOT);
        if (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String toString() {
        List<String> all = new ArrayList<>(exactHosts);
        for (String suffix : wildcardSuffixes) {
            all.add("*" + suffix);
        }
        return "TrustedHostSet" + all;
    }
}
