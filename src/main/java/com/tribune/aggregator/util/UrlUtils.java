package com.tribune.aggregator.util;

import lombok.experimental.UtilityClass;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

@UtilityClass
public class UrlUtils {

    public boolean isAbsolute(String url) {
        if (url == null) return false;
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /**
     * Resolves {@code url} against the scheme and host of {@code base}. Absolute URLs are
     * returned unchanged; anything that cannot be resolved comes back as the raw value.
     */
    public String resolveAgainstOrigin(String url, String base) {
        if (url == null) return null;
        String trimmed = url.trim();
        if (isAbsolute(trimmed)) return trimmed;

        try {
            URI baseUri = URI.create(base.trim());
            if (baseUri.getScheme() == null || baseUri.getRawAuthority() == null) {
                return trimmed;
            }
            URI origin = URI.create(baseUri.getScheme() + "://" + baseUri.getRawAuthority() + "/");
            return origin.resolve(trimmed.replace(" ", "%20")).toString();
        } catch (Exception e) {
            return trimmed;
        }
    }

    public Optional<String> host(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        try {
            return Optional.ofNullable(URI.create(url.trim()).getHost())
                    .map(h -> h.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
