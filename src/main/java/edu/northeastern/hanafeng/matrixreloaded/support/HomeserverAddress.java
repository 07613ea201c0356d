package edu.northeastern.hanafeng.matrixreloaded.support;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Server name and base URL of a homeserver, parsed from user input.
 *
 * <pre>
 * parse("matrix.domain.com")         -> (matrix.domain.com, https://matrix.domain.com)
 * parse("http://matrix.domain.com")  -> (matrix.domain.com, http://matrix.domain.com)
 * </pre>
 */
public record HomeserverAddress(String serverName, String url) {

    private static final Pattern SCHEME = Pattern.compile("^(https?)://");
    private static final String DEFAULT_SCHEME = "https";

    public static HomeserverAddress parse(String homeserver) {
        return parse(homeserver, null);
    }

    public static HomeserverAddress parse(String homeserver, String scheme) {
        if (homeserver == null || homeserver.isBlank()) {
            throw new IllegalArgumentException("homeserver must not be blank");
        }
        String trimmed = homeserver.trim();
        Matcher matcher = SCHEME.matcher(trimmed);
        if (matcher.find()) {
            return new HomeserverAddress(trimmed.substring(matcher.end()), trimmed);
        }
        String effectiveScheme = scheme == null ? DEFAULT_SCHEME : scheme;
        return new HomeserverAddress(trimmed, effectiveScheme + "://" + trimmed);
    }

    public String userId(String localpart) {
        return "@" + localpart + ":" + serverName;
    }
}
