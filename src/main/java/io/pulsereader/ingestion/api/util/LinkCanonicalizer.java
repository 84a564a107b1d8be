package io.pulsereader.ingestion.api.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes article links into the form used as the deduplication key.
 * The same entry fetched twice must always map to the same string.
 */
public final class LinkCanonicalizer {

    // characters feeds publish unescaped that java.net.URI refuses
    private static final String UNSAFE_CHARACTERS = " \"<>\\^`{|}";

    private static final Pattern AUTHORITY_PORT = Pattern.compile("^(.*):(\\d+)$");

    private LinkCanonicalizer() {
    }

    public static Optional<String> canonicalize(String rawLink) {
        if (rawLink == null || rawLink.isBlank()) {
            return Optional.empty();
        }

        URI uri;
        try {
            uri = new URI(escapeUnsafe(rawLink.trim()));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }

        String scheme = uri.getScheme();
        if (scheme == null) {
            return Optional.empty();
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return Optional.empty();
        }

        String host = uri.getHost();
        int port = uri.getPort();
        if (host == null) {
            // registry-based authority, e.g. a host name with an underscore
            String authority = uri.getRawAuthority();
            if (authority == null || authority.isEmpty()) {
                return Optional.empty();
            }
            authority = authority.substring(authority.lastIndexOf('@') + 1);
            Matcher withPort = AUTHORITY_PORT.matcher(authority);
            if (withPort.matches()) {
                host = withPort.group(1);
                port = Integer.parseInt(withPort.group(2));
            } else {
                host = authority;
            }
            if (host.isEmpty()) {
                return Optional.empty();
            }
        }

        StringBuilder canonical = new StringBuilder()
                .append(scheme)
                .append("://")
                .append(host.toLowerCase(Locale.ROOT));

        if (port != -1 && !isDefaultPort(scheme, port)) {
            canonical.append(':').append(port);
        }

        String path = uri.getRawPath();
        canonical.append(path == null || path.isEmpty() ? "/" : path);

        String query = stripTrackingParameters(uri.getRawQuery());
        if (!query.isEmpty()) {
            canonical.append('?').append(query);
        }

        String fragment = uri.getRawFragment();
        if (isRouteFragment(fragment)) {
            canonical.append('#').append(fragment);
        }

        return Optional.of(canonical.toString());
    }

    private static String escapeUnsafe(String link) {
        StringBuilder escaped = new StringBuilder(link.length());
        boolean inFragment = false;
        for (int i = 0; i < link.length(); i++) {
            char c = link.charAt(i);
            if (c == '#' && !inFragment) {
                inFragment = true;
                escaped.append(c);
            } else if (c == '%' && !isEscapeSequence(link, i)) {
                escaped.append("%25");
            } else if (c == '#' || UNSAFE_CHARACTERS.indexOf(c) >= 0) {
                for (byte b : String.valueOf(c).getBytes(StandardCharsets.UTF_8)) {
                    escaped.append('%').append(String.format("%02X", b & 0xFF));
                }
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static boolean isEscapeSequence(String link, int index) {
        return index + 2 < link.length()
                && Character.digit(link.charAt(index + 1), 16) >= 0
                && Character.digit(link.charAt(index + 2), 16) >= 0;
    }

    /**
     * Single-page sites route articles through {@code #/path} or {@code #!path};
     * such fragments identify the article and must stay in the key.
     */
    private static boolean isRouteFragment(String fragment) {
        return fragment != null && fragment.length() > 1
                && (fragment.startsWith("/") || fragment.startsWith("!"));
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
    }

    private static String stripTrackingParameters(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        return Arrays.stream(rawQuery.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> !param.toLowerCase(Locale.ROOT).startsWith("utm_"))
                .collect(Collectors.joining("&"));
    }
}
