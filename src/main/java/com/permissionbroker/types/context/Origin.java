package com.permissionbroker.types.context;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * A scheme/host/port triple. Opaque origins serialize as {@code "null"}.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Origin {

    private static final String OPAQUE = "null";

    @Nullable
    private final String scheme;
    @Nullable
    private final String host;
    private final int port;

    public static Origin of(String scheme, String host, int port) {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        return new Origin(scheme.toLowerCase(Locale.ROOT), host.toLowerCase(Locale.ROOT), port);
    }

    /**
     * Derives the origin of a URL. URLs without a host (data:, about:blank, ...) yield an opaque origin.
     */
    public static Origin fromUri(URI uri) {
        Objects.requireNonNull(uri, "uri");
        if (uri.getScheme() == null || uri.getHost() == null) {
            return opaque();
        }
        return of(uri.getScheme(), uri.getHost(), uri.getPort());
    }

    public static Origin opaque() {
        return new Origin(null, null, -1);
    }

    public boolean isOpaque() {
        return scheme == null;
    }

    /**
     * Serialized form, {@code scheme://host[:port]} with the scheme's default port elided.
     */
    public String serialize() {
        if (isOpaque()) {
            return OPAQUE;
        }
        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port >= 0 && port != defaultPort(scheme)) {
            sb.append(':').append(port);
        }
        return sb.toString();
    }

    private static int defaultPort(String scheme) {
        switch (scheme) {
            case "http":
            case "ws":
                return 80;
            case "https":
            case "wss":
                return 443;
            default:
                return -1;
        }
    }

    @Override
    public String toString() {
        return serialize();
    }
}
