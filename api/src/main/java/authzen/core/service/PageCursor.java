package authzen.core.service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque search cursor holding the offset of the next candidate.
 */
final class PageCursor {

    private static final String PREFIX = "offset:";

    private PageCursor() {}

    static String encode(int offset) {
        return Base64.getUrlEncoder()
                .withoutPadding()
                .encodeToString((PREFIX + offset).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the token was not produced by {@link #encode(int)}
     */
    static int decode(String token) {
        final String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid page token", e);
        }
        if (!raw.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Invalid page token");
        }
        try {
            final var offset = Integer.parseInt(raw.substring(PREFIX.length()));
            if (offset < 0) {
                throw new IllegalArgumentException("Invalid page token");
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page token", e);
        }
    }
}
