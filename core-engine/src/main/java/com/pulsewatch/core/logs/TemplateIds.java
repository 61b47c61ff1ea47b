package com.pulsewatch.core.logs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Content-derived template ids.
 *
 * <p>
 * The id is the first 16 hex digits of the MD5 of the service name and the
 * token sequence that created the template, so replaying the same stream
 * yields the same ids in any process.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemplateIds {

    private static final int ID_HEX_LENGTH = 16;

    private TemplateIds() {
    }

    public static String of(String service, List<String> tokens) {
        String canonical = service + '\u0000' + String.join(" ", tokens);
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, ID_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
