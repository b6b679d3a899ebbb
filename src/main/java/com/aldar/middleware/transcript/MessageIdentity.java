package com.aldar.middleware.transcript;

import com.aldar.middleware.model.MessageRole;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.UUID;

/**
 * Content-addressed message ids: version-5 UUIDs over a fixed namespace, so the same
 * run-log input always reconciles to the same id.
 */
public final class MessageIdentity {

    public static final UUID NAMESPACE = UUID.fromString("6f1c9a52-3b7e-5d0a-9c41-0e8d2b7f4a13");
    public static final int CONTENT_PREFIX_LENGTH = 200;

    static final String NO_RUN = "no-run";
    static final String NO_TIMESTAMP = "no-timestamp";

    private MessageIdentity() {
    }

    public static String assign(String sessionId, String runId, MessageRole role, String content, Instant timestamp) {
        String name = String.join("|",
                nullToEmpty(sessionId),
                runId == null || runId.isBlank() ? NO_RUN : runId,
                role == null ? "" : role.wireName(),
                prefix(content),
                timestamp == null ? NO_TIMESTAMP : timestamp.toString()
        );
        return nameUuidV5(NAMESPACE, name).toString();
    }

    public static String forStream(String sessionId, String streamId) {
        return nameUuidV5(NAMESPACE, String.join("|", nullToEmpty(sessionId), "stream", nullToEmpty(streamId))).toString();
    }

    static UUID nameUuidV5(UUID namespace, String name) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-1 not available", ex);
        }
        ByteBuffer namespaceBytes = ByteBuffer.allocate(16);
        namespaceBytes.putLong(namespace.getMostSignificantBits());
        namespaceBytes.putLong(namespace.getLeastSignificantBits());
        digest.update(namespaceBytes.array());
        byte[] hash = digest.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] &= 0x0f;
        hash[6] |= 0x50;
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80;

        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    private static String prefix(String content) {
        if (content == null) {
            return "";
        }
        return content.length() <= CONTENT_PREFIX_LENGTH ? content : content.substring(0, CONTENT_PREFIX_LENGTH);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
