package io.github.drompincen.vibehub.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a session's conversation history.
 *
 * @param seq       logical position in the session's full history, starting at 0
 * @param role      {@code user} or {@code assistant}
 * @param content   a plain string for user prompts, an array of content blocks for assistant turns
 * @param timestamp epoch millis
 */
public record StoredMessage(
        long seq,
        String role,
        JsonNode content,
        long timestamp
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public StoredMessage withSeq(long newSeq) {
        return new StoredMessage(newSeq, role, content, timestamp);
    }
}
