package io.github.drompincen.vibehub.runtime.session;

import io.github.drompincen.vibehub.protocol.api.StoredMessage;

import java.util.List;

/**
 * Which history entries a (re)connecting client is missing.
 *
 * @param startIndex first logical index to send
 * @param messages   entries to send, in order; may start later than {@code startIndex} when older
 *                   entries are no longer in the in-memory window
 */
public record ReplayPlan(long startIndex, List<StoredMessage> messages) {

    public ReplayPlan {
        messages = List.copyOf(messages);
    }

    /**
     * A client counts the entries it shows since the session's cold start, so its count is an
     * offset from {@code historyBase}, not a position in the full history.
     *
     * @param window             the in-memory history window, ordered by {@code seq}
     * @param historyBase        {@code seq} of the first entry loaded on cold start
     * @param historyLength      total number of entries in the session's history
     * @param clientMessageCount entries the client reports showing, {@code null} treated as 0
     */
    public static ReplayPlan compute(List<StoredMessage> window, long historyBase, long historyLength,
                                     Long clientMessageCount) {
        long reported = clientMessageCount != null ? Math.max(0L, clientMessageCount) : 0L;
        long start = historyBase + Math.min(reported, historyLength - historyBase);
        if (start >= historyLength) {
            return new ReplayPlan(historyLength, List.of());
        }
        List<StoredMessage> missing = window.stream()
                .filter(m -> m.seq() >= start)
                .toList();
        return new ReplayPlan(start, missing);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
