package io.github.drompincen.vibehub.runtime.session;

import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReplayPlanTest {

    private static List<StoredMessage> history(long from, long to) {
        List<StoredMessage> messages = new ArrayList<>();
        for (long i = from; i < to; i++) {
            messages.add(new StoredMessage(i, i % 2 == 0 ? "user" : "assistant", TextNode.valueOf("m" + i), i));
        }
        return messages;
    }

    @Test
    void unknownCountReplaysEverything() {
        ReplayPlan plan = ReplayPlan.compute(history(0, 4), 0, 4, null);
        assertThat(plan.startIndex()).isZero();
        assertThat(plan.messages()).extracting(StoredMessage::seq).containsExactly(0L, 1L, 2L, 3L);
    }

    @Test
    void replaysOnlyMissingSuffix() {
        ReplayPlan plan = ReplayPlan.compute(history(0, 5), 0, 5, 3L);
        assertThat(plan.startIndex()).isEqualTo(3);
        assertThat(plan.messages()).extracting(StoredMessage::seq).containsExactly(3L, 4L);
    }

    @Test
    void upToDateClientGetsNothing() {
        assertThat(ReplayPlan.compute(history(0, 5), 0, 5, 5L).isEmpty()).isTrue();
        assertThat(ReplayPlan.compute(history(0, 5), 0, 5, 9L).isEmpty()).isTrue();
    }

    @Test
    void negativeCountTreatedAsZero() {
        assertThat(ReplayPlan.compute(history(0, 2), 0, 2, -4L).messages()).hasSize(2);
    }

    @Test
    void countIsRelativeToColdStartBase() {
        // 120 entries in total, cold start loaded the last 50
        List<StoredMessage> window = history(70, 120);

        ReplayPlan fresh = ReplayPlan.compute(window, 70, 120, 0L);
        assertThat(fresh.startIndex()).isEqualTo(70);
        assertThat(fresh.messages()).hasSize(50);

        assertThat(ReplayPlan.compute(window, 70, 120, 50L).isEmpty()).isTrue();

        ReplayPlan recent = ReplayPlan.compute(window, 70, 120, 48L);
        assertThat(recent.messages()).extracting(StoredMessage::seq).containsExactly(118L, 119L);
    }

    @Test
    void entriesTrimmedFromWindowAreSkipped() {
        // base 0, but live traffic pushed entries 0..9 out of a 10 entry window
        List<StoredMessage> window = history(10, 20);

        ReplayPlan stale = ReplayPlan.compute(window, 0, 20, 4L);
        assertThat(stale.startIndex()).isEqualTo(4);
        assertThat(stale.messages()).extracting(StoredMessage::seq).first().isEqualTo(10L);
        assertThat(stale.messages()).hasSize(10);
    }

    @Test
    void nonDecreasingCountsNeverResendAnIndex() {
        List<StoredMessage> window = history(30, 40);
        List<Long> seen = new ArrayList<>();
        long shown = 0;
        for (long count : new long[]{0L, 4L, 4L, 7L, 10L}) {
            ReplayPlan plan = ReplayPlan.compute(window, 30, 40, Math.max(count, shown));
            plan.messages().forEach(m -> seen.add(m.seq()));
            shown = Math.max(shown, count) + plan.messages().size();
        }
        assertThat(seen).doesNotHaveDuplicates();
        assertThat(seen).containsExactly(30L, 31L, 32L, 33L, 34L, 35L, 36L, 37L, 38L, 39L);
    }

    @Test
    void repeatedComputationIsStable() {
        List<StoredMessage> window = history(0, 6);
        assertThat(ReplayPlan.compute(window, 0, 6, 2L)).isEqualTo(ReplayPlan.compute(window, 0, 6, 2L));
    }
}
