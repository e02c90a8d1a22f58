package com.streamspy.collection.core.pause;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.streamspy.model.Notification;
import com.streamspy.model.SubscriptionRef;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeckTest {

    private final SubscriptionRef ref = new SubscriptionRef(new Object(), new Object(), new Object());
    private final List<Object> delivered = new ArrayList<>();
    private final List<DeckStats> stats = new ArrayList<>();
    private final Deck deck = new Deck("deck-1", n -> delivered.add(n.value()));

    @Test
    void running_deck_passes_notifications_straight_through() {
        admit(1);
        admit(2);

        assertThat(deck.state()).isEqualTo(DeckState.RUNNING);
        assertThat(delivered).containsExactly(1, 2);
    }

    @Test
    void resume_delivers_everything_buffered_in_arrival_order() {
        deck.pause();
        for (int i = 0; i < 5; i++) admit(i);
        assertThat(delivered).isEmpty();
        assertThat(deck.stats().notifications()).isEqualTo(5);

        deck.resume();

        assertThat(delivered).containsExactly(0, 1, 2, 3, 4);
        assertThat(deck.stats()).isEqualTo(new DeckStats(false, 0, 5, 0, 0, 0));
        admit(5);
        assertThat(delivered).endsWith(5);
    }

    @Test
    void step_releases_one_and_stays_paused() {
        deck.pause();
        admit("a");
        admit("b");

        deck.step();

        assertThat(delivered).containsExactly("a");
        assertThat(deck.paused()).isTrue();
        assertThat(deck.stats().stepped()).isEqualTo(1);
        assertThat(deck.stats().notifications()).isEqualTo(1);
    }

    @Test
    void skip_discards_the_oldest_without_delivery() {
        deck.pause();
        admit("a");
        admit("b");

        deck.skip();
        deck.resume();

        assertThat(delivered).containsExactly("b");
        assertThat(deck.stats().skipped()).isEqualTo(1);
    }

    @Test
    void clear_discards_everything_and_keeps_state() {
        deck.pause();
        admit("a");
        admit("b");

        deck.clear();

        assertThat(deck.paused()).isTrue();
        deck.resume();
        assertThat(delivered).isEmpty();
        assertThat(deck.stats().cleared()).isEqualTo(2);
    }

    @Test
    void step_and_skip_on_empty_buffer_change_nothing() {
        deck.step();
        deck.skip();

        assertThat(deck.state()).isEqualTo(DeckState.RUNNING);
        assertThat(deck.stats()).isEqualTo(new DeckStats(false, 0, 0, 0, 0, 0));
    }

    @Test
    void stats_are_published_on_transitions_and_admissions() throws Exception {
        AutoCloseable handle = deck.addStatsListener(stats::add);

        deck.pause();
        admit("a");
        deck.resume();

        assertThat(stats).extracting(DeckStats::paused).containsExactly(true, true, false);
        assertThat(stats).extracting(DeckStats::notifications).containsExactly(0, 1, 0);

        handle.close();
        deck.pause();
        assertThat(stats).hasSize(3);
    }

    @Test
    void inspect_is_rejected_without_changing_state() {
        deck.pause();
        admit("a");

        assertThrows(UnsupportedOperationException.class, () -> deck.apply(DeckCommand.INSPECT));

        assertThat(deck.stats()).isEqualTo(new DeckStats(true, 1, 0, 0, 0, 0));
    }

    @Test
    void commands_parse_from_wire_names() {
        assertThat(DeckCommand.parse("step")).contains(DeckCommand.STEP);
        assertThat(DeckCommand.parse("inspect")).contains(DeckCommand.INSPECT);
        assertThat(DeckCommand.parse("STEP")).isEmpty();
        assertThat(DeckCommand.parse(null)).isEmpty();
    }

    private void admit(Object value) {
        deck.admit(new PausedNotification(ref, Notification.NEXT, value, 0));
    }
}
