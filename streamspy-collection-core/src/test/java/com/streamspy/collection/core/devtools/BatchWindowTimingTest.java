package com.streamspy.collection.core.devtools;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamspy.client.testkit.InMemoryMessageTransport;
import com.streamspy.collection.core.FakeSubject;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.collection.core.spy.Teardown;
import org.junit.jupiter.api.Test;

/** Batch windows on the real scheduler thread. */
class BatchWindowTimingTest {

    private final Spy spy = new Spy();
    private final InMemoryMessageTransport transport = new InMemoryMessageTransport();

    @Test
    void open_window_posts_one_batch_after_the_delay() throws Exception {
        Teardown teardown = spy.plug(
                new DevToolsPlugin(spy, new JsonConnection(transport), new DevToolsOptions(50, 150)));
        try {
            new FakeSubject(spy).subscribe(v -> {});

            long deadline = System.currentTimeMillis() + 2_000;
            while (transport.frames().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertThat(transport.texts()).hasSize(1);
            JsonNode batch = new ObjectMapper().readTree(transport.texts().get(0));
            assertThat(batch.path("messageType").asText()).isEqualTo("batch");
            assertThat(batch.path("messages").size()).isEqualTo(2);
        } finally {
            teardown.teardown();
        }
    }

    @Test
    void teardown_cancels_the_armed_window() throws Exception {
        Teardown teardown = spy.plug(
                new DevToolsPlugin(spy, new JsonConnection(transport), new DevToolsOptions(50, 150)));
        new FakeSubject(spy).subscribe(v -> {});

        teardown.teardown();
        Thread.sleep(200);

        assertThat(transport.frames()).isEmpty();
        assertThat(transport.isClosed()).isTrue();
    }
}
