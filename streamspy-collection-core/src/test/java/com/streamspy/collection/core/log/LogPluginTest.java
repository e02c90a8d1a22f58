package com.streamspy.collection.core.log;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.streamspy.collection.core.FakeSubject;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.model.SubscriptionRef;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogPluginTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LogPlugin.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Spy spy = new Spy();

    @BeforeEach
    void setUp() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void logs_notifications_of_the_tagged_observable() {
        spy.plug(new LogPlugin(spy, "people"));
        FakeSubject people = new FakeSubject(spy, "people");
        FakeSubject other = new FakeSubject(spy, "other");
        SubscriptionRef ref = people.subscribe(v -> {});
        other.subscribe(v -> {});

        people.next(Map.of("name", "alice"));
        other.next("ignored");
        people.unsubscribe(ref);

        List<String> lines = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertThat(lines)
                .containsExactly(
                        "Tag = people; notification = subscribe",
                        "Tag = people; notification = next; value = {\"name\":\"alice\"}",
                        "Tag = people; notification = unsubscribe");
    }

    @Test
    void untagged_observable_is_labelled_by_id() {
        FakeSubject subject = new FakeSubject(spy);
        String id = spy.identifier().identify(subject);
        spy.plug(new LogPlugin(spy, id));

        subject.subscribe(v -> {});
        subject.error(new IllegalStateException("boom"));

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        "ID = " + id + "; notification = subscribe",
                        "ID = " + id + "; notification = error; value = {\"name\":\"IllegalStateException\",\"message\":\"boom\"}");
    }
}
