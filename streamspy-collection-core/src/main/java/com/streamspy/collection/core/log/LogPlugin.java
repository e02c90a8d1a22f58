package com.streamspy.collection.core.log;

import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.model.Notification;
import com.streamspy.model.SubscriptionRef;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the notifications of one observable, named by its id or tag, at INFO.
 *
 * <p>Lines read {@code Tag = people; notification = next; value = {"name":"alice"}}; an observable
 * without a tag is labelled by its id instead.
 */
@Slf4j
public class LogPlugin implements Plugin {
    private final Spy spy;
    private final String spyId;

    public LogPlugin(Spy spy, String spyId) {
        this.spy = Objects.requireNonNull(spy, "spy");
        this.spyId = Objects.requireNonNull(spyId, "spyId");
    }

    @Override
    public String name() {
        return "log";
    }

    public String spyId() {
        return spyId;
    }

    @Override
    public void beforeSubscribe(SubscriptionRef ref) {
        log(ref, Notification.SUBSCRIBE, null);
    }

    @Override
    public void beforeNext(SubscriptionRef ref, Object value) {
        log(ref, Notification.NEXT, value);
    }

    @Override
    public void beforeError(SubscriptionRef ref, Throwable error) {
        log(ref, Notification.ERROR, error);
    }

    @Override
    public void beforeComplete(SubscriptionRef ref) {
        log(ref, Notification.COMPLETE, null);
    }

    @Override
    public void beforeUnsubscribe(SubscriptionRef ref) {
        log(ref, Notification.UNSUBSCRIBE, null);
    }

    private void log(SubscriptionRef ref, Notification notification, Object value) {
        if (!log.isInfoEnabled() || !spy.matches(ref, spyId)) return;
        Object observable = ref.observable();
        String tag = spy.inference().inferTag(observable);
        String label = tag != null ? "Tag" : "ID";
        String name = tag != null ? tag : spy.identifier().identify(observable);
        if (notification.carriesValue()) {
            log.info(
                    "{} = {}; notification = {}; value = {}",
                    label,
                    name,
                    notification.wireName(),
                    spy.serializer().serialize(value));
        } else {
            log.info("{} = {}; notification = {}", label, name, notification.wireName());
        }
    }
}
