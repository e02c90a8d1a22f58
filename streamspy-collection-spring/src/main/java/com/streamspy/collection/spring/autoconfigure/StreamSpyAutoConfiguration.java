package com.streamspy.collection.spring.autoconfigure;

import com.streamspy.collection.core.cycle.CyclePlugin;
import com.streamspy.collection.core.devtools.Connection;
import com.streamspy.collection.core.devtools.DevToolsOptions;
import com.streamspy.collection.core.devtools.DevToolsPlugin;
import com.streamspy.collection.core.graph.GraphPlugin;
import com.streamspy.collection.core.snapshot.SnapshotPlugin;
import com.streamspy.collection.core.spi.ClassNameInference;
import com.streamspy.collection.core.spi.Identifier;
import com.streamspy.collection.core.spi.JacksonValueSerializer;
import com.streamspy.collection.core.spi.ObservableInference;
import com.streamspy.collection.core.spi.StackTraceProvider;
import com.streamspy.collection.core.spi.ThreadStackTraceProvider;
import com.streamspy.collection.core.spi.ValueSerializer;
import com.streamspy.collection.core.spi.WeakIdentifier;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.collection.core.stacktrace.StackTracePlugin;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers a {@link Spy} with the standard plugins attached, in the order their bookkeeping
 * depends on: stack traces, graph, snapshots, cycle detection and, when the application provides a
 * {@link Connection}, the devtools session. The spy is torn down with the context.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(StreamSpyProperties.class)
@ConditionalOnProperty(prefix = "streamspy", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StreamSpyAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Identifier streamSpyIdentifier() {
        return new WeakIdentifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObservableInference streamSpyObservableInference() {
        return new ClassNameInference();
    }

    @Bean
    @ConditionalOnMissingBean
    public ValueSerializer streamSpyValueSerializer() {
        return new JacksonValueSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public StackTraceProvider streamSpyStackTraceProvider() {
        return new ThreadStackTraceProvider();
    }

    @Bean(destroyMethod = "teardown")
    @ConditionalOnMissingBean
    public Spy spy(
            Identifier identifier,
            ObservableInference inference,
            ValueSerializer serializer,
            ObjectProvider<Clock> clock) {
        return new Spy(identifier, inference, serializer, clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnProperty(
            prefix = "streamspy.stack-trace",
            name = "enabled",
            havingValue = "true",
            matchIfMissing = true)
    public StackTracePlugin stackTracePlugin(Spy spy, StackTraceProvider provider) {
        StackTracePlugin plugin = new StackTracePlugin(provider);
        spy.plug(plugin);
        return plugin;
    }

    @Bean
    public GraphPlugin graphPlugin(Spy spy, ObjectProvider<StackTracePlugin> stackTrace) {
        // plugged first: later plugins read traces during before-subscribe
        stackTrace.getIfAvailable();
        GraphPlugin plugin = new GraphPlugin(spy);
        spy.plug(plugin);
        return plugin;
    }

    @Bean
    public SnapshotPlugin snapshotPlugin(Spy spy, GraphPlugin graph, StreamSpyProperties properties) {
        SnapshotPlugin plugin = new SnapshotPlugin(
                spy, properties.getSnapshot().getKeptValues(), properties.getSnapshot().getKeptClosed());
        spy.plug(plugin);
        return plugin;
    }

    @Bean
    @ConditionalOnProperty(prefix = "streamspy.cycle", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CyclePlugin cyclePlugin(Spy spy, SnapshotPlugin snapshot, StreamSpyProperties properties) {
        CyclePlugin plugin = new CyclePlugin(spy, properties.getCycle().getThreshold());
        spy.plug(plugin);
        return plugin;
    }

    @Bean
    @ConditionalOnBean(Connection.class)
    public DevToolsPlugin devToolsPlugin(
            Spy spy,
            Connection connection,
            SnapshotPlugin snapshot,
            ObjectProvider<CyclePlugin> cycle,
            StreamSpyProperties properties) {
        cycle.getIfAvailable();
        StreamSpyProperties.Devtools devtools = properties.getDevtools();
        DevToolsPlugin plugin = new DevToolsPlugin(
                spy,
                connection,
                new DevToolsOptions(devtools.getBatchMilliseconds(), devtools.getBatchNotifications()));
        spy.plug(plugin);
        log.info("StreamSpy devtools session attached");
        return plugin;
    }
}
