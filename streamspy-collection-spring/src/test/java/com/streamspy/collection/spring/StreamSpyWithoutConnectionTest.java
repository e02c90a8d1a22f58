package com.streamspy.collection.spring;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamspy.collection.core.devtools.DevToolsPlugin;
import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.collection.spring.autoconfigure.StreamSpyAutoConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Configuration;

@SpringBootTest(
        classes = StreamSpyWithoutConnectionTest.TestConfig.class,
        properties = {"streamspy.cycle.enabled=false", "streamspy.stack-trace.enabled=false"})
@ImportAutoConfiguration(classes = StreamSpyAutoConfiguration.class)
class StreamSpyWithoutConnectionTest {

    @Configuration
    static class TestConfig {}

    @Autowired
    private Spy spy;

    @Autowired
    private ApplicationContext context;

    @Test
    void only_local_bookkeeping_plugins_are_attached() {
        assertThat(spy.plugins()).extracting(Plugin::name).containsExactly("graph", "snapshot");
        assertThat(context.getBeanNamesForType(DevToolsPlugin.class)).isEmpty();
    }
}
