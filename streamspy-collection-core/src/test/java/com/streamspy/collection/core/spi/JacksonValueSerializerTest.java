package com.streamspy.collection.core.spi;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JacksonValueSerializerTest {

    private final JacksonValueSerializer serializer = new JacksonValueSerializer();

    @Test
    void serializes_plain_values() {
        assertThat(serializer.serialize(null)).isEqualTo("null");
        assertThat(serializer.serialize("a")).isEqualTo("\"a\"");
        assertThat(serializer.serialize(42)).isEqualTo("42");
        assertThat(serializer.serialize(Optional.of(true))).isEqualTo("true");
        assertThat(serializer.serialize(new int[] {1, 2})).isEqualTo("[1,2]");
        assertThat(serializer.serialize(Instant.ofEpochSecond(0))).isEqualTo("\"1970-01-01T00:00:00Z\"");
    }

    @Test
    void serializes_beans_and_records() {
        assertThat(serializer.serialize(new Point(1, 2))).isEqualTo("{\"x\":1,\"y\":2}");
    }

    @Test
    void replaces_cycles_with_path_references() {
        Map<String, Object> root = new LinkedHashMap<>();
        List<Object> items = new ArrayList<>();
        Map<String, Object> child = new LinkedHashMap<>();
        child.put("parent", root);
        child.put("siblings", items);
        items.add(child);
        root.put("items", items);

        assertThat(serializer.serialize(root))
                .isEqualTo("{\"items\":[{\"parent\":\"~\",\"siblings\":\"~items\"}]}");
    }

    @Test
    void shared_but_acyclic_values_are_written_twice() {
        List<Integer> shared = List.of(1);
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("a", shared);
        value.put("b", shared);

        assertThat(serializer.serialize(value)).isEqualTo("{\"a\":[1],\"b\":[1]}");
    }

    @Test
    void throwables_become_name_and_message() {
        assertThat(serializer.serialize(new IllegalArgumentException("bad")))
                .isEqualTo("{\"name\":\"IllegalArgumentException\",\"message\":\"bad\"}");
    }

    record Point(int x, int y) {}
}
