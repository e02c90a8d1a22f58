package com.streamspy.collection.core.spi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.lang.reflect.Array;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Jackson-backed serializer that survives cyclic values. Maps, iterables and arrays are walked
 * directly; a container that is already on the current path is written as a {@code ~}-separated
 * reference to it ({@code "~"} for the root, {@code "~items~0"} for a nested one). Other objects go
 * through the mapper and fall back to {@code toString()} when the mapper cannot handle them.
 */
public class JacksonValueSerializer implements ValueSerializer {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper;

    public JacksonValueSerializer() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
    }

    public JacksonValueSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String serialize(Object value) {
        JsonNode node = toNode(value, new ArrayDeque<>(), new IdentityHashMap<>());
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode value tree", e);
        }
    }

    private JsonNode toNode(Object value, Deque<String> path, IdentityHashMap<Object, String> ancestors) {
        if (value == null) return NODES.nullNode();
        if (value instanceof String s) return NODES.textNode(s);
        if (value instanceof Boolean b) return NODES.booleanNode(b);
        if (value instanceof Number || value instanceof Character) return mapper.valueToTree(value);
        if (value instanceof Enum<?> e) return NODES.textNode(e.name());
        if (value instanceof Optional<?> opt) return toNode(opt.orElse(null), path, ancestors);
        if (value instanceof Throwable t) return throwableNode(t);

        String seen = ancestors.get(value);
        if (seen != null) return NODES.textNode(seen);

        if (value instanceof Map<?, ?> map) {
            ancestors.put(value, reference(path));
            ObjectNode node = NODES.objectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                path.addLast(key);
                node.set(key, toNode(entry.getValue(), path, ancestors));
                path.removeLast();
            }
            ancestors.remove(value);
            return node;
        }
        if (value instanceof Iterable<?> iterable) {
            ancestors.put(value, reference(path));
            ArrayNode node = NODES.arrayNode();
            int index = 0;
            for (Object item : iterable) {
                path.addLast(Integer.toString(index++));
                node.add(toNode(item, path, ancestors));
                path.removeLast();
            }
            ancestors.remove(value);
            return node;
        }
        if (value.getClass().isArray()) {
            ancestors.put(value, reference(path));
            ArrayNode node = NODES.arrayNode();
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                path.addLast(Integer.toString(i));
                node.add(toNode(Array.get(value, i), path, ancestors));
                path.removeLast();
            }
            ancestors.remove(value);
            return node;
        }
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException ex) {
            // Jackson reports self-referencing beans as infinite recursion.
            return NODES.textNode(String.valueOf(value));
        }
    }

    private static ObjectNode throwableNode(Throwable t) {
        ObjectNode node = NODES.objectNode();
        node.put("name", t.getClass().getSimpleName());
        node.put("message", t.getMessage());
        return node;
    }

    private static String reference(Deque<String> path) {
        return path.isEmpty() ? "~" : "~" + String.join("~", path);
    }
}
