package com.eyelevel.dispatcher.scheduling;

import com.eyelevel.dispatcher.common.json.JsonSerializer;
import lombok.RequiredArgsConstructor;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces a hash of a service configuration that does not depend on key order or map implementation.
 * Maps become key-sorted lists of {@code [key, value]} pairs, lists keep their order, sets are sorted by
 * the canonical form of their elements. The canonical form is serialized as JSON and hashed with SHA-256.
 */
@Component
@RequiredArgsConstructor
public class ConfigHasher {

    private final JsonSerializer jsonSerializer;

    public String hash(final Map<String, ?> config) {
        return DigestUtils.sha256Hex(jsonSerializer.serialize(normalize(config == null ? Map.of() : config)));
    }

    /**
     * The configuration a service runs with for one submission: its defaults overlaid with the submission's
     * parameters for that service.
     */
    public Map<String, Object> effectiveConfig(final Map<String, Object> defaults, final Map<String, Object> overrides) {
        final Map<String, Object> effective = new LinkedHashMap<>();
        if (defaults != null) {
            effective.putAll(defaults);
        }
        if (overrides != null) {
            effective.putAll(overrides);
        }
        return effective;
    }

    Object normalize(final Object value) {
        if (value instanceof Map<?, ?> map) {
            final List<List<Object>> pairs = new ArrayList<>(map.size());
            map.entrySet().stream().sorted(Comparator.comparing(entry -> String.valueOf(entry.getKey())))
               .forEach(entry -> pairs.add(Arrays.asList(String.valueOf(entry.getKey()), normalize(entry.getValue()))));
            return pairs;
        }
        if (value instanceof Set<?> set) {
            final List<Object> elements = new ArrayList<>(set.size());
            set.forEach(element -> elements.add(normalize(element)));
            elements.sort(Comparator.comparing((Object element) -> jsonSerializer.serialize(element)));
            return elements;
        }
        if (value instanceof Collection<?> collection) {
            final List<Object> elements = new ArrayList<>(collection.size());
            collection.forEach(element -> elements.add(normalize(element)));
            return elements;
        }
        return value;
    }
}
