package com.eyelevel.dispatcher.scheduling;

import com.eyelevel.dispatcher.common.json.jackson.JacksonJsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigHasherTest {

    private final ConfigHasher hasher = new ConfigHasher(new JacksonJsonSerializer(new ObjectMapper()));

    @Test
    void hash_ignoresKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", 2);
        second.put("a", 1);

        assertThat(hasher.hash(first)).isEqualTo(hasher.hash(second));
    }

    @Test
    void hash_ignoresMapImplementationInNestedValues() {
        Map<String, Object> nestedTree = new TreeMap<>(Map.of("z", true, "y", "deep"));
        Map<String, Object> nestedHash = new HashMap<>(Map.of("y", "deep", "z", true));

        assertThat(hasher.hash(Map.of("opts", nestedTree, "list", List.of(1, 2))))
                .isEqualTo(hasher.hash(Map.of("list", List.of(1, 2), "opts", nestedHash)));
    }

    @Test
    void hash_keepsListOrderSignificant() {
        assertThat(hasher.hash(Map.of("order", List.of(1, 2))))
                .isNotEqualTo(hasher.hash(Map.of("order", List.of(2, 1))));
    }

    @Test
    void hash_sortsSetElements() {
        Set<String> first = new LinkedHashSet<>(List.of("x", "y"));
        Set<String> second = new LinkedHashSet<>(List.of("y", "x"));

        assertThat(hasher.hash(Map.of("tags", first))).isEqualTo(hasher.hash(Map.of("tags", second)));
    }

    @Test
    void hash_distinguishesValues() {
        assertThat(hasher.hash(Map.of("a", 1))).isNotEqualTo(hasher.hash(Map.of("a", 2)));
        assertThat(hasher.hash(Map.of("a", 1))).isNotEqualTo(hasher.hash(Map.of("b", 1)));
    }

    @Test
    void hash_treatsNullConfigAsEmpty() {
        assertThat(hasher.hash(null)).isEqualTo(hasher.hash(Map.of())).hasSize(64);
    }

    @Test
    void hash_acceptsNullValues() {
        Map<String, Object> config = new HashMap<>();
        config.put("password", null);

        assertThat(hasher.hash(config)).isNotEqualTo(hasher.hash(Map.of()));
    }

    @Test
    void normalize_producesSortedKeyValuePairs() {
        Object normalized = hasher.normalize(Map.of("b", Map.of("d", 4, "c", 3), "a", new int[]{1, 2}));

        assertThat(normalized).isEqualTo(List.of(Arrays.asList("a", List.of(1, 2)),
                                                 Arrays.asList("b", List.of(Arrays.asList("c", 3),
                                                                            Arrays.asList("d", 4)))));
    }

    @Test
    void effectiveConfig_overlaysSubmissionParametersOnDefaults() {
        Map<String, Object> effective = hasher.effectiveConfig(Map.of("depth", 1, "mode", "fast"),
                                                               Map.of("depth", 3));

        assertThat(effective).containsEntry("depth", 3).containsEntry("mode", "fast");
        assertThat(hasher.effectiveConfig(null, null)).isEmpty();
    }

    @Test
    void resultKey_isStableAndSeparatesItsParts() {
        ResultKey key = new ResultKey("abc", "Ext.ract", "4.2", "h1");

        assertThat(key.toString()).isEqualTo("abc.Ext_ract.v4_2.ch1");
        assertThat(key.toString()).isEqualTo(new ResultKey("abc", "Ext.ract", "4.2", "h1").toString());
        assertThat(key.toString()).isNotEqualTo(new ResultKey("abc", "Ext.ract", "4.2", "h2").toString());
    }

    @Test
    void resultKey_doesNotDistinguishDotsFromUnderscores() {
        assertThat(new ResultKey("abc", "a.b", "1.2", "h1").toString())
                .isEqualTo(new ResultKey("abc", "a_b", "1_2", "h1").toString());
    }

    @Test
    void hash_treatsNestedListsInOrderAndNestedMapsByKey() {
        Map<String, Object> first = Map.of("opts", List.of(Map.of("a", 1, "b", 2), "x"));
        Map<String, Object> second = Map.of("opts", List.of(Map.of("b", 2, "a", 1), "x"));
        Map<String, Object> reordered = Map.of("opts", List.of("x", Map.of("a", 1, "b", 2)));

        assertThat(hasher.hash(first)).isEqualTo(hasher.hash(second));
        assertThat(hasher.hash(first)).isNotEqualTo(hasher.hash(reordered));
    }
}
