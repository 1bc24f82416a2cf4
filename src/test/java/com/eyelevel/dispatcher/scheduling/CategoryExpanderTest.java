package com.eyelevel.dispatcher.scheduling;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryExpanderTest {

    @Test
    void expand_resolvesNestedCategoriesToServiceNames() {
        Map<String, Set<String>> categories = Map.of("static", Set.of("Strings", "Characterize"),
                                                     "deep", Set.of("static", "Sandbox"));

        Set<String> services = CategoryExpander.expand(List.of("deep", "Extract"), categories);

        assertThat(services).containsExactlyInAnyOrder("Strings", "Characterize", "Sandbox", "Extract");
    }

    @Test
    void expand_terminatesOnMutuallyReferencingCategories() {
        Map<String, Set<String>> categories = Map.of("A", Set.of("B", "svcA"), "B", Set.of("A", "svcB"));

        Set<String> services = CategoryExpander.expand(Set.of("A"), categories);

        assertThat(services).containsExactlyInAnyOrder("svcA", "svcB");
    }

    @Test
    void expand_terminatesOnSelfReferencingCategory() {
        Map<String, Set<String>> categories = Map.of("loop", Set.of("loop", "svc"));

        assertThat(CategoryExpander.expand(Set.of("loop"), categories)).containsExactly("svc");
    }

    @Test
    void expand_tracksWholeCategoryNames() {
        // "a" would be blocked if the characters of "ab" were remembered instead of the name
        Map<String, Set<String>> categories = Map.of("ab", Set.of("svc1", "a"), "a", Set.of("svc2"));

        assertThat(CategoryExpander.expand(Set.of("ab"), categories)).containsExactlyInAnyOrder("svc1", "svc2");
    }

    @Test
    void expand_collapsesDuplicates() {
        Map<String, Set<String>> categories = Map.of("x", Set.of("svc"), "y", Set.of("svc"));

        assertThat(CategoryExpander.expand(List.of("x", "y", "svc"), categories)).containsExactly("svc");
    }

    @Test
    void expand_treatsNullAndEmptyAsEmpty() {
        assertThat(CategoryExpander.expand(null, Map.of("x", Set.of("svc")))).isEmpty();
        assertThat(CategoryExpander.expand(Set.of(), Map.of())).isEmpty();
        assertThat(CategoryExpander.expand(Set.of("svc"), null)).containsExactly("svc");
    }
}
