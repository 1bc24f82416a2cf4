package com.eyelevel.dispatcher.scheduling;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves category and service selectors into service names. Categories may contain other categories;
 * each category is expanded at most once, so cyclic definitions terminate.
 */
public final class CategoryExpander {

    private CategoryExpander() {
    }

    /**
     * @param selectors  category or service names, {@code null} is treated as empty
     * @param categories category name to member names
     * @return The service names reachable from the selectors, without duplicates.
     */
    public static Set<String> expand(final Collection<String> selectors, final Map<String, Set<String>> categories) {
        final Set<String> services = new LinkedHashSet<>();
        if (selectors == null || selectors.isEmpty()) {
            return services;
        }
        final Map<String, Set<String>> known = categories == null ? Map.of() : categories;
        final Deque<String> pending = new ArrayDeque<>(selectors);
        final Set<String> expanded = new HashSet<>();

        while (!pending.isEmpty()) {
            final String name = pending.pop();
            if (known.containsKey(name)) {
                if (expanded.add(name)) {
                    known.get(name).forEach(pending::push);
                }
            } else {
                services.add(name);
            }
        }
        return services;
    }
}
