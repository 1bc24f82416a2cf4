package com.eyelevel.dispatcher.registry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One immutable load of the service registry. Scheduling decisions read a single snapshot from start to end.
 *
 * @param services   services by name
 * @param categories category name to member names (services or other categories)
 * @param loadedAt   when the snapshot was built
 */
public record RegistrySnapshot(Map<String, AnalysisService> services, Map<String, Set<String>> categories,
                               Instant loadedAt) {

    public RegistrySnapshot {
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        categories.forEach((name, members) -> copy.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(members))));
        categories = Collections.unmodifiableMap(copy);
    }

    public Optional<AnalysisService> lookup(final String name) {
        return Optional.ofNullable(services.get(name));
    }

    public Set<String> servicesInCategory(final String category) {
        Set<String> names = new LinkedHashSet<>();
        services.values().stream().filter(service -> service.isInCategory(category))
                .forEach(service -> names.add(service.name()));
        return names;
    }
}
