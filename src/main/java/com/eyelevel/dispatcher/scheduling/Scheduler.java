package com.eyelevel.dispatcher.scheduling;

import com.eyelevel.dispatcher.config.DispatchConfig;
import com.eyelevel.dispatcher.model.Submission;
import com.eyelevel.dispatcher.registry.AnalysisService;
import com.eyelevel.dispatcher.registry.RegistrySnapshot;
import com.eyelevel.dispatcher.registry.ServiceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes which services process a file of a given type within a submission, and in which stage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Scheduler {

    private final ServiceRegistry serviceRegistry;
    private final DispatchConfig dispatchConfig;

    public Schedule buildSchedule(final Submission submission, final String fileType) {
        final RegistrySnapshot snapshot = serviceRegistry.refreshIfStale();
        final Map<String, Set<String>> categories = snapshot.categories();

        final Set<String> selected = submission.getSelectedCategories() == null ||
                                     submission.getSelectedCategories().isEmpty()
                                     ? new LinkedHashSet<>(snapshot.services().keySet())
                                     : CategoryExpander.expand(submission.getSelectedCategories(), categories);
        final Set<String> excluded = CategoryExpander.expand(submission.getExcludedCategories(), categories);

        final Set<String> candidates = new LinkedHashSet<>(selected);
        candidates.removeAll(excluded);
        candidates.addAll(snapshot.servicesInCategory(dispatchConfig.getSystemCategory()));

        final List<String> stages = serviceRegistry.stages();
        final List<Map<String, AnalysisService>> buckets = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            buckets.add(new TreeMap<>());
        }
        final Set<String> skipped = new LinkedHashSet<>();

        for (String name : candidates) {
            final Optional<AnalysisService> found = snapshot.lookup(name);
            if (found.isEmpty()) {
                log.warn("[{}] Selected service '{}' is not registered. Skipping it.", submission.getSid(), name);
                skipped.add(name);
                continue;
            }
            final AnalysisService service = found.get();
            if (!service.accepts(fileType)) {
                skipped.add(name);
                continue;
            }
            buckets.get(stages.indexOf(service.stage())).put(name, service);
        }

        log.debug("[{}] Schedule for file type '{}': {} services, {} skipped.", submission.getSid(), fileType,
                  candidates.size() - skipped.size(), skipped.size());
        return new Schedule(stages, buckets, skipped);
    }
}
