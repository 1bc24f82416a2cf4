package com.eyelevel.dispatcher.scheduling;

import com.eyelevel.dispatcher.registry.AnalysisService;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The services a file must go through, one bucket per configured stage in stage order.
 * Stages without a matching service are kept as empty buckets so that indexes line up with the stage list.
 *
 * @param stages  stage names, in order
 * @param buckets services by name for each stage, same length as {@code stages}
 * @param skipped candidates that were left out, either unknown or not accepting the file type
 */
public record Schedule(List<String> stages, List<Map<String, AnalysisService>> buckets, Set<String> skipped) {

    public Schedule {
        stages = List.copyOf(stages);
        buckets = buckets.stream().map(Collections::unmodifiableMap).toList();
        skipped = Collections.unmodifiableSet(new LinkedHashSet<>(skipped));
    }

    public Map<String, AnalysisService> bucket(final int stageIndex) {
        return buckets.get(stageIndex);
    }

    public int size() {
        return buckets.size();
    }

    public Set<String> serviceNames() {
        final Set<String> names = new LinkedHashSet<>();
        buckets.forEach(bucket -> names.addAll(bucket.keySet()));
        return names;
    }
}
