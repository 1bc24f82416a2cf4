package com.eyelevel.dispatcher.registry;

import com.eyelevel.dispatcher.common.cache.CachedValue;
import com.eyelevel.dispatcher.common.json.JsonParser;
import com.eyelevel.dispatcher.config.DispatchConfig;
import com.eyelevel.dispatcher.exception.ServiceConfigurationException;
import com.eyelevel.dispatcher.exception.json.JsonParsingException;
import com.eyelevel.dispatcher.model.ServiceDefinition;
import com.eyelevel.dispatcher.repository.ServiceDefinitionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Read-mostly view over the registered services. The view is an immutable {@link RegistrySnapshot} held in a
 * {@link CachedValue}; callers check it for staleness at the start of each scheduling decision.
 */
@Slf4j
@Service
public class ServiceRegistry {

    private final ServiceDefinitionRepository serviceDefinitionRepository;
    private final JsonParser jsonParser;
    private final DispatchConfig dispatchConfig;
    private final Clock clock;
    private final CachedValue<RegistrySnapshot> snapshot;

    public ServiceRegistry(final ServiceDefinitionRepository serviceDefinitionRepository, final JsonParser jsonParser,
                           final DispatchConfig dispatchConfig, final Clock clock) {
        this.serviceDefinitionRepository = serviceDefinitionRepository;
        this.jsonParser = jsonParser;
        this.dispatchConfig = dispatchConfig;
        this.clock = clock;
        this.snapshot = new CachedValue<>("service-registry", this::load,
                                          Duration.ofSeconds(dispatchConfig.getRegistryRefreshSeconds()), clock);
    }

    /**
     * Reloads the snapshot if it is older than the configured refresh interval and returns the current one.
     */
    public RegistrySnapshot refreshIfStale() {
        snapshot.refreshIfStale();
        return snapshot.get();
    }

    public RegistrySnapshot snapshot() {
        return snapshot.get();
    }

    public RegistrySnapshot reload() {
        return snapshot.refresh();
    }

    public Optional<AnalysisService> lookup(final String name) {
        return snapshot().lookup(name);
    }

    public List<String> stages() {
        return dispatchConfig.getStages();
    }

    /**
     * @return The position of the stage in the stage list, or -1 when it is not a configured stage.
     */
    public int stageIndex(final String stage) {
        return dispatchConfig.getStages().indexOf(stage);
    }

    /**
     * Validates and stores a service definition, then reloads the snapshot so the next scheduling decision sees it.
     *
     * @throws ServiceConfigurationException if the definition names an unknown stage, carries an invalid pattern
     *                                       or a non-positive failure limit.
     */
    @Transactional
    public AnalysisService register(final ServiceDefinition definition) {
        final AnalysisService service = toAnalysisService(definition);
        serviceDefinitionRepository.save(definition);
        log.info("Registered service '{}' (category '{}', stage '{}', version '{}').", service.name(),
                 service.category(), service.stage(), service.version());
        reload();
        return service;
    }

    private RegistrySnapshot load() {
        final Map<String, AnalysisService> services = new LinkedHashMap<>();
        for (ServiceDefinition definition : serviceDefinitionRepository.findAll()) {
            if (!definition.isEnabled()) {
                log.debug("Service '{}' is disabled and will not be scheduled.", definition.getName());
                continue;
            }
            try {
                services.put(definition.getName(), toAnalysisService(definition));
            } catch (ServiceConfigurationException e) {
                log.error("Dropping service '{}' from the registry: {}", definition.getName(), e.getMessage());
            }
        }

        final Map<String, Set<String>> categories = new LinkedHashMap<>();
        services.values().forEach(service -> categories.computeIfAbsent(service.category(), k -> new LinkedHashSet<>())
                                                       .add(service.name()));
        dispatchConfig.getCategories().forEach(
                (group, members) -> categories.computeIfAbsent(group, k -> new LinkedHashSet<>()).addAll(members));

        log.info("Loaded service registry with {} services and {} categories.", services.size(), categories.size());
        return new RegistrySnapshot(services, categories, clock.instant());
    }

    private AnalysisService toAnalysisService(final ServiceDefinition definition) {
        final String name = definition.getName();
        if (!StringUtils.hasText(name)) {
            throw new ServiceConfigurationException("Service definition has no name");
        }
        if (!StringUtils.hasText(definition.getCategory())) {
            throw new ServiceConfigurationException("Service '" + name + "' has no category");
        }
        if (stageIndex(definition.getStage()) < 0) {
            throw new ServiceConfigurationException(
                    "Service '%s' names unknown stage '%s'; known stages are %s".formatted(name, definition.getStage(),
                                                                                          dispatchConfig.getStages()));
        }
        if (definition.getFailureLimit() < 1) {
            throw new ServiceConfigurationException(
                    "Service '%s' has a non-positive failure limit %d".formatted(name, definition.getFailureLimit()));
        }
        final Map<String, Object> config;
        try {
            config = jsonParser.parseMap(definition.getConfig());
        } catch (JsonParsingException e) {
            throw new ServiceConfigurationException("Service '" + name + "' has an invalid default config", e);
        }
        return new AnalysisService(name, definition.getCategory(), definition.getStage(),
                                   compile(name, "accepts", definition.getAccepts()),
                                   compile(name, "rejects", definition.getRejects()), definition.getFailureLimit(),
                                   StringUtils.hasText(definition.getVersion()) ? definition.getVersion() : "0",
                                   config);
    }

    private static Pattern compile(final String serviceName, final String field, final String regex) {
        if (!StringUtils.hasLength(regex)) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ServiceConfigurationException(
                    "Service '%s' has an invalid %s pattern '%s'".formatted(serviceName, field, regex), e);
        }
    }
}
