package com.eyelevel.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds application properties under the "app.dispatch" prefix to a strongly-typed
 * configuration object. Loaded once at start-up and handed to the scheduler and dispatcher
 * through constructor injection.
 */
@Data
@ConfigurationProperties(prefix = "app.dispatch")
public class DispatchConfig {

    /**
     * The only legal execution order. Every service must name one of these stages.
     */
    private List<String> stages = new ArrayList<>(List.of("pre", "core", "post"));

    /**
     * Services in this category are scheduled for every file and cannot be excluded.
     */
    private String systemCategory = "system";

    /**
     * Extra category groups. A member may be a service name or another category name.
     */
    private Map<String, Set<String>> categories = new HashMap<>();

    private long registryRefreshSeconds = 5;
    private int maxExtractionDepth = 6;
    private int maxFilesPerSubmission = 500;
    private int submissionTtlDays = 15;

    private Retry retry = new Retry();
    private Queues queues = new Queues();
    private Listener listener = new Listener();
    private Expiry expiry = new Expiry();
    private Archive archive = new Archive();
    private Storage storage = new Storage();

    @Data
    public static class Retry {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 60000;
    }

    @Data
    public static class Queues {
        private String submission = "dispatch-submissions.fifo";
        private String signal = "dispatch-signals.fifo";
        private String archive = "dispatch-archive";
        private String servicePrefix = "service-";
    }

    @Data
    public static class Listener {
        private int concurrencyLimit = 10;
        private int maxMessagesPerPoll = 10;
        private int pollTimeoutSeconds = 10;
    }

    @Data
    public static class Expiry {
        private long sleepTimeMs = 300000;
        private long delayHours = 0;
        private boolean batchDelete = false;
        private boolean deleteStorage = true;
        private int workers = 20;
        private int batchSize = 500;
    }

    @Data
    public static class Archive {
        private int workers = 4;
    }

    @Data
    public static class Storage {
        private String fileBucket;
        private String cacheBucket;
        private String archiveBucket;
        private TransferRetry retry = new TransferRetry();
    }

    @Data
    public static class TransferRetry {
        private int attempts = 2;
        private long delayMs = 500;
    }
}
