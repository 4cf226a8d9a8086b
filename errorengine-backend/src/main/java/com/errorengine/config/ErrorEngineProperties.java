package com.errorengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Settings under the {@code errorengine} prefix.
 */
@Data
@ConfigurationProperties(prefix = "errorengine")
public class ErrorEngineProperties {

    /** Time zone used for weekdays and time windows. */
    private String timezone = ZoneId.systemDefault().getId();

    private Scheduler scheduler = new Scheduler();
    private Source source = new Source();
    private Notify notify = new Notify();
    private Store store = new Store();
    private Retention retention = new Retention();
    private Definitions definitions = new Definitions();

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private int tickSeconds = 60;
        private int initialDelaySeconds = 10;
        private int workerThreads = 4;
        private int shutdownWaitSeconds = 30;
    }

    @Data
    public static class Source {
        private int defaultTimeoutSeconds = 30;
        /** A larger result fails the fetch; 0 disables the limit. */
        private int maxRows = 10_000;
        private int connectTimeoutSeconds = 10;
        private int sampleRows = 5;
    }

    @Data
    public static class Notify {
        private int httpTimeoutSeconds = 30;
        private String telegramApiUrl = "https://api.telegram.org";
        private String subjectPrefix = "[ErrorEngine]";
        /** Maximum errors listed in a single channel message. */
        private int maxErrorsPerMessage = 50;
    }

    @Data
    public static class Store {
        /** jdbc or memory */
        private String type = "jdbc";
        private String url = "jdbc:h2:file:./data/errorengine;AUTO_SERVER=TRUE";
        private String username = "sa";
        private String password = "";
        private int maxPoolSize = 5;
        private boolean initializeSchema = true;
    }

    @Data
    public static class Retention {
        private String cron = "0 0 3 * * *";
        private int logDays = 30;
        private int resolvedErrorDays = 60;
    }

    @Data
    public static class Definitions {
        /** Directory scanned for *.yaml / *.yml definition packs at startup. */
        private String path = "definitions";
    }
}
