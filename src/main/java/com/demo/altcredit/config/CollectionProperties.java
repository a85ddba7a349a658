package com.demo.altcredit.config;

import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.consent.ConsentPurpose;
import com.demo.altcredit.service.refresh.RefreshOverwritePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "altcredit")
public class CollectionProperties {

    private Collector collector = new Collector();
    private Refresh refresh = new Refresh();
    private Risk risk = new Risk();
    private Backend backend = new Backend();
    private Store store = new Store();
    private Session session = new Session();

    @Data
    public static class Collector {
        private Duration defaultTimeout = Duration.ofSeconds(10);
        private Duration locationTimeout = Duration.ofSeconds(15);
        /** Justification shown when location permission is requested. */
        private ConsentPurpose locationPurpose = ConsentPurpose.FRAUD_PREVENTION;
        private int threads = 8;
    }

    @Data
    public static class Refresh {
        private Duration interval = Duration.ofHours(1);
        private RefreshOverwritePolicy overwritePolicy = RefreshOverwritePolicy.OVERWRITE;
    }

    @Data
    public static class Risk {
        private Map<SourceId, Double> weights = defaultWeights();

        private static Map<SourceId, Double> defaultWeights() {
            Map<SourceId, Double> w = new EnumMap<>(SourceId.class);
            w.put(SourceId.DIGITAL_FOOTPRINT, 0.25);
            w.put(SourceId.DEVICE_PROFILE, 0.30);
            w.put(SourceId.LOCATION, 0.20);
            w.put(SourceId.UTILITY, 0.25);
            return w;
        }
    }

    @Data
    public static class Backend {
        private String baseUrl = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(8);
    }

    @Data
    public static class Store {
        /** {@code jdbc} or {@code memory}. */
        private String type = "jdbc";
        private String keyPrefix = "altcredit";
    }

    @Data
    public static class Session {
        /** Sessions untouched for this long are disposed; zero disables eviction. */
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }
}
