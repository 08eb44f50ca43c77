package com.ridedispatch.api.dispatch.service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    /** How long every offer of one batch stays open. */
    private Duration offerWindow = Duration.ofSeconds(30);

    private int batchSize = 5;

    private int maxBatches = 10;

    /** Overall search budget of one ride, measured from creation. */
    private Duration searchTimeout = Duration.ofMinutes(10);

    private Radius radius = new Radius();

    private Ranking ranking = new Ranking();

    /** Drivers not heard from within this window are not offered rides. */
    private Duration heartbeatStaleness = Duration.ofMinutes(5);

    private double averageSpeedKmh = 30.0;

    private int schedulerPoolSize = 4;

    private boolean recoveryEnabled = true;

    private boolean seedSampleDrivers = false;

    private Outbox outbox = new Outbox();

    private Sweep sweep = new Sweep();

    private Pricing pricing = new Pricing();

    @Data
    public static class Radius {
        private double initialKm = 5.0;
        private double stepKm = 5.0;
        private double maxKm = 15.0;
    }

    @Data
    public static class Ranking {
        private double distanceWeight = 0.5;
        private double ratingWeight = 0.3;
        private double idleWeight = 0.2;
        private Duration idleCap = Duration.ofMinutes(30);
    }

    @Data
    public static class Outbox {
        private boolean enabled = true;
        private long intervalMs = 5000;
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private long intervalMs = 60000;
    }

    @Data
    public static class Pricing {
        private double baseFare = 5.0;
        private double perKm = 2.0;
    }
}
