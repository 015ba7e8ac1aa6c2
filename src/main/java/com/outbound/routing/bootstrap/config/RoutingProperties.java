package com.outbound.routing.bootstrap.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    private final Scoring scoring = new Scoring();
    private final Decision decision = new Decision();
    private final Ingestion ingestion = new Ingestion();
    private final Kafka kafka = new Kafka();
    private final Redis redis = new Redis();
    private final Sweep sweep = new Sweep();
    private final Relay relay = new Relay();
    private final Dashboard dashboard = new Dashboard();

    public Scoring getScoring() {
        return scoring;
    }

    public Decision getDecision() {
        return decision;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Redis getRedis() {
        return redis;
    }

    public Sweep getSweep() {
        return sweep;
    }

    public Relay getRelay() {
        return relay;
    }

    public Dashboard getDashboard() {
        return dashboard;
    }

    public static class Scoring {
        private final Thresholds thresholds = new Thresholds();
        private final Weights weights = new Weights();
        private Duration fullWeightWindow = Duration.ofDays(7);
        private Duration reducedWeightWindow = Duration.ofDays(14);
        private Duration decayWindow = Duration.ofDays(30);
        private double reducedFactor = 0.8;
        private double agingFactor = 0.6;
        private double staleFactor = 0.3;

        public Thresholds getThresholds() {
            return thresholds;
        }

        public Weights getWeights() {
            return weights;
        }

        public Duration getFullWeightWindow() {
            return fullWeightWindow;
        }

        public void setFullWeightWindow(Duration fullWeightWindow) {
            this.fullWeightWindow = fullWeightWindow;
        }

        public Duration getReducedWeightWindow() {
            return reducedWeightWindow;
        }

        public void setReducedWeightWindow(Duration reducedWeightWindow) {
            this.reducedWeightWindow = reducedWeightWindow;
        }

        public Duration getDecayWindow() {
            return decayWindow;
        }

        public void setDecayWindow(Duration decayWindow) {
            this.decayWindow = decayWindow;
        }

        public double getReducedFactor() {
            return reducedFactor;
        }

        public void setReducedFactor(double reducedFactor) {
            this.reducedFactor = reducedFactor;
        }

        public double getAgingFactor() {
            return agingFactor;
        }

        public void setAgingFactor(double agingFactor) {
            this.agingFactor = agingFactor;
        }

        public double getStaleFactor() {
            return staleFactor;
        }

        public void setStaleFactor(double staleFactor) {
            this.staleFactor = staleFactor;
        }
    }

    public static class Thresholds {
        private double lukewarm = 15;
        private double warm = 40;
        private double hot = 70;

        public double getLukewarm() {
            return lukewarm;
        }

        public void setLukewarm(double lukewarm) {
            this.lukewarm = lukewarm;
        }

        public double getWarm() {
            return warm;
        }

        public void setWarm(double warm) {
            this.warm = warm;
        }

        public double getHot() {
            return hot;
        }

        public void setHot(double hot) {
            this.hot = hot;
        }
    }

    public static class Weights {
        private double reply = 75;
        private double meetingBooked = 75;
        private double meetingCompleted = 85;
        private double formSubmitted = 70;
        private double requestedContact = 80;
        private double openBurst = 40;
        private double repeatVisits = 25;
        private double pricingOrDemoViewed = 15;
        private double contentDownloaded = 25;
        private double open = 15;
        private double click = 20;
        private double networkConnected = 20;
        private double visitorIdentified = 15;
        private double websiteVisit = 15;
        private double noShowPenalty = 15;

        public double getReply() {
            return reply;
        }

        public void setReply(double reply) {
            this.reply = reply;
        }

        public double getMeetingBooked() {
            return meetingBooked;
        }

        public void setMeetingBooked(double meetingBooked) {
            this.meetingBooked = meetingBooked;
        }

        public double getMeetingCompleted() {
            return meetingCompleted;
        }

        public void setMeetingCompleted(double meetingCompleted) {
            this.meetingCompleted = meetingCompleted;
        }

        public double getFormSubmitted() {
            return formSubmitted;
        }

        public void setFormSubmitted(double formSubmitted) {
            this.formSubmitted = formSubmitted;
        }

        public double getRequestedContact() {
            return requestedContact;
        }

        public void setRequestedContact(double requestedContact) {
            this.requestedContact = requestedContact;
        }

        public double getOpenBurst() {
            return openBurst;
        }

        public void setOpenBurst(double openBurst) {
            this.openBurst = openBurst;
        }

        public double getRepeatVisits() {
            return repeatVisits;
        }

        public void setRepeatVisits(double repeatVisits) {
            this.repeatVisits = repeatVisits;
        }

        public double getPricingOrDemoViewed() {
            return pricingOrDemoViewed;
        }

        public void setPricingOrDemoViewed(double pricingOrDemoViewed) {
            this.pricingOrDemoViewed = pricingOrDemoViewed;
        }

        public double getContentDownloaded() {
            return contentDownloaded;
        }

        public void setContentDownloaded(double contentDownloaded) {
            this.contentDownloaded = contentDownloaded;
        }

        public double getOpen() {
            return open;
        }

        public void setOpen(double open) {
            this.open = open;
        }

        public double getClick() {
            return click;
        }

        public void setClick(double click) {
            this.click = click;
        }

        public double getNetworkConnected() {
            return networkConnected;
        }

        public void setNetworkConnected(double networkConnected) {
            this.networkConnected = networkConnected;
        }

        public double getVisitorIdentified() {
            return visitorIdentified;
        }

        public void setVisitorIdentified(double visitorIdentified) {
            this.visitorIdentified = visitorIdentified;
        }

        public double getWebsiteVisit() {
            return websiteVisit;
        }

        public void setWebsiteVisit(double websiteVisit) {
            this.websiteVisit = websiteVisit;
        }

        public double getNoShowPenalty() {
            return noShowPenalty;
        }

        public void setNoShowPenalty(double noShowPenalty) {
            this.noShowPenalty = noShowPenalty;
        }
    }

    public static class Decision {
        private double highWaterMark = 65;
        private int openBurstCount = 3;
        private Duration openBurstWindow = Duration.ofDays(7);

        public double getHighWaterMark() {
            return highWaterMark;
        }

        public void setHighWaterMark(double highWaterMark) {
            this.highWaterMark = highWaterMark;
        }

        public int getOpenBurstCount() {
            return openBurstCount;
        }

        public void setOpenBurstCount(int openBurstCount) {
            this.openBurstCount = openBurstCount;
        }

        public Duration getOpenBurstWindow() {
            return openBurstWindow;
        }

        public void setOpenBurstWindow(Duration openBurstWindow) {
            this.openBurstWindow = openBurstWindow;
        }
    }

    public static class Ingestion {
        private Duration clockSkewTolerance = Duration.ofMinutes(5);
        private int maxConflictRetries = 5;
        private int workers = 8;
        private int queueCapacity = 500;
        private Duration submitTimeout = Duration.ofSeconds(10);

        public Duration getClockSkewTolerance() {
            return clockSkewTolerance;
        }

        public void setClockSkewTolerance(Duration clockSkewTolerance) {
            this.clockSkewTolerance = clockSkewTolerance;
        }

        public int getMaxConflictRetries() {
            return maxConflictRetries;
        }

        public void setMaxConflictRetries(int maxConflictRetries) {
            this.maxConflictRetries = maxConflictRetries;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getSubmitTimeout() {
            return submitTimeout;
        }

        public void setSubmitTimeout(Duration submitTimeout) {
            this.submitTimeout = submitTimeout;
        }
    }

    public static class Kafka {
        private final Topics topics = new Topics();
        private long publishAckTimeoutMs = 3000;

        public Topics getTopics() {
            return topics;
        }

        public long getPublishAckTimeoutMs() {
            return publishAckTimeoutMs;
        }

        public void setPublishAckTimeoutMs(long publishAckTimeoutMs) {
            this.publishAckTimeoutMs = publishAckTimeoutMs;
        }
    }

    public static class Topics {
        private String engagementEvents = "engagement-events";
        private String routingCommands = "routing-commands";
        private String dlq = "engagement-events-dlq";

        public String getEngagementEvents() {
            return engagementEvents;
        }

        public void setEngagementEvents(String engagementEvents) {
            this.engagementEvents = engagementEvents;
        }

        public String getRoutingCommands() {
            return routingCommands;
        }

        public void setRoutingCommands(String routingCommands) {
            this.routingCommands = routingCommands;
        }

        public String getDlq() {
            return dlq;
        }

        public void setDlq(String dlq) {
            this.dlq = dlq;
        }
    }

    public static class Redis {
        private String commandIdempotencyPrefix = "routing:command:";
        private long idempotencyTtlHours = 24;
        private long processingTtlMinutes = 5;
        private String sweepCursorKey = "routing:sweep:cursor";
        private long sweepCursorTtlHours = 24;

        public String getCommandIdempotencyPrefix() {
            return commandIdempotencyPrefix;
        }

        public void setCommandIdempotencyPrefix(String commandIdempotencyPrefix) {
            this.commandIdempotencyPrefix = commandIdempotencyPrefix;
        }

        public long getIdempotencyTtlHours() {
            return idempotencyTtlHours;
        }

        public void setIdempotencyTtlHours(long idempotencyTtlHours) {
            this.idempotencyTtlHours = idempotencyTtlHours;
        }

        public long getProcessingTtlMinutes() {
            return processingTtlMinutes;
        }

        public void setProcessingTtlMinutes(long processingTtlMinutes) {
            this.processingTtlMinutes = processingTtlMinutes;
        }

        public String getSweepCursorKey() {
            return sweepCursorKey;
        }

        public void setSweepCursorKey(String sweepCursorKey) {
            this.sweepCursorKey = sweepCursorKey;
        }

        public long getSweepCursorTtlHours() {
            return sweepCursorTtlHours;
        }

        public void setSweepCursorTtlHours(long sweepCursorTtlHours) {
            this.sweepCursorTtlHours = sweepCursorTtlHours;
        }
    }

    public static class Sweep {
        private boolean enabled = true;
        private int pageSize = 200;
        private long fixedDelayMs = 900_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public long getFixedDelayMs() {
            return fixedDelayMs;
        }

        public void setFixedDelayMs(long fixedDelayMs) {
            this.fixedDelayMs = fixedDelayMs;
        }
    }

    public static class Relay {
        private boolean enabled = true;
        private long fixedDelayMs = 30_000;
        private Duration minAge = Duration.ofSeconds(30);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getFixedDelayMs() {
            return fixedDelayMs;
        }

        public void setFixedDelayMs(long fixedDelayMs) {
            this.fixedDelayMs = fixedDelayMs;
        }

        public Duration getMinAge() {
            return minAge;
        }

        public void setMinAge(Duration minAge) {
            this.minAge = minAge;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Dashboard {
        private int defaultLimit = 20;
        private int maxLimit = 500;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }
}
