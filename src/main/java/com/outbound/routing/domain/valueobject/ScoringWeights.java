package com.outbound.routing.domain.valueobject;

/**
 * Points contributed by each signal before recency weighting.
 * <p>
 * Grouped by family: positive intent (strongest signal wins), repeated light
 * engagement and single light engagement (both additive) and the no-show
 * penalty.
 * </p>
 */
public final class ScoringWeights {

    // Positive intent
    private final double reply;
    private final double meetingBooked;
    private final double meetingCompleted;
    private final double formSubmitted;
    private final double requestedContact;

    // Repeated light engagement
    private final double openBurst;
    private final double repeatVisits;
    private final double pricingOrDemoViewed;
    private final double contentDownloaded;

    // Single light engagement
    private final double open;
    private final double click;
    private final double networkConnected;
    private final double visitorIdentified;
    private final double websiteVisit;

    private final double noShowPenalty;

    private ScoringWeights(Builder b) {
        this.reply = b.reply;
        this.meetingBooked = b.meetingBooked;
        this.meetingCompleted = b.meetingCompleted;
        this.formSubmitted = b.formSubmitted;
        this.requestedContact = b.requestedContact;
        this.openBurst = b.openBurst;
        this.repeatVisits = b.repeatVisits;
        this.pricingOrDemoViewed = b.pricingOrDemoViewed;
        this.contentDownloaded = b.contentDownloaded;
        this.open = b.open;
        this.click = b.click;
        this.networkConnected = b.networkConnected;
        this.visitorIdentified = b.visitorIdentified;
        this.websiteVisit = b.websiteVisit;
        this.noShowPenalty = b.noShowPenalty;
    }

    public static ScoringWeights defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getReply() {
        return reply;
    }

    public double getMeetingBooked() {
        return meetingBooked;
    }

    public double getMeetingCompleted() {
        return meetingCompleted;
    }

    public double getFormSubmitted() {
        return formSubmitted;
    }

    public double getRequestedContact() {
        return requestedContact;
    }

    public double getOpenBurst() {
        return openBurst;
    }

    public double getRepeatVisits() {
        return repeatVisits;
    }

    public double getPricingOrDemoViewed() {
        return pricingOrDemoViewed;
    }

    public double getContentDownloaded() {
        return contentDownloaded;
    }

    public double getOpen() {
        return open;
    }

    public double getClick() {
        return click;
    }

    public double getNetworkConnected() {
        return networkConnected;
    }

    public double getVisitorIdentified() {
        return visitorIdentified;
    }

    public double getWebsiteVisit() {
        return websiteVisit;
    }

    public double getNoShowPenalty() {
        return noShowPenalty;
    }

    public static final class Builder {
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

        private Builder() {
        }

        public Builder reply(double v) { this.reply = v; return this; }
        public Builder meetingBooked(double v) { this.meetingBooked = v; return this; }
        public Builder meetingCompleted(double v) { this.meetingCompleted = v; return this; }
        public Builder formSubmitted(double v) { this.formSubmitted = v; return this; }
        public Builder requestedContact(double v) { this.requestedContact = v; return this; }
        public Builder openBurst(double v) { this.openBurst = v; return this; }
        public Builder repeatVisits(double v) { this.repeatVisits = v; return this; }
        public Builder pricingOrDemoViewed(double v) { this.pricingOrDemoViewed = v; return this; }
        public Builder contentDownloaded(double v) { this.contentDownloaded = v; return this; }
        public Builder open(double v) { this.open = v; return this; }
        public Builder click(double v) { this.click = v; return this; }
        public Builder networkConnected(double v) { this.networkConnected = v; return this; }
        public Builder visitorIdentified(double v) { this.visitorIdentified = v; return this; }
        public Builder websiteVisit(double v) { this.websiteVisit = v; return this; }
        public Builder noShowPenalty(double v) { this.noShowPenalty = v; return this; }

        public ScoringWeights build() {
            return new ScoringWeights(this);
        }
    }
}
