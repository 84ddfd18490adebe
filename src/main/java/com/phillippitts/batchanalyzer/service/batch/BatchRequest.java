package com.phillippitts.batchanalyzer.service.batch;

import com.phillippitts.batchanalyzer.domain.AnalysisOptions;
import com.phillippitts.batchanalyzer.domain.BatchItem;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one batch run. Built with {@link #builder(List)} or, to start from the
 * configured defaults, {@link BatchCoordinator#requestBuilder(List)}.
 *
 * @param items          items to analyze, ids unique
 * @param concurrency    maximum analyses in flight (C)
 * @param minCallSpacing minimum interval between two capability calls (R)
 * @param maxAttempts    attempts per representative including the first (M)
 * @param maxCost        cost ceiling (B), or null for unlimited
 * @param resume         load the checkpoint for the run token before starting
 * @param runToken       checkpoint key; derived from the item ids when null
 * @param pinnedTier     analyze at this tier only, or null to escalate from the cheapest
 * @param options        what to ask the capability for
 * @param stopSignal     cooperative stop request
 */
public record BatchRequest(
        List<BatchItem> items,
        int concurrency,
        Duration minCallSpacing,
        int maxAttempts,
        Double maxCost,
        boolean resume,
        String runToken,
        String pinnedTier,
        AnalysisOptions options,
        StopSignal stopSignal
) {

    public BatchRequest {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        Objects.requireNonNull(minCallSpacing, "minCallSpacing");
        options = options == null ? AnalysisOptions.defaults() : options;
        stopSignal = stopSignal == null ? new StopSignal() : stopSignal;
    }

    public static Builder builder(List<BatchItem> items) {
        return new Builder(items);
    }

    /**
     * Builder with the library defaults: C=5, R=100ms, M=3, no cost ceiling.
     */
    public static final class Builder {
        private final List<BatchItem> items;
        private int concurrency = 5;
        private Duration minCallSpacing = Duration.ofMillis(100);
        private int maxAttempts = 3;
        private Double maxCost;
        private boolean resume = true;
        private String runToken;
        private String pinnedTier;
        private AnalysisOptions options = AnalysisOptions.defaults();
        private StopSignal stopSignal;

        private Builder(List<BatchItem> items) {
            this.items = items;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder minCallSpacing(Duration minCallSpacing) {
            this.minCallSpacing = minCallSpacing;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder maxCost(Double maxCost) {
            this.maxCost = maxCost;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        public Builder runToken(String runToken) {
            this.runToken = runToken;
            return this;
        }

        public Builder pinnedTier(String pinnedTier) {
            this.pinnedTier = pinnedTier;
            return this;
        }

        public Builder options(AnalysisOptions options) {
            this.options = options;
            return this;
        }

        public Builder stopSignal(StopSignal stopSignal) {
            this.stopSignal = stopSignal;
            return this;
        }

        public BatchRequest build() {
            return new BatchRequest(items, concurrency, minCallSpacing, maxAttempts, maxCost,
                    resume, runToken, pinnedTier, options, stopSignal);
        }
    }
}
