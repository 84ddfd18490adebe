package com.phillippitts.batchanalyzer.config;

import com.phillippitts.batchanalyzer.config.properties.CheckpointProperties;
import com.phillippitts.batchanalyzer.config.properties.CoordinatorProperties;
import com.phillippitts.batchanalyzer.config.properties.GroupingProperties;
import com.phillippitts.batchanalyzer.config.properties.TierProperties;
import com.phillippitts.batchanalyzer.service.capability.UnconfiguredVisionCapability;
import com.phillippitts.batchanalyzer.service.capability.VisionCapability;
import com.phillippitts.batchanalyzer.service.grouping.SimilarityGrouper;
import com.phillippitts.batchanalyzer.service.hash.PerceptualHasher;
import com.phillippitts.batchanalyzer.service.hash.SimilarityMetric;
import com.phillippitts.batchanalyzer.service.metrics.AnalysisMetrics;
import com.phillippitts.batchanalyzer.service.progress.CheckpointStore;
import com.phillippitts.batchanalyzer.service.progress.FileCheckpointStore;
import com.phillippitts.batchanalyzer.service.tier.SufficiencyPolicy;
import com.phillippitts.batchanalyzer.service.tier.TierSelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Wires the analysis pipeline from typed properties.
 *
 * <p>A {@link VisionCapability} bean supplied by the application takes precedence over the
 * {@link UnconfiguredVisionCapability} placeholder.
 */
@Configuration
public class AnalysisEngineConfig {

    private static final Logger LOG = LogManager.getLogger(AnalysisEngineConfig.class);

    @Bean
    public PerceptualHasher perceptualHasher(GroupingProperties grouping) {
        return new PerceptualHasher(grouping.getHashSize(), grouping.getHighFrequencyFactor());
    }

    @Bean
    public SimilarityMetric similarityMetric(GroupingProperties grouping) {
        return new SimilarityMetric(grouping.getWeights());
    }

    @Bean
    public SimilarityGrouper similarityGrouper(PerceptualHasher hasher,
                                               SimilarityMetric metric,
                                               GroupingProperties grouping,
                                               @Qualifier("analysisExecutor") Executor analysisExecutor) {
        return new SimilarityGrouper(hasher, metric, grouping.getSimilarityThreshold(), analysisExecutor);
    }

    @Bean
    public SufficiencyPolicy sufficiencyPolicy(TierProperties tiers) {
        return new SufficiencyPolicy(tiers.getMinTags(), tiers.getMinDescriptionLength(), tiers.getMinCategories());
    }

    @Bean
    @ConditionalOnMissingBean(VisionCapability.class)
    public VisionCapability unconfiguredVisionCapability() {
        return new UnconfiguredVisionCapability();
    }

    @Bean
    public TierSelector tierSelector(VisionCapability capability,
                                     TierProperties tiers,
                                     SufficiencyPolicy policy,
                                     CoordinatorProperties coordinator,
                                     @Qualifier("capabilityExecutor") Executor capabilityExecutor,
                                     AnalysisMetrics metrics,
                                     ApplicationEventPublisher publisher) {
        if (tiers.getLevels().isEmpty()) {
            LOG.warn("No analysis tiers configured (batch.tiers.levels); batch runs will be rejected");
        } else {
            LOG.info("Analysis tiers: {} using capability {}", tiers.toTiers(), capability.getName());
        }
        return new TierSelector(capability, tiers.toTiers(), policy, capabilityExecutor,
                coordinator.getCallTimeoutMs(), metrics, publisher);
    }

    @Bean
    public CheckpointStore checkpointStore(CheckpointProperties checkpoint) {
        return new FileCheckpointStore(Path.of(checkpoint.getDirectory()));
    }
}
