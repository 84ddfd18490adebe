package com.phillippitts.batchanalyzer.service.grouping;

import com.phillippitts.batchanalyzer.domain.BatchItem;
import com.phillippitts.batchanalyzer.domain.Fingerprint;
import com.phillippitts.batchanalyzer.domain.HashAlgorithm;
import com.phillippitts.batchanalyzer.domain.SimilarityGroup;
import com.phillippitts.batchanalyzer.service.hash.PerceptualHasher;
import com.phillippitts.batchanalyzer.service.hash.SimilarityMetric;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Partitions a batch into groups of near-duplicate items.
 *
 * <p>Fingerprints are computed in parallel on the supplied executor. Grouping itself is a greedy
 * single pass in input order: each ungrouped item becomes a representative and absorbs every
 * later ungrouped item whose composite similarity to it reaches the threshold. The same input
 * always yields the same groups.
 *
 * <p>Items that cannot be read or decoded become singleton groups so they are still analyzed.
 */
public class SimilarityGrouper {

    private static final Logger LOG = LogManager.getLogger(SimilarityGrouper.class);

    private final PerceptualHasher hasher;
    private final SimilarityMetric metric;
    private final double threshold;
    private final Executor executor;

    public SimilarityGrouper(PerceptualHasher hasher, SimilarityMetric metric, double threshold, Executor executor) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.metric = Objects.requireNonNull(metric, "metric");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (threshold <= 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be in (0,1], got: " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * Fingerprints and groups the items.
     *
     * @param items batch items with unique ids
     * @return groups covering every item exactly once
     */
    public List<SimilarityGroup> group(List<BatchItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        long start = System.nanoTime();
        List<ItemFingerprints> fingerprints = fingerprint(items);
        List<SimilarityGroup> groups = groupFingerprints(fingerprints);
        if (LOG.isInfoEnabled()) {
            LOG.info("Grouped {} items into {} groups in {} ms (threshold {})",
                    items.size(), groups.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), threshold);
        }
        return groups;
    }

    /**
     * Computes fingerprints for every item in parallel, preserving input order.
     */
    public List<ItemFingerprints> fingerprint(List<BatchItem> items) {
        Set<HashAlgorithm> algorithms = metric.algorithms();
        List<CompletableFuture<ItemFingerprints>> futures = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> fingerprintOne(item, algorithms), executor));
        }
        List<ItemFingerprints> out = new ArrayList<>(items.size());
        for (int i = 0; i < futures.size(); i++) {
            ItemFingerprints fp;
            try {
                fp = futures.get(i).join();
            } catch (RuntimeException e) {
                LOG.warn("Fingerprinting failed for item {}: {}", items.get(i).id(), e.getMessage());
                fp = ItemFingerprints.unhashable(items.get(i).id());
            }
            out.add(fp);
        }
        return out;
    }

    /**
     * Greedy grouping over precomputed fingerprints.
     */
    public List<SimilarityGroup> groupFingerprints(List<ItemFingerprints> fingerprints) {
        Set<HashAlgorithm> required = metric.algorithms();
        Set<String> assigned = new HashSet<>();
        List<SimilarityGroup> groups = new ArrayList<>();

        for (int i = 0; i < fingerprints.size(); i++) {
            ItemFingerprints rep = fingerprints.get(i);
            if (!assigned.add(rep.itemId())) {
                continue;
            }
            if (!rep.covers(required)) {
                groups.add(SimilarityGroup.singleton(rep.itemId()));
                continue;
            }
            List<String> members = new ArrayList<>();
            Map<String, Double> confidences = new LinkedHashMap<>();
            members.add(rep.itemId());
            confidences.put(rep.itemId(), 1.0);

            for (int j = i + 1; j < fingerprints.size(); j++) {
                ItemFingerprints candidate = fingerprints.get(j);
                if (assigned.contains(candidate.itemId()) || !candidate.covers(required)) {
                    continue;
                }
                double similarity = metric.composite(rep.fingerprints(), candidate.fingerprints());
                if (similarity >= threshold) {
                    assigned.add(candidate.itemId());
                    members.add(candidate.itemId());
                    confidences.put(candidate.itemId(), similarity);
                }
            }
            if (members.size() > 1) {
                LOG.debug("Item {} represents {} similar items", rep.itemId(), members.size() - 1);
            }
            groups.add(new SimilarityGroup(rep.itemId(), members, confidences, null));
        }
        return List.copyOf(groups);
    }

    private ItemFingerprints fingerprintOne(BatchItem item, Set<HashAlgorithm> algorithms) {
        byte[] bytes;
        try {
            bytes = item.source().read();
        } catch (IOException e) {
            LOG.warn("Cannot read item {} for fingerprinting: {}", item.id(), e.getMessage());
            return ItemFingerprints.unhashable(item.id());
        }
        Map<HashAlgorithm, Fingerprint> fps = hasher.fingerprintAll(bytes, algorithms);
        if (fps.isEmpty()) {
            LOG.info("Item {} could not be fingerprinted; it will be analyzed on its own", item.id());
        }
        return new ItemFingerprints(item.id(), fps);
    }
}
