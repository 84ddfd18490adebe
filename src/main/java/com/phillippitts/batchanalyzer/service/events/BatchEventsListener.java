package com.phillippitts.batchanalyzer.service.events;

import com.phillippitts.batchanalyzer.service.progress.RunState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log of batch events. Escalation logs are throttled per tier pair and reason
 * so a large batch of thin results does not flood the log.
 */
@Component
class BatchEventsListener {
    private static final Logger LOG = LogManager.getLogger(BatchEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onTierEscalated(TierEscalatedEvent e) {
        String key = "escalation-" + e.fromTier() + '-' + e.toTier() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.info("Escalating from tier {} to {}: {} (further identical escalations throttled)",
                    e.fromTier(), e.toTier(), e.reason());
        }
    }

    @EventListener
    void onItemDeadLettered(ItemDeadLetteredEvent e) {
        LOG.warn("Giving up on item {} after {} attempt(s), {} item(s) affected: {}",
                e.itemId(), e.attempts(), e.groupSize(), e.reason());
    }

    @EventListener
    void onBatchCompleted(BatchCompletedEvent e) {
        if (e.state() == RunState.ABORTED) {
            LOG.warn("Run {} stopped early: succeeded={}, derived={}, failed={}, skipped={}, cost={}; "
                    + "resume with the same run token", e.runToken(), e.succeeded(), e.derived(),
                    e.failed(), e.skipped(), String.format(Locale.ROOT, "%.4f", e.cost()));
        } else if (e.failed() > 0) {
            LOG.warn("Run {} completed with {} failed item(s); checkpoint retained for retry",
                    e.runToken(), e.failed());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
