package com.phillippitts.batchanalyzer.presentation.controller;

import com.phillippitts.batchanalyzer.domain.BatchItem;
import com.phillippitts.batchanalyzer.service.batch.BatchCoordinator;
import com.phillippitts.batchanalyzer.service.batch.BatchReport;
import com.phillippitts.batchanalyzer.service.batch.BatchRequest;
import com.phillippitts.batchanalyzer.service.batch.CostEstimate;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * REST entry point for batch runs over image files readable by the server.
 *
 * <p>Runs are synchronous: the response is the complete report.
 */
@RestController
@RequestMapping("/api/batch")
class BatchAnalysisController {

    private static final Logger LOG = LogManager.getLogger(BatchAnalysisController.class);

    private final BatchCoordinator coordinator;

    BatchAnalysisController(BatchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/analyze")
    ResponseEntity<BatchReport> analyze(@Valid @RequestBody AnalyzeBatchRequest body) {
        LOG.info("Batch analysis requested for {} path(s)", body.paths().size());
        BatchRequest.Builder builder = coordinator.requestBuilder(toItems(body.paths()))
                .options(body.toOptions())
                .runToken(body.runToken())
                .pinnedTier(body.tier());
        if (body.concurrency() != null) {
            builder.concurrency(body.concurrency());
        }
        if (body.minCallSpacingMs() != null) {
            builder.minCallSpacing(Duration.ofMillis(body.minCallSpacingMs()));
        }
        if (body.maxAttempts() != null) {
            builder.maxAttempts(body.maxAttempts());
        }
        if (body.maxCost() != null) {
            builder.maxCost(body.maxCost());
        }
        if (body.resume() != null) {
            builder.resume(body.resume());
        }
        return ResponseEntity.ok(coordinator.run(builder.build()));
    }

    @PostMapping("/estimate")
    ResponseEntity<CostEstimate> estimate(@Valid @RequestBody EstimateBatchRequest body) {
        return ResponseEntity.ok(coordinator.estimate(toItems(body.paths()), body.tier()));
    }

    private static List<BatchItem> toItems(List<String> paths) {
        return paths.stream().map(Path::of).map(BatchItem::ofPath).toList();
    }
}
