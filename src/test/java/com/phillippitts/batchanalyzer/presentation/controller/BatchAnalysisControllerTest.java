package com.phillippitts.batchanalyzer.presentation.controller;

import com.phillippitts.batchanalyzer.domain.AnalysisOptions;
import com.phillippitts.batchanalyzer.domain.BatchItem;
import com.phillippitts.batchanalyzer.service.batch.BatchCoordinator;
import com.phillippitts.batchanalyzer.service.batch.BatchReport;
import com.phillippitts.batchanalyzer.service.batch.BatchRequest;
import com.phillippitts.batchanalyzer.service.batch.CostEstimate;
import com.phillippitts.batchanalyzer.service.progress.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchAnalysisControllerTest {

    private BatchCoordinator coordinator;
    private BatchAnalysisController controller;

    @BeforeEach
    void setUp() {
        coordinator = mock(BatchCoordinator.class);
        controller = new BatchAnalysisController(coordinator);
    }

    @Test
    void analyzeAppliesOverridesOnTopOfConfiguredDefaults() {
        when(coordinator.requestBuilder(anyList()))
                .thenAnswer(inv -> BatchRequest.builder(inv.getArgument(0)));
        BatchReport report = new BatchReport("tok", RunState.COMPLETED, List.of(), 0, 0, 0,
                0.0, 0.0, 0.0, Duration.ZERO, false);
        when(coordinator.run(any())).thenReturn(report);
        AnalyzeBatchRequest body = new AnalyzeBatchRequest(List.of("/images/a.png", "/images/b.png"),
                2, 250L, null, 1.5, false, "nightly", "premium", false, null, true, "Focus on lighting.");

        ResponseEntity<BatchReport> response = controller.analyze(body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(report);
        ArgumentCaptor<BatchRequest> captor = ArgumentCaptor.forClass(BatchRequest.class);
        verify(coordinator).run(captor.capture());
        BatchRequest request = captor.getValue();
        assertThat(request.items()).extracting(BatchItem::id)
                .containsExactly(Path.of("/images/a.png").toString(),
                        Path.of("/images/b.png").toString());
        assertThat(request.concurrency()).isEqualTo(2);
        assertThat(request.minCallSpacing()).isEqualTo(Duration.ofMillis(250));
        assertThat(request.maxAttempts()).isEqualTo(3);
        assertThat(request.maxCost()).isEqualTo(1.5);
        assertThat(request.resume()).isFalse();
        assertThat(request.runToken()).isEqualTo("nightly");
        assertThat(request.pinnedTier()).isEqualTo("premium");
        assertThat(request.options()).isEqualTo(new AnalysisOptions(false, true, true, "Focus on lighting."));
    }

    @Test
    void estimateDelegatesToCoordinator() {
        CostEstimate estimate = new CostEstimate(3, 2, "local", 0.0, 0.0, 0.0);
        when(coordinator.estimate(anyList(), eq("local"))).thenReturn(estimate);

        ResponseEntity<CostEstimate> response =
                controller.estimate(new EstimateBatchRequest(List.of("a.png", "b.png", "c.png"), "local"));

        assertThat(response.getBody()).isSameAs(estimate);
    }

    @Test
    void requestOptionsDefaultWhenOmitted() {
        AnalyzeBatchRequest body = new AnalyzeBatchRequest(List.of("a.png"),
                null, null, null, null, null, null, null, null, null, null, null);

        assertThat(body.toOptions()).isEqualTo(AnalysisOptions.defaults());
    }
}
