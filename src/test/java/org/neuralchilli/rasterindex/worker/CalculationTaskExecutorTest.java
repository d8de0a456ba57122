package org.neuralchilli.rasterindex.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.domain.CalculationStatus;
import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.TaskResult;
import org.neuralchilli.rasterindex.monitoring.CalculationMetrics;
import org.neuralchilli.rasterindex.raster.PixelEvaluator;
import org.neuralchilli.rasterindex.raster.PixelEvaluator.EvaluationOutcome;
import org.neuralchilli.rasterindex.support.FakeRaster;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CalculationTaskExecutorTest {

    private PixelEvaluator pixelEvaluator;
    private CalculationMetrics metrics;
    private CalculationTaskExecutor executor;
    private CalculationTask task;

    @BeforeEach
    void setUp() {
        pixelEvaluator = mock(PixelEvaluator.class);
        metrics = new CalculationMetrics();
        executor = new CalculationTaskExecutor(pixelEvaluator, metrics);
        task = CalculationTask.create(
                "NGRDI_wernette", "(G - R) / (G + R)", FakeRaster.small("field"), BandMapping.rgb(),
                0.04, "mem://field_NGRDI_wernette.tiff", Path.of("out", "field_NGRDI_wernette.tiff"));
    }

    @Test
    void shouldReportSuccess() {
        when(pixelEvaluator.evaluate(eq("(G - R) / (G + R)"), any(), any(), eq("mem://field_NGRDI_wernette.tiff")))
                .thenReturn(EvaluationOutcome.succeeded());

        TaskResult result = executor.execute(task);

        assertThat(result.calculationStatus()).isEqualTo(CalculationStatus.SUCCESS);
        assertThat(result.index()).isEqualTo("NGRDI_wernette");
        assertThat(result.source()).isEqualTo("/data/field.tif");
        assertThat(result.timeSpent()).isGreaterThanOrEqualTo(0);
        assertThat(result.savingStatus()).isNull();
        assertThat(metrics.getReport().calculationsSucceeded()).isEqualTo(1);
    }

    @Test
    void shouldReportEvaluationFailureAsError() {
        when(pixelEvaluator.evaluate(any(), any(), any(), any()))
                .thenReturn(EvaluationOutcome.failed("Invalid expression"));

        TaskResult result = executor.execute(task);

        assertThat(result.calculationStatus()).isEqualTo(CalculationStatus.ERROR);
        assertThat(result.message()).isEqualTo("Invalid expression");
        assertThat(metrics.getReport().calculationsFailed()).isEqualTo(1);
    }

    @Test
    void shouldCatchUnexpectedFailures() {
        when(pixelEvaluator.evaluate(any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("Raster band unreadable"));

        TaskResult result = executor.execute(task);

        assertThat(result.calculationStatus()).isEqualTo(CalculationStatus.EXCEPTION);
        assertThat(result.message()).isEqualTo("Raster band unreadable");
        assertThat(metrics.getReport().calculationsExcepted()).isEqualTo(1);
    }

    @Test
    void shouldUseExceptionTypeWhenMessageMissing() {
        when(pixelEvaluator.evaluate(any(), any(), any(), any()))
                .thenThrow(new NullPointerException());

        TaskResult result = executor.execute(task);

        assertThat(result.message()).isEqualTo(NullPointerException.class.getName());
    }
}
