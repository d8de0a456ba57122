package org.neuralchilli.rasterindex.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.rasterindex.core.FormulaLibrary;
import org.neuralchilli.rasterindex.core.FormulaResolver;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.domain.BandStatistic;
import org.neuralchilli.rasterindex.domain.CalculationStatus;
import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.TaskPlan;
import org.neuralchilli.rasterindex.raster.BandStatisticsProvider;
import org.neuralchilli.rasterindex.raster.RasterHandle;
import org.neuralchilli.rasterindex.support.FakeRaster;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TaskPlannerTest {

    private final Path outputDir = Path.of("/out");

    private BandStatisticsProvider statistics;
    private TaskPlanner planner;

    @BeforeEach
    void setup() {
        statistics = mock(BandStatisticsProvider.class);
        when(statistics.statistic(any(), anyInt(), any())).thenReturn(200.0);

        FormulaLibrary library = FormulaLibrary.of(Map.of(
                "Rnorm", "R / func_band_max(R)",
                "ExG_wernette", "2 * G - R - B",
                "NIRnorm", "N / func_band_max(N)"
        ));
        planner = new TaskPlanner(new FormulaResolver(library, statistics));
    }

    @Test
    void shouldPlanRasterMajor() {
        // Given: Two rasters and two indices
        List<RasterHandle> rasters = List.of(FakeRaster.small("a"), FakeRaster.small("b"));

        // When: Consume the plan
        List<TaskPlan> plans = drain(planner.plan(rasters, List.of("Rnorm", "ExG_wernette"), BandMapping.rgb(), outputDir));

        // Then: Every index of the first raster comes before the second raster
        assertThat(plans).hasSize(4).allMatch(plan -> plan instanceof TaskPlan.Ready);
        assertThat(plans).extracting(plan -> ((TaskPlan.Ready) plan).task().raster().name() + "/" + plan.index())
                .containsExactly("a/Rnorm", "a/ExG_wernette", "b/Rnorm", "b/ExG_wernette");
    }

    @Test
    void shouldBuildTaskWithResolvedExpressionAndPaths() {
        RasterHandle raster = FakeRaster.small("field_01");

        TaskPlan plan = planner.planTask(raster, "Rnorm", BandMapping.rgb(), outputDir);

        CalculationTask task = ((TaskPlan.Ready) plan).task();
        assertThat(task.expression()).isEqualTo("R / 200.0");
        assertThat(task.stagingPath()).isEqualTo("mem://field_01_Rnorm_" + task.id() + ".tiff");
        assertThat(task.outputFile()).isEqualTo(Path.of("/out/field_01_Rnorm.tiff"));
        assertThat(task.estimatedMemoryMb()).isEqualTo(TaskPlanner.taskCost(raster));
        assertThat(task.source()).isEqualTo("/data/field_01.tif");
        verify(statistics).statistic(raster, 1, BandStatistic.MAX);
    }

    @Test
    void shouldStageSameNamedRastersUnderDistinctPaths() {
        // Given: Two runs over different rasters that share a file name
        RasterHandle first = new FakeRaster("/data/2023/field.tif", "field", 100, 100, 3, 1);
        RasterHandle second = new FakeRaster("/data/2024/field.tif", "field", 100, 100, 3, 1);

        // When: Plan the same index for both
        CalculationTask a = ((TaskPlan.Ready) planner.planTask(first, "Rnorm", BandMapping.rgb(), outputDir)).task();
        CalculationTask b = ((TaskPlan.Ready) planner.planTask(second, "Rnorm", BandMapping.rgb(), outputDir)).task();

        // Then: Staged outputs cannot overwrite each other
        assertThat(a.stagingPath()).isNotEqualTo(b.stagingPath());
        assertThat(a.stagingPath()).contains(a.id().toString());
        assertThat(b.stagingPath()).contains(b.id().toString());
    }

    @Test
    void shouldTurnResolutionFailureIntoErrorResult() {
        // Given: A formula using a band symbol the mapping lacks
        RasterHandle raster = FakeRaster.small("field");

        // When: Plan it
        TaskPlan plan = planner.planTask(raster, "NIRnorm", BandMapping.rgb(), outputDir);

        // Then: A finished error result, no task
        assertThat(plan).isInstanceOf(TaskPlan.Unresolvable.class);
        TaskPlan.Unresolvable unresolvable = (TaskPlan.Unresolvable) plan;
        assertThat(unresolvable.result().calculationStatus()).isEqualTo(CalculationStatus.ERROR);
        assertThat(unresolvable.result().source()).isEqualTo("/data/field.tif");
        assertThat(unresolvable.result().index()).isEqualTo("NIRnorm");
        assertThat(unresolvable.result().message()).startsWith("Formula resolution failed: ");
        assertThat(unresolvable.result().timeSpent()).isZero();
    }

    @Test
    void shouldResolveOnlyAsPlansAreConsumed() {
        List<RasterHandle> rasters = List.of(FakeRaster.small("a"), FakeRaster.small("b"));

        Iterator<TaskPlan> plans = planner.plan(rasters, List.of("Rnorm"), BandMapping.rgb(), outputDir);
        verifyNoInteractions(statistics);

        plans.next();
        verify(statistics, times(1)).statistic(any(), anyInt(), any());
    }

    @Test
    void shouldEstimateRasterPlusOneOutputBand() {
        // 1024x1024, 4 bands, 2 bytes: 8 MB input, 2 MB output band
        RasterHandle raster = new FakeRaster("/data/big.tif", "big", 1024, 1024, 4, 2);

        assertThat(raster.sizeInMegabytes()).isEqualTo(8.0);
        assertThat(TaskPlanner.taskCost(raster)).isEqualTo(10.0);
    }

    private static List<TaskPlan> drain(Iterator<TaskPlan> iterator) {
        List<TaskPlan> plans = new ArrayList<>();
        iterator.forEachRemaining(plans::add);
        return plans;
    }
}
