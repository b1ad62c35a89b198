package com.offerflow.test;

import com.offerflow.api.dto.DependencyInferenceResultDTO;
import com.offerflow.api.dto.LifecycleGenerateResultDTO;
import com.offerflow.api.dto.StoryEstimateDTO;
import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.domain.ai.service.PlanningPromptDomainService;
import com.offerflow.domain.ai.service.ToolCallingDomainService;
import com.offerflow.domain.dependency.service.DependencyGraphDomainService;
import com.offerflow.domain.lifecycle.service.LifecyclePlanDomainService;
import com.offerflow.domain.lifecycle.service.PhaseSequencerDomainService;
import com.offerflow.test.support.InMemoryDependencyRepository;
import com.offerflow.test.support.InMemoryLifecyclePhaseRepository;
import com.offerflow.test.support.InMemoryServiceTaskRepository;
import com.offerflow.test.support.InMemoryStoryEstimateRepository;
import com.offerflow.test.support.InMemoryWorkItemCatalog;
import com.offerflow.test.support.ScriptedToolCallingModelGateway;
import com.offerflow.trigger.application.command.DependencyCommandService;
import com.offerflow.trigger.application.command.EstimationCommandService;
import com.offerflow.trigger.application.command.LifecycleCommandService;
import com.offerflow.trigger.application.command.ModelAssistedPlanningService;
import com.offerflow.trigger.application.common.LifecycleViewAssembler;
import com.offerflow.trigger.application.common.PlanningViewAssembler;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

public class ModelAssistedPlanningServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
    private final InMemoryWorkItemCatalog catalog = new InMemoryWorkItemCatalog()
            .addProject(1L, "Card offer")
            .addEpic(1L, 10L)
            .addStory(10L, 101L, "Pricing API", 6D)
            .addStory(10L, 102L, "Pricing UI", 4D)
            .addStory(10L, 103L, "Launch comms", 2D)
            .addTask(101L, 1001L, "Define schema")
            .addProject(2L, "Empty offer");
    private final InMemoryDependencyRepository dependencyRepository = new InMemoryDependencyRepository();
    private final InMemoryStoryEstimateRepository estimateRepository = new InMemoryStoryEstimateRepository();
    private final InMemoryLifecyclePhaseRepository phaseRepository = new InMemoryLifecyclePhaseRepository();
    private final InMemoryServiceTaskRepository taskRepository = new InMemoryServiceTaskRepository();
    private final ScriptedToolCallingModelGateway gateway = new ScriptedToolCallingModelGateway();

    private final LifecycleCommandService lifecycleCommandService = new LifecycleCommandService(
            phaseRepository, taskRepository, catalog,
            new PhaseSequencerDomainService(), new LifecyclePlanDomainService(),
            new LifecycleViewAssembler(), clock);
    private final ModelAssistedPlanningService service = new ModelAssistedPlanningService(
            catalog,
            phaseRepository,
            new PlanningPromptDomainService(),
            new ToolCallingDomainService(gateway),
            new DependencyCommandService(dependencyRepository, catalog,
                    new DependencyGraphDomainService(dependencyRepository, catalog), new PlanningViewAssembler(), clock),
            new EstimationCommandService(estimateRepository, catalog, new PlanningViewAssembler(), clock),
            lifecycleCommandService);

    @Test
    public void shouldInferAndSaveDependencies() {
        gateway.answer(PlanningPromptDomainService.TOOL_RECORD_DEPENDENCIES, Map.of("dependencies", List.of(
                Map.of("source_id", 102, "target_id", 101, "dependency_type", "blocks", "confidence", 0.9,
                        "reasoning", "ui calls api"),
                Map.of("source_id", 101, "target_id", 101))));

        DependencyInferenceResultDTO result = service.inferDependencies(1L, LlmProviderConfig.stub());

        Assertions.assertEquals(1, result.getCreatedCount());
        Assertions.assertEquals(1, result.getSkippedCount());
        Assertions.assertEquals(1, dependencyRepository.findByProjectId(1L).size());
        Assertions.assertTrue(gateway.getLastMessages().get(1).content().contains("Pricing UI"));
    }

    @Test
    public void shouldSkipInferenceForProjectWithoutStories() {
        DependencyInferenceResultDTO result = service.inferDependencies(2L, null);

        Assertions.assertEquals(0, result.getCreatedCount());
        Assertions.assertTrue(result.getDependencies().isEmpty());
        Assertions.assertNull(gateway.getLastMessages());
    }

    @Test
    public void shouldWriteNothingWhenInferenceFails() {
        gateway.failWith(new IllegalStateException("timeout"));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.inferDependencies(1L, LlmProviderConfig.stub()));

        Assertions.assertTrue(ex.is(ResponseCode.UPSTREAM_FAILURE));
        Assertions.assertTrue(dependencyRepository.findByProjectId(1L).isEmpty());
    }

    @Test
    public void shouldRejectInferenceForUnknownProject() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.inferDependencies(9L, null));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
        Assertions.assertNull(gateway.getLastMessages());
    }

    @Test
    public void shouldGenerateRangeEstimateFromTaskContext() {
        gateway.answer(PlanningPromptDomainService.TOOL_PROVIDE_ESTIMATES, Map.of(
                "p10_hours", 4, "p50_hours", 6, "p90_hours", 11, "confidence", 0.7, "reasoning", "schema plus api"));

        StoryEstimateDTO result = service.generateRangeEstimate(101L, LlmProviderConfig.stub());

        Assertions.assertEquals(6.5D, result.getPertExpectedHours(), 1e-9);
        Assertions.assertEquals(1, estimateRepository.size());
        Assertions.assertTrue(gateway.getLastMessages().get(1).content().contains("Define schema"));
    }

    @Test
    public void shouldFailWhenModelReturnsNoEstimate() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.generateRangeEstimate(101L, LlmProviderConfig.stub()));

        Assertions.assertTrue(ex.is(ResponseCode.UPSTREAM_FAILURE));
        Assertions.assertEquals(0, estimateRepository.size());
    }

    @Test
    public void shouldRejectEstimateForUnknownStory() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.generateRangeEstimate(999L, null));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
        Assertions.assertNull(gateway.getLastMessages());
    }

    @Test
    public void shouldGenerateLifecycleFromModelPlan() {
        gateway.answer(PlanningPromptDomainService.TOOL_GENERATE_LIFECYCLE, Map.of(
                "offer_type", "credit_card",
                "phases", List.of(Map.of("phase", "concept", "target_duration_days", 14, "tasks", List.of(
                        Map.of("title", "Market sizing", "days_required", 5))))));

        LifecycleGenerateResultDTO result = service.generateLifecycle(1L, LocalDate.of(2026, 4, 1),
                LlmProviderConfig.stub());

        Assertions.assertEquals(6, result.getPhasesCreated());
        Assertions.assertEquals(1, result.getTasksCreated());
        Assertions.assertEquals(LocalDate.of(2026, 4, 15), result.getPhases().get(1).getTargetStartDate());
    }

    @Test
    public void shouldFallBackToDefaultPhasesWhenModelReturnsNothing() {
        LifecycleGenerateResultDTO result = service.generateLifecycle(1L, null, null);

        Assertions.assertEquals(6, result.getPhasesCreated());
        Assertions.assertEquals(0, result.getTasksCreated());
        Assertions.assertEquals(TODAY, result.getPhases().get(0).getTargetStartDate());
    }

    @Test
    public void shouldWriteNothingWhenGenerationFails() {
        gateway.failWith(new IllegalStateException("quota exceeded"));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.generateLifecycle(1L, null, LlmProviderConfig.stub()));

        Assertions.assertTrue(ex.is(ResponseCode.UPSTREAM_FAILURE));
        Assertions.assertTrue(phaseRepository.findByProjectId(1L).isEmpty());
        Assertions.assertTrue(taskRepository.findAll().isEmpty());
    }

    @Test
    public void shouldNotCallModelWhenLifecycleExists() {
        lifecycleCommandService.initialize(1L);

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.generateLifecycle(1L, null, null));

        Assertions.assertTrue(ex.is(ResponseCode.ALREADY_EXISTS));
        Assertions.assertNull(gateway.getLastMessages());
    }
}
