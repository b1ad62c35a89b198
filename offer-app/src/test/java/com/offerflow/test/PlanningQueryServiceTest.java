package com.offerflow.test;

import com.offerflow.api.dto.BacklogItemDTO;
import com.offerflow.api.dto.CriticalPathDTO;
import com.offerflow.domain.dependency.model.entity.DependencyEntity;
import com.offerflow.domain.dependency.service.DependencyGraphDomainService;
import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;
import com.offerflow.domain.estimation.service.BacklogRankingDomainService;
import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.test.support.InMemoryDependencyRepository;
import com.offerflow.test.support.InMemoryStoryEstimateRepository;
import com.offerflow.test.support.InMemoryWorkItemCatalog;
import com.offerflow.trigger.application.common.PlanningProperties;
import com.offerflow.trigger.application.common.PlanningViewAssembler;
import com.offerflow.trigger.application.query.PlanningQueryService;
import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.DependencyTypeEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

public class PlanningQueryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 9, 0);

    private final InMemoryDependencyRepository dependencyRepository = new InMemoryDependencyRepository();
    private final InMemoryStoryEstimateRepository estimateRepository = new InMemoryStoryEstimateRepository();
    private final InMemoryWorkItemCatalog catalog = new InMemoryWorkItemCatalog()
            .addProject(1L, "Card offer")
            .addEpic(1L, 10L)
            .addStory(10L, 101L, "Pricing API", 6D)
            .addStory(10L, 102L, "Pricing UI", null)
            .addStory(10L, 103L, "Launch comms", 2D);
    private final PlanningProperties properties = new PlanningProperties();
    private final PlanningQueryService service = new PlanningQueryService(
            dependencyRepository,
            estimateRepository,
            catalog,
            new DependencyGraphDomainService(dependencyRepository, catalog),
            new BacklogRankingDomainService(),
            new PlanningViewAssembler(),
            properties);

    @Test
    public void shouldComputeCriticalPathFromEstimatesAndDefaults() {
        save(101L, 102L);
        save(102L, 103L);
        StoryEstimateEntity estimate = StoryEstimateEntity.create(101L, NOW);
        estimate.applyRange(5D, 10D, 20D, NOW);
        estimateRepository.save(estimate);
        properties.setDefaultNodeDurationHours(4D);

        CriticalPathDTO path = service.criticalPath(1L);

        Assertions.assertEquals(List.of(101L, 102L, 103L),
                path.getItems().stream().map(item -> item.getItemId()).collect(Collectors.toList()));
        Assertions.assertEquals(List.of(10D, 4D, 2D),
                path.getItems().stream().map(item -> item.getDuration()).collect(Collectors.toList()));
        Assertions.assertEquals(16D, path.getTotalDuration(), 1e-9);
        Assertions.assertFalse(path.getCyclic());
        Assertions.assertEquals("story", path.getItems().get(0).getItemType());
    }

    @Test
    public void shouldFilterDependenciesByStatus() {
        DependencyEntity first = save(101L, 102L);
        save(102L, 103L);
        first.changeStatus(DependencyStatusEnum.BLOCKED, "waiting on vendor", NOW);

        Assertions.assertEquals(2, service.listDependencies(1L, null).size());
        Assertions.assertEquals(1, service.listDependencies(1L, "blocked").size());
        Assertions.assertThrows(AppException.class, () -> service.listDependencies(1L, "stalled"));
    }

    @Test
    public void shouldRankBacklogByRequestedModel() {
        StoryEstimateEntity rice = StoryEstimateEntity.create(103L, NOW);
        rice.applyRiceInputs(100, 1D, 1D, 1D, NOW);
        estimateRepository.save(rice);
        StoryEstimateEntity wsjf = StoryEstimateEntity.create(102L, NOW);
        wsjf.applyWsjfInputs(8, 8, 2, 2, NOW);
        estimateRepository.save(wsjf);

        List<BacklogItemDTO> byRice = service.backlog(1L, null);
        List<BacklogItemDTO> byWsjf = service.backlog(1L, "wsjf");

        Assertions.assertEquals(103L, byRice.get(0).getStoryId());
        Assertions.assertEquals(102L, byWsjf.get(0).getStoryId());
        Assertions.assertEquals(9D, byWsjf.get(0).getScore(), 1e-9);
        Assertions.assertEquals(3, byWsjf.size());
    }

    @Test
    public void shouldRejectUnknownProjectAndMissingEstimate() {
        AppException path = Assertions.assertThrows(AppException.class, () -> service.criticalPath(9L));
        Assertions.assertTrue(path.is(ResponseCode.NOT_FOUND));

        AppException estimate = Assertions.assertThrows(AppException.class, () -> service.getEstimate(101L));
        Assertions.assertTrue(estimate.is(ResponseCode.NOT_FOUND));

        AppException model = Assertions.assertThrows(AppException.class, () -> service.backlog(1L, "moscow"));
        Assertions.assertTrue(model.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    private DependencyEntity save(Long sourceStoryId, Long targetStoryId) {
        return dependencyRepository.save(DependencyEntity.create(1L, WorkItemRef.story(sourceStoryId),
                WorkItemRef.story(targetStoryId), DependencyTypeEnum.BLOCKS, false, null, null, null, NOW));
    }
}
