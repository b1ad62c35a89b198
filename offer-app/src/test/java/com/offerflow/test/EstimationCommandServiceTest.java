package com.offerflow.test;

import com.offerflow.api.dto.CostOfDelayRequestDTO;
import com.offerflow.api.dto.RangeEstimateRequestDTO;
import com.offerflow.api.dto.RiceInputRequestDTO;
import com.offerflow.api.dto.StoryEstimateDTO;
import com.offerflow.api.dto.WsjfInputRequestDTO;
import com.offerflow.test.support.InMemoryStoryEstimateRepository;
import com.offerflow.test.support.InMemoryWorkItemCatalog;
import com.offerflow.trigger.application.command.EstimationCommandService;
import com.offerflow.trigger.application.common.PlanningViewAssembler;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

public class EstimationCommandServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
    private final InMemoryStoryEstimateRepository estimateRepository = new InMemoryStoryEstimateRepository();
    private final InMemoryWorkItemCatalog catalog = new InMemoryWorkItemCatalog()
            .addProject(1L, "Card offer")
            .addEpic(1L, 10L)
            .addStory(10L, 101L, "Pricing API", 6D)
            .addTask(101L, 1001L, "Define schema");
    private final EstimationCommandService service = new EstimationCommandService(
            estimateRepository,
            catalog,
            new PlanningViewAssembler(),
            clock);

    @Test
    public void shouldKeepSingleEstimatePerStoryAcrossInputs() {
        RiceInputRequestDTO rice = new RiceInputRequestDTO();
        rice.setReach(400);
        rice.setImpact(2D);
        rice.setConfidence(0.5);
        rice.setEffort(4D);
        StoryEstimateDTO afterRice = service.setRiceInputs(101L, rice);

        WsjfInputRequestDTO wsjf = new WsjfInputRequestDTO();
        wsjf.setBusinessValue(13);
        wsjf.setTimeCriticality(8);
        wsjf.setRiskReduction(3);
        wsjf.setJobSize(8);
        StoryEstimateDTO afterWsjf = service.setWsjfInputs(101L, wsjf);

        CostOfDelayRequestDTO cod = new CostOfDelayRequestDTO();
        cod.setWeekly(2500D);
        cod.setUrgencyProfile("urgent");
        StoryEstimateDTO afterCod = service.setCostOfDelay(101L, cod);

        Assertions.assertEquals(1, estimateRepository.size());
        Assertions.assertEquals(afterRice.getId(), afterCod.getId());
        Assertions.assertEquals(100D, afterWsjf.getRiceScore(), 1e-9);
        Assertions.assertEquals(3D, afterWsjf.getWsjfScore(), 1e-9);
        Assertions.assertEquals("urgent", afterCod.getCodUrgencyProfile());
    }

    @Test
    public void shouldRejectUnorderedRange() {
        RangeEstimateRequestDTO range = new RangeEstimateRequestDTO();
        range.setP10(8D);
        range.setP50(4D);
        range.setP90(12D);

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.setRangeEstimate(101L, range));
        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertEquals(0, estimateRepository.size());
    }

    @Test
    public void shouldRejectUnknownStory() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.setRiceInputs(999L, new RiceInputRequestDTO()));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldStoreModelEstimateAndFillEmptyRange() {
        StoryEstimateDTO result = service.applyAiEstimate(101L, Map.of(
                "p10_hours", 4, "p50_hours", 6, "p90_hours", 11, "confidence", 0.7, "reasoning", "schema plus api"));

        Assertions.assertEquals(6D, result.getAiEstimateP50());
        Assertions.assertEquals(6D, result.getEstimateP50());
        Assertions.assertEquals(6.5D, result.getPertExpectedHours(), 1e-9);
        Assertions.assertEquals("schema plus api", result.getAiReasoning());
    }

    @Test
    public void shouldFailWhenModelEstimateIsMissing() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.applyAiEstimate(101L, null));

        Assertions.assertTrue(ex.is(ResponseCode.UPSTREAM_FAILURE));
        Assertions.assertEquals(0, estimateRepository.size());
    }
}
