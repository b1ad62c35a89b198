package com.offerflow.test;

import com.offerflow.api.dto.AssumptionCreateRequestDTO;
import com.offerflow.api.dto.AssumptionDTO;
import com.offerflow.api.dto.AssumptionUpdateRequestDTO;
import com.offerflow.test.support.InMemoryAssumptionRepository;
import com.offerflow.test.support.InMemoryDecisionRepository;
import com.offerflow.test.support.InMemoryWorkItemCatalog;
import com.offerflow.trigger.application.command.AssumptionCommandService;
import com.offerflow.trigger.application.common.DecisionLogViewAssembler;
import com.offerflow.trigger.application.query.DecisionLogQueryService;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

public class AssumptionCommandServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 9, 0);

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
    private final InMemoryAssumptionRepository assumptionRepository = new InMemoryAssumptionRepository();
    private final InMemoryWorkItemCatalog catalog = new InMemoryWorkItemCatalog().addProject(1L, "Card offer");
    private final DecisionLogViewAssembler assembler = new DecisionLogViewAssembler();
    private final AssumptionCommandService service = new AssumptionCommandService(
            assumptionRepository, catalog, assembler, clock);
    private final DecisionLogQueryService queryService = new DecisionLogQueryService(
            new InMemoryDecisionRepository(), assumptionRepository, assembler);

    @Test
    public void shouldRecordUnvalidatedAssumptionWithMediumRiskByDefault() {
        AssumptionDTO created = service.createAssumption(1L, request("Partners accept 1% interchange", null));

        Assertions.assertEquals("unvalidated", created.getStatus());
        Assertions.assertEquals("medium", created.getRiskLevel());
        Assertions.assertNull(created.getValidatedAt());
    }

    @Test
    public void shouldRejectBlankAssumptionAndUnknownRisk() {
        AppException blank = Assertions.assertThrows(AppException.class,
                () -> service.createAssumption(1L, request("", "high")));
        Assertions.assertTrue(blank.is(ResponseCode.ILLEGAL_PARAMETER));

        AppException risk = Assertions.assertThrows(AppException.class,
                () -> service.createAssumption(1L, request("Demand exists", "severe")));
        Assertions.assertTrue(risk.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldRejectAssumptionForUnknownProject() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.createAssumption(9L, request("Demand exists", null)));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldStampValidatedAtOnlyWhenConcluded() {
        AssumptionDTO created = service.createAssumption(1L, request("Demand exists", "high"));

        AssumptionUpdateRequestDTO validating = new AssumptionUpdateRequestDTO();
        validating.setStatus("validating");
        validating.setValidationOwner("research");
        AssumptionDTO inProgress = service.updateAssumption(created.getId(), validating);
        Assertions.assertEquals("validating", inProgress.getStatus());
        Assertions.assertNull(inProgress.getValidatedAt());

        AssumptionUpdateRequestDTO invalidated = new AssumptionUpdateRequestDTO();
        invalidated.setStatus("invalidated");
        invalidated.setValidationResult("survey showed 4% intent");
        AssumptionDTO concluded = service.updateAssumption(created.getId(), invalidated);

        Assertions.assertEquals("invalidated", concluded.getStatus());
        Assertions.assertEquals(NOW, concluded.getValidatedAt());
        Assertions.assertEquals("survey showed 4% intent", concluded.getValidationResult());
        Assertions.assertEquals("research", concluded.getValidationOwner());
        Assertions.assertEquals("high", concluded.getRiskLevel());
    }

    @Test
    public void shouldListByRiskThenNewestAndApplyFilters() {
        AssumptionDTO low = service.createAssumption(1L, request("Branding is fine", "low"));
        AssumptionDTO critical = service.createAssumption(1L, request("Regulator approves", "critical"));
        AssumptionDTO mediumOld = service.createAssumption(1L, request("Demand exists", null));
        AssumptionDTO mediumNew = service.createAssumption(1L, request("Ops can scale", "medium"));

        List<Long> ordered = queryService.listAssumptions(1L, null, null).stream()
                .map(AssumptionDTO::getId)
                .collect(Collectors.toList());
        Assertions.assertEquals(List.of(critical.getId(), mediumNew.getId(), mediumOld.getId(), low.getId()), ordered);
        Assertions.assertEquals(2, queryService.listAssumptions(1L, null, "medium").size());
        Assertions.assertEquals(4, queryService.listAssumptions(1L, "unvalidated", null).size());
        Assertions.assertTrue(queryService.listAssumptions(1L, "validated", null).isEmpty());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> queryService.listAssumptions(1L, null, "severe"));
        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldFailUpdatingOrDeletingMissingAssumption() {
        AppException update = Assertions.assertThrows(AppException.class,
                () -> service.updateAssumption(99L, new AssumptionUpdateRequestDTO()));
        Assertions.assertTrue(update.is(ResponseCode.NOT_FOUND));

        AppException delete = Assertions.assertThrows(AppException.class, () -> service.deleteAssumption(99L));
        Assertions.assertTrue(delete.is(ResponseCode.NOT_FOUND));
    }

    private AssumptionCreateRequestDTO request(String assumption, String riskLevel) {
        AssumptionCreateRequestDTO request = new AssumptionCreateRequestDTO();
        request.setAssumption(assumption);
        request.setRiskLevel(riskLevel);
        request.setImpactIfWrong("launch slips a quarter");
        request.setValidationDeadline(NOW.plusDays(14));
        return request;
    }
}
