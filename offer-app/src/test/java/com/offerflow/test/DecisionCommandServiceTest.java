package com.offerflow.test;

import com.offerflow.api.dto.DecisionCreateRequestDTO;
import com.offerflow.api.dto.DecisionDTO;
import com.offerflow.api.dto.DecisionUpdateRequestDTO;
import com.offerflow.test.support.InMemoryAssumptionRepository;
import com.offerflow.test.support.InMemoryDecisionRepository;
import com.offerflow.test.support.InMemoryWorkItemCatalog;
import com.offerflow.trigger.application.command.DecisionCommandService;
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

public class DecisionCommandServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 9, 0);

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
    private final InMemoryDecisionRepository decisionRepository = new InMemoryDecisionRepository();
    private final InMemoryWorkItemCatalog catalog = new InMemoryWorkItemCatalog().addProject(1L, "Card offer");
    private final DecisionLogViewAssembler assembler = new DecisionLogViewAssembler();
    private final DecisionCommandService service = new DecisionCommandService(decisionRepository, catalog, assembler, clock);
    private final DecisionLogQueryService queryService = new DecisionLogQueryService(
            decisionRepository, new InMemoryAssumptionRepository(), assembler);

    @Test
    public void shouldRecordProposedDecision() {
        DecisionDTO created = service.createDecision(1L, request("  Launch with fixed APR ", "Fixed 19.9% APR"));

        Assertions.assertNotNull(created.getId());
        Assertions.assertEquals("Launch with fixed APR", created.getTitle());
        Assertions.assertEquals("proposed", created.getStatus());
        Assertions.assertEquals(List.of("variable APR", "tiered APR"), created.getAlternatives());
        Assertions.assertNull(created.getDecisionDate());
        Assertions.assertEquals(NOW, created.getCreatedAt());
    }

    @Test
    public void shouldRequireTitleAndDecision() {
        AppException noTitle = Assertions.assertThrows(AppException.class,
                () -> service.createDecision(1L, request(" ", "Fixed APR")));
        Assertions.assertTrue(noTitle.is(ResponseCode.ILLEGAL_PARAMETER));

        AppException noDecision = Assertions.assertThrows(AppException.class,
                () -> service.createDecision(1L, request("APR", null)));
        Assertions.assertTrue(noDecision.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertEquals(0, decisionRepository.size());
    }

    @Test
    public void shouldRejectDecisionForUnknownProject() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.createDecision(9L, request("APR", "Fixed APR")));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldStampDecisionDateWhenAccepted() {
        DecisionDTO created = service.createDecision(1L, request("APR", "Fixed APR"));

        DecisionUpdateRequestDTO accept = new DecisionUpdateRequestDTO();
        accept.setStatus("accepted");
        accept.setDecisionMaker("pricing committee");
        DecisionDTO accepted = service.updateDecision(created.getId(), accept);

        Assertions.assertEquals("accepted", accepted.getStatus());
        Assertions.assertEquals(NOW, accepted.getDecisionDate());
        Assertions.assertEquals("pricing committee", accepted.getDecisionMaker());

        DecisionUpdateRequestDTO supersede = new DecisionUpdateRequestDTO();
        supersede.setStatus("superseded");
        DecisionDTO superseded = service.updateDecision(created.getId(), supersede);
        Assertions.assertEquals("superseded", superseded.getStatus());
        Assertions.assertEquals(NOW, superseded.getDecisionDate());
    }

    @Test
    public void shouldKeepFieldsNotSentAndIgnoreBlankTitle() {
        DecisionDTO created = service.createDecision(1L, request("APR", "Fixed APR"));

        DecisionUpdateRequestDTO update = new DecisionUpdateRequestDTO();
        update.setTitle("");
        update.setRationale("");
        update.setAlternatives(List.of());
        DecisionDTO updated = service.updateDecision(created.getId(), update);

        Assertions.assertEquals("APR", updated.getTitle());
        Assertions.assertEquals("Fixed APR", updated.getDecision());
        Assertions.assertEquals("", updated.getRationale());
        Assertions.assertTrue(updated.getAlternatives().isEmpty());
        Assertions.assertEquals("proposed", updated.getStatus());
    }

    @Test
    public void shouldRejectUnknownStatusCode() {
        DecisionDTO created = service.createDecision(1L, request("APR", "Fixed APR"));
        DecisionUpdateRequestDTO update = new DecisionUpdateRequestDTO();
        update.setStatus("approved");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.updateDecision(created.getId(), update));
        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldListNewestFirstAndFilterByStatus() {
        DecisionDTO first = service.createDecision(1L, request("APR", "Fixed APR"));
        DecisionDTO second = service.createDecision(1L, request("Rewards", "Cashback only"));
        DecisionUpdateRequestDTO accept = new DecisionUpdateRequestDTO();
        accept.setStatus("accepted");
        service.updateDecision(first.getId(), accept);

        List<DecisionDTO> all = queryService.listDecisions(1L, null);
        Assertions.assertEquals(List.of(second.getId(), first.getId()),
                all.stream().map(DecisionDTO::getId).collect(Collectors.toList()));
        Assertions.assertEquals(1, queryService.listDecisions(1L, "accepted").size());
        Assertions.assertTrue(queryService.listDecisions(2L, null).isEmpty());
    }

    @Test
    public void shouldDeleteDecisionOnce() {
        DecisionDTO created = service.createDecision(1L, request("APR", "Fixed APR"));

        service.deleteDecision(created.getId());

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.deleteDecision(created.getId()));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    private DecisionCreateRequestDTO request(String title, String decision) {
        DecisionCreateRequestDTO request = new DecisionCreateRequestDTO();
        request.setTitle(title);
        request.setDecision(decision);
        request.setContext("competitor launched at 21%");
        request.setAlternatives(List.of("variable APR", "tiered APR"));
        return request;
    }
}
