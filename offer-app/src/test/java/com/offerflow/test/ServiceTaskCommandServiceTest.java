package com.offerflow.test;

import com.offerflow.api.dto.BulkUpdateResultDTO;
import com.offerflow.api.dto.ServiceTaskBulkStatusRequestDTO;
import com.offerflow.api.dto.ServiceTaskCreateRequestDTO;
import com.offerflow.api.dto.ServiceTaskDTO;
import com.offerflow.api.dto.ServiceTaskLinkRequestDTO;
import com.offerflow.api.dto.ServiceTaskUpdateRequestDTO;
import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.domain.lifecycle.service.LifecyclePlanDomainService;
import com.offerflow.domain.lifecycle.service.PhaseSequencerDomainService;
import com.offerflow.test.support.InMemoryLifecyclePhaseRepository;
import com.offerflow.test.support.InMemoryServiceTaskRepository;
import com.offerflow.trigger.application.command.ServiceTaskCommandService;
import com.offerflow.trigger.application.common.LifecycleViewAssembler;
import com.offerflow.trigger.application.query.LifecycleQueryService;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.enums.ServiceTaskStatusEnum;
import com.offerflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

public class ServiceTaskCommandServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
    private final InMemoryLifecyclePhaseRepository phaseRepository = new InMemoryLifecyclePhaseRepository();
    private final InMemoryServiceTaskRepository taskRepository = new InMemoryServiceTaskRepository();
    private final LifecycleViewAssembler assembler = new LifecycleViewAssembler();
    private final ServiceTaskCommandService service = new ServiceTaskCommandService(
            taskRepository, phaseRepository, new LifecyclePlanDomainService(), assembler, clock);
    private final LifecycleQueryService queryService = new LifecycleQueryService(
            phaseRepository, taskRepository, new PhaseSequencerDomainService(), assembler);

    private Long conceptId;
    private Long defineId;

    @BeforeEach
    public void setUp() {
        List<LifecyclePhaseEntity> phases = new PhaseSequencerDomainService()
                .newLifecycle(1L, LocalDateTime.now(clock));
        phases.forEach(phaseRepository::save);
        conceptId = phases.get(0).getId();
        defineId = phases.get(1).getId();
    }

    @Test
    public void shouldAppendManualTasksInOrder() {
        ServiceTaskDTO first = service.createTask(conceptId, create("Kickoff", 2));
        ServiceTaskDTO second = service.createTask(conceptId, create("Stakeholder map", null));

        Assertions.assertEquals(0, first.getTaskOrder());
        Assertions.assertEquals(1, second.getTaskOrder());
        Assertions.assertEquals("manual", first.getSource());
        Assertions.assertEquals("not_started", first.getStatus());
        Assertions.assertEquals(TODAY.plusDays(2), first.getTargetCompleteDate());
        Assertions.assertNull(second.getTargetCompleteDate());
    }

    @Test
    public void shouldValidateCreateRequest() {
        AppException blank = Assertions.assertThrows(AppException.class,
                () -> service.createTask(conceptId, create(" ", 1)));
        Assertions.assertTrue(blank.is(ResponseCode.ILLEGAL_PARAMETER));

        AppException negative = Assertions.assertThrows(AppException.class,
                () -> service.createTask(conceptId, create("Kickoff", -1)));
        Assertions.assertTrue(negative.is(ResponseCode.ILLEGAL_PARAMETER));

        AppException missingPhase = Assertions.assertThrows(AppException.class,
                () -> service.createTask(99L, create("Kickoff", 1)));
        Assertions.assertTrue(missingPhase.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldPatchOnlyProvidedFieldsAndTrackDates() {
        ServiceTaskDTO task = service.createTask(conceptId, create("Kickoff", 2));

        ServiceTaskUpdateRequestDTO start = new ServiceTaskUpdateRequestDTO();
        start.setStatus("in_progress");
        start.setOwner("alice");
        ServiceTaskDTO started = service.updateTask(task.getId(), start);

        Assertions.assertEquals("Kickoff", started.getTitle());
        Assertions.assertEquals("alice", started.getOwner());
        Assertions.assertEquals(TODAY, started.getActualStartDate());

        ServiceTaskUpdateRequestDTO complete = new ServiceTaskUpdateRequestDTO();
        complete.setStatus("completed");
        complete.setCompletionNotes("done");
        ServiceTaskDTO completed = service.updateTask(task.getId(), complete);

        Assertions.assertEquals("completed", completed.getStatus());
        Assertions.assertEquals(TODAY, completed.getActualCompleteDate());
        Assertions.assertNotNull(completed.getCompletedAt());
        Assertions.assertEquals("alice", completed.getOwner());
        Assertions.assertEquals("done", completed.getCompletionNotes());
    }

    @Test
    public void shouldRejectUnknownStatusCode() {
        ServiceTaskDTO task = service.createTask(conceptId, create("Kickoff", 2));
        ServiceTaskUpdateRequestDTO update = new ServiceTaskUpdateRequestDTO();
        update.setStatus("paused");

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.updateTask(task.getId(), update));
        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldLinkDevelopmentWork() {
        ServiceTaskDTO task = service.createTask(conceptId, create("Kickoff", 2));

        AppException empty = Assertions.assertThrows(AppException.class,
                () -> service.linkDevWork(task.getId(), new ServiceTaskLinkRequestDTO()));
        Assertions.assertTrue(empty.is(ResponseCode.ILLEGAL_PARAMETER));

        ServiceTaskLinkRequestDTO link = new ServiceTaskLinkRequestDTO();
        link.setStoryId(101L);
        ServiceTaskDTO linked = service.linkDevWork(task.getId(), link);
        Assertions.assertEquals(101L, linked.getLinkedStoryId());
        Assertions.assertNull(linked.getLinkedEpicId());
    }

    @Test
    public void shouldBulkUpdateOnlyTasksOfPhase() {
        ServiceTaskDTO a = service.createTask(conceptId, create("A", 1));
        ServiceTaskDTO b = service.createTask(conceptId, create("B", 1));
        ServiceTaskDTO foreign = service.createTask(defineId, create("C", 1));

        ServiceTaskBulkStatusRequestDTO request = new ServiceTaskBulkStatusRequestDTO();
        request.setStatus("completed");
        request.setTaskIds(Arrays.asList(a.getId(), b.getId(), a.getId(), foreign.getId(), 999L, null));
        BulkUpdateResultDTO result = service.bulkUpdateStatus(conceptId, request);

        Assertions.assertEquals(2, result.getUpdatedCount());
        Assertions.assertEquals(ServiceTaskStatusEnum.NOT_STARTED, taskRepository.findById(foreign.getId()).getStatus());
        Assertions.assertEquals(2L, queryService.getPhase(conceptId).getCompletedTaskCount());
        Assertions.assertEquals(2, queryService.listTasks(conceptId, "completed", null).size());
        Assertions.assertEquals(0, queryService.listTasks(defineId, "completed", null).size());
    }

    @Test
    public void shouldDeleteTaskOnce() {
        ServiceTaskDTO task = service.createTask(conceptId, create("Kickoff", 2));
        service.deleteTask(task.getId());

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.deleteTask(task.getId()));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
        AppException query = Assertions.assertThrows(AppException.class, () -> queryService.getTask(task.getId()));
        Assertions.assertTrue(query.is(ResponseCode.NOT_FOUND));
    }

    private ServiceTaskCreateRequestDTO create(String title, Integer days) {
        ServiceTaskCreateRequestDTO request = new ServiceTaskCreateRequestDTO();
        request.setTitle(title);
        request.setDaysRequired(days);
        request.setTargetStartDate(TODAY);
        request.setCategory("research");
        return request;
    }
}
