package com.offerflow.test;

import com.offerflow.api.dto.BulkUpdateResultDTO;
import com.offerflow.api.dto.LifecyclePhaseDTO;
import com.offerflow.api.dto.PhaseApprovalRequestDTO;
import com.offerflow.api.dto.PhaseApprovalResultDTO;
import com.offerflow.api.dto.ServiceTaskBulkStatusRequestDTO;
import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.trigger.application.command.LifecycleCommandService;
import com.offerflow.trigger.application.command.ModelAssistedPlanningService;
import com.offerflow.trigger.application.command.ServiceTaskCommandService;
import com.offerflow.trigger.application.common.AiProviderProperties;
import com.offerflow.trigger.application.common.LlmProviderConfigResolver;
import com.offerflow.trigger.application.query.LifecycleQueryService;
import com.offerflow.trigger.http.GlobalApiExceptionHandler;
import com.offerflow.trigger.http.LifecycleController;
import com.offerflow.trigger.http.ServiceTaskController;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class LifecycleControllerTest {

    private MockMvc mockMvc;
    private LifecycleCommandService lifecycleCommandService;
    private LifecycleQueryService lifecycleQueryService;
    private ServiceTaskCommandService serviceTaskCommandService;
    private ModelAssistedPlanningService modelAssistedPlanningService;

    @BeforeEach
    public void setUp() {
        this.lifecycleCommandService = mock(LifecycleCommandService.class);
        this.lifecycleQueryService = mock(LifecycleQueryService.class);
        this.serviceTaskCommandService = mock(ServiceTaskCommandService.class);
        this.modelAssistedPlanningService = mock(ModelAssistedPlanningService.class);
        AiProviderProperties properties = new AiProviderProperties();
        properties.setModel("gpt-4o");
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new LifecycleController(lifecycleCommandService, lifecycleQueryService, modelAssistedPlanningService,
                                new LlmProviderConfigResolver(properties)),
                        new ServiceTaskController(serviceTaskCommandService, lifecycleQueryService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldInitializeLifecycle() throws Exception {
        LifecyclePhaseDTO concept = new LifecyclePhaseDTO();
        concept.setId(1L);
        concept.setPhase("concept");
        concept.setStatus("not_started");
        when(lifecycleCommandService.initialize(7L)).thenReturn(List.of(concept));

        mockMvc.perform(post("/api/lifecycle/projects/7/initialize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].phase").value("concept"));
    }

    @Test
    public void shouldReturnConflictWhenLifecycleExists() throws Exception {
        when(lifecycleCommandService.initialize(7L))
                .thenThrow(new AppException(ResponseCode.ALREADY_EXISTS, "项目生命周期已存在: 7"));

        mockMvc.perform(post("/api/lifecycle/projects/7/initialize"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(ResponseCode.ALREADY_EXISTS.getCode()));
    }

    @Test
    public void shouldPassStartDateAndConfiguredModelToGeneration() throws Exception {
        mockMvc.perform(post("/api/lifecycle/projects/7/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2026-05-01\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<LlmProviderConfig> captor = ArgumentCaptor.forClass(LlmProviderConfig.class);
        verify(modelAssistedPlanningService).generateLifecycle(eq(7L), eq(LocalDate.of(2026, 5, 1)), captor.capture());
        assertEquals("gpt-4o", captor.getValue().model());
    }

    @Test
    public void shouldReturnConflictOnSequenceViolation() throws Exception {
        when(lifecycleCommandService.start(2L))
                .thenThrow(new AppException(ResponseCode.SEQUENCE_VIOLATION, "前序阶段 concept 尚未审批，不能开始 define"));

        mockMvc.perform(post("/api/lifecycle/phases/2/start"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(ResponseCode.SEQUENCE_VIOLATION.getCode()));
    }

    @Test
    public void shouldApprovePhase() throws Exception {
        LifecyclePhaseDTO approved = new LifecyclePhaseDTO();
        approved.setStatus("approved");
        LifecyclePhaseDTO next = new LifecyclePhaseDTO();
        next.setPhase("define");
        PhaseApprovalResultDTO result = new PhaseApprovalResultDTO();
        result.setApprovedPhase(approved);
        result.setStartedNextPhase(next);
        when(lifecycleCommandService.approve(eq(1L), any(PhaseApprovalRequestDTO.class))).thenReturn(result);

        mockMvc.perform(post("/api/lifecycle/phases/1/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approvedBy\":\"director\",\"notes\":\"go\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.approvedPhase.status").value("approved"))
                .andExpect(jsonPath("$.data.startedNextPhase.phase").value("define"));
    }

    @Test
    public void shouldReturnNotFoundForMissingSummary() throws Exception {
        when(lifecycleQueryService.summary(9L)).thenThrow(new AppException(ResponseCode.NOT_FOUND, "项目尚未初始化生命周期: 9"));

        mockMvc.perform(get("/api/lifecycle/projects/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void shouldBulkUpdateTaskStatus() throws Exception {
        BulkUpdateResultDTO result = new BulkUpdateResultDTO();
        result.setUpdatedCount(2);
        when(serviceTaskCommandService.bulkUpdateStatus(eq(3L), any(ServiceTaskBulkStatusRequestDTO.class)))
                .thenReturn(result);

        mockMvc.perform(post("/api/lifecycle/phases/3/tasks/bulk-status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"taskIds\":[1,2,3],\"status\":\"completed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.updatedCount").value(2));

        ArgumentCaptor<ServiceTaskBulkStatusRequestDTO> captor = ArgumentCaptor.forClass(ServiceTaskBulkStatusRequestDTO.class);
        verify(serviceTaskCommandService).bulkUpdateStatus(eq(3L), captor.capture());
        assertEquals(List.of(1L, 2L, 3L), captor.getValue().getTaskIds());
    }

    @Test
    public void shouldForwardTaskFilters() throws Exception {
        when(lifecycleQueryService.listTasks(3L, "blocked", "legal")).thenReturn(List.of());

        mockMvc.perform(get("/api/lifecycle/phases/3/tasks").param("status", "blocked").param("category", "legal"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }
}
