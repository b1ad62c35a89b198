package com.offerflow.trigger.http;

import com.offerflow.api.dto.BulkUpdateResultDTO;
import com.offerflow.api.dto.ServiceTaskBulkStatusRequestDTO;
import com.offerflow.api.dto.ServiceTaskCreateRequestDTO;
import com.offerflow.api.dto.ServiceTaskDTO;
import com.offerflow.api.dto.ServiceTaskLinkRequestDTO;
import com.offerflow.api.dto.ServiceTaskUpdateRequestDTO;
import com.offerflow.api.response.Response;
import com.offerflow.trigger.application.command.ServiceTaskCommandService;
import com.offerflow.trigger.application.query.LifecycleQueryService;
import com.offerflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 阶段服务任务 API。
 */
@RestController
@RequestMapping("/api/lifecycle")
public class ServiceTaskController {

    private final ServiceTaskCommandService serviceTaskCommandService;
    private final LifecycleQueryService lifecycleQueryService;

    public ServiceTaskController(ServiceTaskCommandService serviceTaskCommandService,
                                 LifecycleQueryService lifecycleQueryService) {
        this.serviceTaskCommandService = serviceTaskCommandService;
        this.lifecycleQueryService = lifecycleQueryService;
    }

    @GetMapping("/phases/{phaseId}/tasks")
    public Response<List<ServiceTaskDTO>> listTasks(@PathVariable("phaseId") Long phaseId,
                                                    @RequestParam(value = "status", required = false) String status,
                                                    @RequestParam(value = "category", required = false) String category) {
        return success(lifecycleQueryService.listTasks(phaseId, status, category));
    }

    @PostMapping("/phases/{phaseId}/tasks")
    public Response<ServiceTaskDTO> createTask(@PathVariable("phaseId") Long phaseId,
                                               @RequestBody ServiceTaskCreateRequestDTO request) {
        return success(serviceTaskCommandService.createTask(phaseId, request));
    }

    @PostMapping("/phases/{phaseId}/tasks/bulk-status")
    public Response<BulkUpdateResultDTO> bulkUpdateStatus(@PathVariable("phaseId") Long phaseId,
                                                          @RequestBody ServiceTaskBulkStatusRequestDTO request) {
        return success(serviceTaskCommandService.bulkUpdateStatus(phaseId, request));
    }

    @GetMapping("/tasks/{taskId}")
    public Response<ServiceTaskDTO> getTask(@PathVariable("taskId") Long taskId) {
        return success(lifecycleQueryService.getTask(taskId));
    }

    @PutMapping("/tasks/{taskId}")
    public Response<ServiceTaskDTO> updateTask(@PathVariable("taskId") Long taskId,
                                               @RequestBody ServiceTaskUpdateRequestDTO request) {
        return success(serviceTaskCommandService.updateTask(taskId, request));
    }

    @DeleteMapping("/tasks/{taskId}")
    public Response<Boolean> deleteTask(@PathVariable("taskId") Long taskId) {
        serviceTaskCommandService.deleteTask(taskId);
        return success(Boolean.TRUE);
    }

    @PostMapping("/tasks/{taskId}/link-dev-work")
    public Response<ServiceTaskDTO> linkDevWork(@PathVariable("taskId") Long taskId,
                                                @RequestBody ServiceTaskLinkRequestDTO request) {
        return success(serviceTaskCommandService.linkDevWork(taskId, request));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
