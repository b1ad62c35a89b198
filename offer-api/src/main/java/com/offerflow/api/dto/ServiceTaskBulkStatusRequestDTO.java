package com.offerflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 批量更新服务任务状态请求 DTO。
 */
@Data
public class ServiceTaskBulkStatusRequestDTO {

    private List<Long> taskIds;
    private String status;
}
