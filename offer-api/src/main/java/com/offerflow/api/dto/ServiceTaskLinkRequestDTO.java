package com.offerflow.api.dto;

import lombok.Data;

/**
 * 服务任务关联研发工作项请求 DTO。
 */
@Data
public class ServiceTaskLinkRequestDTO {

    private Long epicId;
    private Long storyId;
}
