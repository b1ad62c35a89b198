package com.offerflow.domain.workitem.adapter.gateway;

import com.offerflow.domain.workitem.model.valobj.CatalogProject;
import com.offerflow.domain.workitem.model.valobj.CatalogStory;
import com.offerflow.domain.workitem.model.valobj.WorkItemRef;

import java.util.List;

/**
 * 工作项目录端口：项目、Epic、Story、Task 由外部系统维护，本服务只读。
 */
public interface IWorkItemCatalog {

    /**
     * 查询项目。
     *
     * @param projectId 项目 ID
     * @return 项目快照，不存在时返回 null
     */
    CatalogProject findProject(Long projectId);

    /**
     * 解析工作项所属项目。
     *
     * @param ref 工作项引用
     * @return 所属项目 ID，工作项不存在时返回 null
     */
    Long findOwningProjectId(WorkItemRef ref);

    /**
     * 按 Epic、Story 的目录顺序列出项目下全部故事。
     */
    List<CatalogStory> findStoriesByProject(Long projectId);

    /**
     * 查询单个故事，不存在时返回 null。
     */
    CatalogStory findStory(Long storyId);

    /**
     * 列出故事下开发任务的标题，按 ID 升序。
     */
    List<String> findTaskTitlesByStory(Long storyId);

    default boolean projectExists(Long projectId) {
        return projectId != null && findProject(projectId) != null;
    }
}
