package com.offerflow.infrastructure.dao;

import com.offerflow.infrastructure.dao.po.CatalogProjectPO;
import com.offerflow.infrastructure.dao.po.CatalogStoryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 工作项目录只读 DAO (projects / epics / stories / tasks)
 */
@Mapper
public interface WorkItemCatalogDao {

    CatalogProjectPO selectProjectById(@Param("projectId") Long projectId);

    Long selectProjectIdByEpicId(@Param("epicId") Long epicId);

    Long selectProjectIdByStoryId(@Param("storyId") Long storyId);

    Long selectProjectIdByTaskId(@Param("taskId") Long taskId);

    /**
     * 项目下全部故事，按 epic ID、story ID 升序
     */
    List<CatalogStoryPO> selectStoriesByProjectId(@Param("projectId") Long projectId);

    CatalogStoryPO selectStoryById(@Param("storyId") Long storyId);

    List<String> selectTaskTitlesByStoryId(@Param("storyId") Long storyId);
}
