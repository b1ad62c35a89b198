package com.offerflow.infrastructure.workitem;

import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.domain.workitem.model.valobj.CatalogProject;
import com.offerflow.domain.workitem.model.valobj.CatalogStory;
import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.infrastructure.dao.WorkItemCatalogDao;
import com.offerflow.infrastructure.dao.po.CatalogProjectPO;
import com.offerflow.infrastructure.dao.po.CatalogStoryPO;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作项目录只读实现，直接读取项目/Epic/Story/Task 表。
 */
@Component
public class WorkItemCatalogImpl implements IWorkItemCatalog {

    private final WorkItemCatalogDao workItemCatalogDao;

    public WorkItemCatalogImpl(WorkItemCatalogDao workItemCatalogDao) {
        this.workItemCatalogDao = workItemCatalogDao;
    }

    @Override
    public CatalogProject findProject(Long projectId) {
        if (projectId == null) {
            return null;
        }
        CatalogProjectPO po = workItemCatalogDao.selectProjectById(projectId);
        if (po == null) {
            return null;
        }
        return CatalogProject.builder()
                .id(po.getId())
                .name(po.getName())
                .description(po.getDescription())
                .prdContent(po.getPrdContent())
                .build();
    }

    @Override
    public Long findOwningProjectId(WorkItemRef ref) {
        if (ref == null) {
            return null;
        }
        return switch (ref.type()) {
            case EPIC -> workItemCatalogDao.selectProjectIdByEpicId(ref.id());
            case STORY -> workItemCatalogDao.selectProjectIdByStoryId(ref.id());
            case TASK -> workItemCatalogDao.selectProjectIdByTaskId(ref.id());
        };
    }

    @Override
    public List<CatalogStory> findStoriesByProject(Long projectId) {
        return workItemCatalogDao.selectStoriesByProjectId(projectId).stream()
                .map(this::toStory)
                .collect(Collectors.toList());
    }

    @Override
    public CatalogStory findStory(Long storyId) {
        CatalogStoryPO po = workItemCatalogDao.selectStoryById(storyId);
        return po == null ? null : toStory(po);
    }

    @Override
    public List<String> findTaskTitlesByStory(Long storyId) {
        return workItemCatalogDao.selectTaskTitlesByStoryId(storyId);
    }

    private CatalogStory toStory(CatalogStoryPO po) {
        return CatalogStory.builder()
                .id(po.getId())
                .epicId(po.getEpicId())
                .epicTitle(po.getEpicTitle())
                .projectId(po.getProjectId())
                .title(po.getTitle())
                .description(po.getDescription())
                .acceptanceCriteria(po.getAcceptanceCriteria())
                .storyPoints(po.getStoryPoints())
                .estimatedHours(po.getEstimatedHours())
                .build();
    }
}
