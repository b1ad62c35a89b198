package com.offerflow.infrastructure.repository.lifecycle;

import com.offerflow.domain.lifecycle.adapter.repository.IServiceTaskRepository;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.model.valobj.PhaseTaskStat;
import com.offerflow.infrastructure.dao.ServiceTaskDao;
import com.offerflow.infrastructure.dao.po.PhaseTaskStatPO;
import com.offerflow.infrastructure.dao.po.ServiceTaskPO;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.enums.ServiceTaskStatusEnum;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 服务任务仓储实现类。
 */
@Repository
public class ServiceTaskRepositoryImpl implements IServiceTaskRepository {

    private final ServiceTaskDao serviceTaskDao;

    public ServiceTaskRepositoryImpl(ServiceTaskDao serviceTaskDao) {
        this.serviceTaskDao = serviceTaskDao;
    }

    @Override
    public ServiceTaskEntity save(ServiceTaskEntity entity) {
        entity.validate();
        ServiceTaskPO po = toPO(entity);
        serviceTaskDao.insert(po);
        return toEntity(po);
    }

    @Override
    public ServiceTaskEntity update(ServiceTaskEntity entity) {
        entity.validate();
        ServiceTaskPO po = toPO(entity);
        if (serviceTaskDao.update(po) == 0) {
            throw new AppException(ResponseCode.NOT_FOUND, "服务任务不存在: " + entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public boolean deleteById(Long id) {
        return serviceTaskDao.deleteById(id) > 0;
    }

    @Override
    public ServiceTaskEntity findById(Long id) {
        return toEntity(serviceTaskDao.selectById(id));
    }

    @Override
    public List<ServiceTaskEntity> findByPhaseId(Long phaseId, ServiceTaskStatusEnum status, String category) {
        return serviceTaskDao.selectByPhaseId(phaseId, status, category).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public int maxOrderByPhaseId(Long phaseId) {
        Integer max = serviceTaskDao.selectMaxOrderByPhaseId(phaseId);
        return max == null ? -1 : max;
    }

    @Override
    public int deleteByPhaseIds(Collection<Long> phaseIds) {
        if (phaseIds == null || phaseIds.isEmpty()) {
            return 0;
        }
        return serviceTaskDao.deleteByPhaseIds(phaseIds);
    }

    @Override
    public List<PhaseTaskStat> summarizeByPhaseIds(Collection<Long> phaseIds) {
        if (phaseIds == null || phaseIds.isEmpty()) {
            return Collections.emptyList();
        }
        return serviceTaskDao.selectStatsByPhaseIds(phaseIds).stream()
                .map(this::toStat)
                .collect(Collectors.toList());
    }

    private PhaseTaskStat toStat(PhaseTaskStatPO po) {
        return PhaseTaskStat.builder()
                .phaseId(po.getPhaseId())
                .total(po.getTotal())
                .completedCount(po.getCompletedCount())
                .build();
    }

    private ServiceTaskEntity toEntity(ServiceTaskPO po) {
        if (po == null) {
            return null;
        }
        ServiceTaskEntity entity = new ServiceTaskEntity();
        entity.setId(po.getId());
        entity.setPhaseId(po.getPhaseId());
        entity.setTitle(po.getTitle());
        entity.setDescription(po.getDescription());
        entity.setDefinition(po.getDefinition());
        entity.setCategory(po.getCategory());
        entity.setSubcategory(po.getSubcategory());
        entity.setStatus(po.getStatus());
        entity.setSource(po.getSource());
        entity.setTargetStartDate(po.getTargetStartDate());
        entity.setTargetCompleteDate(po.getTargetCompleteDate());
        entity.setDaysRequired(po.getDaysRequired());
        entity.setActualStartDate(po.getActualStartDate());
        entity.setActualCompleteDate(po.getActualCompleteDate());
        entity.setOwner(po.getOwner());
        entity.setTeam(po.getTeam());
        entity.setLinkedEpicId(po.getLinkedEpicId());
        entity.setLinkedStoryId(po.getLinkedStoryId());
        entity.setTaskOrder(po.getTaskOrder());
        entity.setRequired(po.getIsRequired());
        entity.setAiConfidence(po.getAiConfidence());
        entity.setAiReasoning(po.getAiReasoning());
        entity.setNotes(po.getNotes());
        entity.setCompletionNotes(po.getCompletionNotes());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ServiceTaskPO toPO(ServiceTaskEntity entity) {
        return ServiceTaskPO.builder()
                .id(entity.getId())
                .phaseId(entity.getPhaseId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .definition(entity.getDefinition())
                .category(entity.getCategory())
                .subcategory(entity.getSubcategory())
                .status(entity.getStatus())
                .source(entity.getSource())
                .targetStartDate(entity.getTargetStartDate())
                .targetCompleteDate(entity.getTargetCompleteDate())
                .daysRequired(entity.getDaysRequired())
                .actualStartDate(entity.getActualStartDate())
                .actualCompleteDate(entity.getActualCompleteDate())
                .owner(entity.getOwner())
                .team(entity.getTeam())
                .linkedEpicId(entity.getLinkedEpicId())
                .linkedStoryId(entity.getLinkedStoryId())
                .taskOrder(entity.getTaskOrder())
                .isRequired(entity.getRequired())
                .aiConfidence(entity.getAiConfidence())
                .aiReasoning(entity.getAiReasoning())
                .notes(entity.getNotes())
                .completionNotes(entity.getCompletionNotes())
                .completedAt(entity.getCompletedAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
