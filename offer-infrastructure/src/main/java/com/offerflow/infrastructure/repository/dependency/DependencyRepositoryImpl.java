package com.offerflow.infrastructure.repository.dependency;

import com.offerflow.domain.dependency.adapter.repository.IDependencyRepository;
import com.offerflow.domain.dependency.model.entity.DependencyEntity;
import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.infrastructure.dao.DependencyDao;
import com.offerflow.infrastructure.dao.po.DependencyPO;
import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.DependencyTypeEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作项依赖仓储实现类。
 * <p>
 * 依赖边只允许修改状态与备注，其余字段写入后不变。
 * </p>
 */
@Repository
public class DependencyRepositoryImpl implements IDependencyRepository {

    private final DependencyDao dependencyDao;

    public DependencyRepositoryImpl(DependencyDao dependencyDao) {
        this.dependencyDao = dependencyDao;
    }

    @Override
    public DependencyEntity save(DependencyEntity entity) {
        entity.validate();
        DependencyPO po = toPO(entity);
        dependencyDao.insert(po);
        return toEntity(po);
    }

    @Override
    public DependencyEntity update(DependencyEntity entity) {
        entity.validate();
        DependencyPO po = toPO(entity);
        int affected = dependencyDao.updateStatus(po);
        if (affected == 0) {
            throw new AppException(ResponseCode.NOT_FOUND, "依赖不存在: " + entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public boolean deleteById(Long id) {
        return dependencyDao.deleteById(id) > 0;
    }

    @Override
    public DependencyEntity findById(Long id) {
        return toEntity(dependencyDao.selectById(id));
    }

    @Override
    public List<DependencyEntity> findByProjectId(Long projectId) {
        return findByProjectIdAndStatus(projectId, null);
    }

    @Override
    public List<DependencyEntity> findByProjectIdAndStatus(Long projectId, DependencyStatusEnum status) {
        return dependencyDao.selectByProjectId(projectId, status).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean existsEdge(Long projectId, WorkItemRef source, WorkItemRef target, DependencyTypeEnum dependencyType) {
        return dependencyDao.countEdge(projectId, source.type(), source.id(), target.type(), target.id(),
                dependencyType) > 0;
    }

    private DependencyEntity toEntity(DependencyPO po) {
        if (po == null) {
            return null;
        }
        DependencyEntity entity = new DependencyEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setSourceType(po.getSourceType());
        entity.setSourceId(po.getSourceId());
        entity.setTargetType(po.getTargetType());
        entity.setTargetId(po.getTargetId());
        entity.setDependencyType(po.getDependencyType());
        entity.setStatus(po.getStatus());
        entity.setInferred(po.getIsInferred());
        entity.setConfidence(po.getConfidence());
        entity.setInferenceReason(po.getInferenceReason());
        entity.setNotes(po.getNotes());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private DependencyPO toPO(DependencyEntity entity) {
        return DependencyPO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .sourceType(entity.getSourceType())
                .sourceId(entity.getSourceId())
                .targetType(entity.getTargetType())
                .targetId(entity.getTargetId())
                .dependencyType(entity.getDependencyType())
                .status(entity.getStatus())
                .isInferred(entity.getInferred())
                .confidence(entity.getConfidence())
                .inferenceReason(entity.getInferenceReason())
                .notes(entity.getNotes())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
