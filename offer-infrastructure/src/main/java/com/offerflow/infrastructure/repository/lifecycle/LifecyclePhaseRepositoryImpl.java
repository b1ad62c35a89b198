package com.offerflow.infrastructure.repository.lifecycle;

import com.offerflow.domain.lifecycle.adapter.repository.ILifecyclePhaseRepository;
import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.infrastructure.dao.LifecyclePhaseDao;
import com.offerflow.infrastructure.dao.po.LifecyclePhasePO;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 生命周期阶段仓储实现类。
 * <p>
 * 更新走版本号 CAS：{@code UPDATE ... WHERE id = ? AND version = ?}，
 * 影响行数为 0 时抛出 {@link ResponseCode#CONCURRENT_MODIFICATION}。
 * </p>
 */
@Slf4j
@Repository
public class LifecyclePhaseRepositoryImpl implements ILifecyclePhaseRepository {

    private final LifecyclePhaseDao lifecyclePhaseDao;

    public LifecyclePhaseRepositoryImpl(LifecyclePhaseDao lifecyclePhaseDao) {
        this.lifecyclePhaseDao = lifecyclePhaseDao;
    }

    @Override
    public LifecyclePhaseEntity save(LifecyclePhaseEntity entity) {
        entity.validate();
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        LifecyclePhasePO po = toPO(entity);
        lifecyclePhaseDao.insert(po);
        return toEntity(po);
    }

    @Override
    public LifecyclePhaseEntity update(LifecyclePhaseEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for LifecyclePhase update: " + entity.getId());
        }
        LifecyclePhasePO po = toPO(entity);
        int affected = lifecyclePhaseDao.updateWithVersion(po);
        if (affected == 0) {
            log.warn("Optimistic lock failed for lifecycle phase. phaseId={}, expectedVersion={}",
                    entity.getId(), oldVersion);
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION,
                    "阶段已被并发修改: " + entity.getId());
        }
        Integer newVersion = oldVersion + 1;
        entity.setVersion(newVersion);
        po.setVersion(newVersion);
        return toEntity(po);
    }

    @Override
    public LifecyclePhaseEntity findById(Long id) {
        return toEntity(lifecyclePhaseDao.selectById(id));
    }

    @Override
    public List<LifecyclePhaseEntity> findByProjectId(Long projectId) {
        return lifecyclePhaseDao.selectByProjectId(projectId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByProjectId(Long projectId) {
        return lifecyclePhaseDao.deleteByProjectId(projectId);
    }

    private LifecyclePhaseEntity toEntity(LifecyclePhasePO po) {
        if (po == null) {
            return null;
        }
        LifecyclePhaseEntity entity = new LifecyclePhaseEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setPhase(po.getPhase());
        entity.setStatus(po.getStatus());
        entity.setPhaseOrder(po.getPhaseOrder());
        entity.setApprovalRequired(po.getApprovalRequired());
        entity.setApprovedBy(po.getApprovedBy());
        entity.setApprovedAt(po.getApprovedAt());
        entity.setApprovalNotes(po.getApprovalNotes());
        entity.setSequenceOverridden(po.getSequenceOverridden());
        entity.setOverrideReason(po.getOverrideReason());
        entity.setOverriddenBy(po.getOverriddenBy());
        entity.setOverriddenAt(po.getOverriddenAt());
        entity.setTargetStartDate(po.getTargetStartDate());
        entity.setTargetEndDate(po.getTargetEndDate());
        entity.setActualStartDate(po.getActualStartDate());
        entity.setActualEndDate(po.getActualEndDate());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private LifecyclePhasePO toPO(LifecyclePhaseEntity entity) {
        return LifecyclePhasePO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .phase(entity.getPhase())
                .status(entity.getStatus())
                .phaseOrder(entity.getPhaseOrder())
                .approvalRequired(entity.getApprovalRequired())
                .approvedBy(entity.getApprovedBy())
                .approvedAt(entity.getApprovedAt())
                .approvalNotes(entity.getApprovalNotes())
                .sequenceOverridden(entity.getSequenceOverridden())
                .overrideReason(entity.getOverrideReason())
                .overriddenBy(entity.getOverriddenBy())
                .overriddenAt(entity.getOverriddenAt())
                .targetStartDate(entity.getTargetStartDate())
                .targetEndDate(entity.getTargetEndDate())
                .actualStartDate(entity.getActualStartDate())
                .actualEndDate(entity.getActualEndDate())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
