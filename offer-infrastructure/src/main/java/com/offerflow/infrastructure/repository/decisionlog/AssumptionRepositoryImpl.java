package com.offerflow.infrastructure.repository.decisionlog;

import com.offerflow.domain.decisionlog.adapter.repository.IAssumptionRepository;
import com.offerflow.domain.decisionlog.model.entity.AssumptionEntity;
import com.offerflow.infrastructure.dao.AssumptionDao;
import com.offerflow.infrastructure.dao.po.AssumptionPO;
import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 项目假设仓储实现类
 */
@Repository
public class AssumptionRepositoryImpl implements IAssumptionRepository {

    private final AssumptionDao assumptionDao;

    public AssumptionRepositoryImpl(AssumptionDao assumptionDao) {
        this.assumptionDao = assumptionDao;
    }

    @Override
    public AssumptionEntity save(AssumptionEntity entity) {
        entity.validate();
        AssumptionPO po = toPO(entity);
        assumptionDao.insert(po);
        return toEntity(po);
    }

    @Override
    public AssumptionEntity update(AssumptionEntity entity) {
        entity.validate();
        AssumptionPO po = toPO(entity);
        if (assumptionDao.update(po) == 0) {
            throw new AppException(ResponseCode.NOT_FOUND, "假设不存在: " + entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public boolean deleteById(Long id) {
        return assumptionDao.deleteById(id) > 0;
    }

    @Override
    public AssumptionEntity findById(Long id) {
        return toEntity(assumptionDao.selectById(id));
    }

    @Override
    public List<AssumptionEntity> findByProjectId(Long projectId, AssumptionStatusEnum status,
                                                  AssumptionRiskEnum riskLevel) {
        return assumptionDao.selectByProjectId(projectId, status, riskLevel).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private AssumptionEntity toEntity(AssumptionPO po) {
        if (po == null) {
            return null;
        }
        AssumptionEntity entity = new AssumptionEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setAssumption(po.getAssumption());
        entity.setContext(po.getContext());
        entity.setImpactIfWrong(po.getImpactIfWrong());
        entity.setStatus(po.getStatus());
        entity.setRiskLevel(po.getRiskLevel());
        entity.setValidationMethod(po.getValidationMethod());
        entity.setValidationOwner(po.getValidationOwner());
        entity.setValidationDeadline(po.getValidationDeadline());
        entity.setValidationResult(po.getValidationResult());
        entity.setValidatedAt(po.getValidatedAt());
        entity.setExtractedFrom(po.getExtractedFrom());
        entity.setExtractionConfidence(po.getExtractionConfidence());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private AssumptionPO toPO(AssumptionEntity entity) {
        return AssumptionPO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .assumption(entity.getAssumption())
                .context(entity.getContext())
                .impactIfWrong(entity.getImpactIfWrong())
                .status(entity.getStatus())
                .riskLevel(entity.getRiskLevel())
                .validationMethod(entity.getValidationMethod())
                .validationOwner(entity.getValidationOwner())
                .validationDeadline(entity.getValidationDeadline())
                .validationResult(entity.getValidationResult())
                .validatedAt(entity.getValidatedAt())
                .extractedFrom(entity.getExtractedFrom())
                .extractionConfidence(entity.getExtractionConfidence())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
