package com.offerflow.infrastructure.repository.decisionlog;

import com.offerflow.domain.decisionlog.adapter.repository.IDecisionRepository;
import com.offerflow.domain.decisionlog.model.entity.DecisionEntity;
import com.offerflow.infrastructure.dao.DecisionDao;
import com.offerflow.infrastructure.dao.po.DecisionPO;
import com.offerflow.infrastructure.util.JsonCodec;
import com.offerflow.types.enums.DecisionStatusEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 决策记录仓储实现类。备选方案以 JSON 数组文本落库。
 */
@Repository
public class DecisionRepositoryImpl implements IDecisionRepository {

    private final DecisionDao decisionDao;
    private final JsonCodec jsonCodec;

    public DecisionRepositoryImpl(DecisionDao decisionDao, JsonCodec jsonCodec) {
        this.decisionDao = decisionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public DecisionEntity save(DecisionEntity entity) {
        entity.validate();
        DecisionPO po = toPO(entity);
        decisionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public DecisionEntity update(DecisionEntity entity) {
        entity.validate();
        if (decisionDao.update(toPO(entity)) == 0) {
            throw new AppException(ResponseCode.NOT_FOUND, "决策不存在: " + entity.getId());
        }
        return entity;
    }

    @Override
    public boolean deleteById(Long id) {
        return decisionDao.deleteById(id) > 0;
    }

    @Override
    public DecisionEntity findById(Long id) {
        return toEntity(decisionDao.selectById(id));
    }

    @Override
    public List<DecisionEntity> findByProjectId(Long projectId, DecisionStatusEnum status) {
        return decisionDao.selectByProjectId(projectId, status).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private DecisionEntity toEntity(DecisionPO po) {
        if (po == null) {
            return null;
        }
        DecisionEntity entity = new DecisionEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setTitle(po.getTitle());
        entity.setContext(po.getContext());
        entity.setDecision(po.getDecision());
        entity.setRationale(po.getRationale());
        entity.setAlternatives(jsonCodec.readStringList(po.getAlternatives()));
        entity.setConsequences(po.getConsequences());
        entity.setStatus(po.getStatus());
        entity.setDecisionMaker(po.getDecisionMaker());
        entity.setDecisionDate(po.getDecisionDate());
        entity.setExtractedFrom(po.getExtractedFrom());
        entity.setExtractionConfidence(po.getExtractionConfidence());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private DecisionPO toPO(DecisionEntity entity) {
        return DecisionPO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .title(entity.getTitle())
                .context(entity.getContext())
                .decision(entity.getDecision())
                .rationale(entity.getRationale())
                .alternatives(jsonCodec.writeValue(entity.getAlternatives()))
                .consequences(entity.getConsequences())
                .status(entity.getStatus())
                .decisionMaker(entity.getDecisionMaker())
                .decisionDate(entity.getDecisionDate())
                .extractedFrom(entity.getExtractedFrom())
                .extractionConfidence(entity.getExtractionConfidence())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
