package com.offerflow.domain.decisionlog.model.entity;

import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 待验证的项目假设。
 *
 * @author offerflow
 * @since 2026-10-19
 */
@Data
public class AssumptionEntity {

    private Long id;

    private Long projectId;

    /**
     * 假设内容
     */
    private String assumption;

    private String context;

    /**
     * 假设不成立时的影响
     */
    private String impactIfWrong;

    private AssumptionStatusEnum status;

    private AssumptionRiskEnum riskLevel;

    private String validationMethod;

    private String validationOwner;

    private LocalDateTime validationDeadline;

    private String validationResult;

    /**
     * 得出验证结论的时间
     */
    private LocalDateTime validatedAt;

    private String extractedFrom;

    private Double extractionConfidence;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static AssumptionEntity create(Long projectId,
                                          String assumption,
                                          String context,
                                          String impactIfWrong,
                                          AssumptionRiskEnum riskLevel,
                                          String validationMethod,
                                          String validationOwner,
                                          LocalDateTime validationDeadline,
                                          LocalDateTime now) {
        AssumptionEntity entity = new AssumptionEntity();
        entity.setProjectId(projectId);
        entity.setAssumption(assumption);
        entity.setContext(context);
        entity.setImpactIfWrong(impactIfWrong);
        entity.setRiskLevel(riskLevel == null ? AssumptionRiskEnum.MEDIUM : riskLevel);
        entity.setStatus(AssumptionStatusEnum.UNVALIDATED);
        entity.setValidationMethod(validationMethod);
        entity.setValidationOwner(validationOwner);
        entity.setValidationDeadline(validationDeadline);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public void validate() {
        if (projectId == null) {
            throw new IllegalStateException("Project ID cannot be null");
        }
        if (StringUtils.isBlank(assumption)) {
            throw new IllegalStateException("Assumption cannot be blank");
        }
        if (status == null) {
            throw new IllegalStateException("Assumption status cannot be null");
        }
        if (riskLevel == null) {
            throw new IllegalStateException("Assumption risk level cannot be null");
        }
    }

    /**
     * 切换验证状态。切到成立或不成立时记录结论时间，其余状态保留已有时间。
     */
    public void changeStatus(AssumptionStatusEnum newStatus, LocalDateTime now) {
        if (newStatus == null) {
            return;
        }
        this.status = newStatus;
        if (newStatus.isConcluded()) {
            this.validatedAt = now;
        }
        this.updatedAt = now;
    }
}
