package com.offerflow.domain.lifecycle.model.valobj;

import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 模型生成的生命周期计划，尚未持久化。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedLifecyclePlan {

    private List<PhasePlan> phases;

    private String offerType;

    private String complexityAssessment;

    private Integer totalEstimatedDays;

    private List<String> keyRisks;

    /**
     * 阶段及其任务；任务的 phaseId 在阶段落库后回填
     */
    public record PhasePlan(LifecyclePhaseEntity phase, List<ServiceTaskEntity> tasks) {
    }
}
