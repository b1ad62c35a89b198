package com.offerflow.trigger.application.command;

import com.offerflow.api.dto.CostOfDelayRequestDTO;
import com.offerflow.api.dto.RangeEstimateRequestDTO;
import com.offerflow.api.dto.RiceInputRequestDTO;
import com.offerflow.api.dto.StoryEstimateDTO;
import com.offerflow.api.dto.WsjfInputRequestDTO;
import com.offerflow.domain.ai.service.ToolCallingDomainService;
import com.offerflow.domain.estimation.adapter.repository.IStoryEstimateRepository;
import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.domain.workitem.model.valobj.CatalogStory;
import com.offerflow.trigger.application.common.PlanningViewAssembler;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 故事估算写用例。每个故事至多一条估算，首次写入时创建。
 */
@Slf4j
@Service
public class EstimationCommandService {

    private final IStoryEstimateRepository storyEstimateRepository;
    private final IWorkItemCatalog workItemCatalog;
    private final PlanningViewAssembler planningViewAssembler;
    private final Clock clock;

    public EstimationCommandService(IStoryEstimateRepository storyEstimateRepository,
                                    IWorkItemCatalog workItemCatalog,
                                    PlanningViewAssembler planningViewAssembler,
                                    Clock clock) {
        this.storyEstimateRepository = storyEstimateRepository;
        this.workItemCatalog = workItemCatalog;
        this.planningViewAssembler = planningViewAssembler;
        this.clock = clock;
    }

    @Transactional(rollbackFor = Exception.class)
    public StoryEstimateDTO setRiceInputs(Long storyId, RiceInputRequestDTO request) {
        requireBody(request);
        requireStory(storyId);
        LocalDateTime now = LocalDateTime.now(clock);
        StoryEstimateEntity estimate = loadOrCreate(storyId, now);
        estimate.applyRiceInputs(request.getReach(), request.getImpact(), request.getConfidence(), request.getEffort(), now);
        StoryEstimateEntity saved = persist(estimate);
        log.info("RICE inputs saved. storyId={}, riceScore={}", storyId, saved.getRiceScore());
        return planningViewAssembler.toEstimateDTO(saved);
    }

    @Transactional(rollbackFor = Exception.class)
    public StoryEstimateDTO setWsjfInputs(Long storyId, WsjfInputRequestDTO request) {
        requireBody(request);
        requireStory(storyId);
        LocalDateTime now = LocalDateTime.now(clock);
        StoryEstimateEntity estimate = loadOrCreate(storyId, now);
        estimate.applyWsjfInputs(request.getBusinessValue(), request.getTimeCriticality(),
                request.getRiskReduction(), request.getJobSize(), now);
        StoryEstimateEntity saved = persist(estimate);
        log.info("WSJF inputs saved. storyId={}, wsjfScore={}", storyId, saved.getWsjfScore());
        return planningViewAssembler.toEstimateDTO(saved);
    }

    @Transactional(rollbackFor = Exception.class)
    public StoryEstimateDTO setCostOfDelay(Long storyId, CostOfDelayRequestDTO request) {
        requireBody(request);
        requireStory(storyId);
        LocalDateTime now = LocalDateTime.now(clock);
        StoryEstimateEntity estimate = loadOrCreate(storyId, now);
        estimate.applyCostOfDelay(request.getWeekly(), request.getUrgencyProfile(), now);
        return planningViewAssembler.toEstimateDTO(persist(estimate));
    }

    @Transactional(rollbackFor = Exception.class)
    public StoryEstimateDTO setRangeEstimate(Long storyId, RangeEstimateRequestDTO request) {
        requireBody(request);
        requireStory(storyId);
        LocalDateTime now = LocalDateTime.now(clock);
        StoryEstimateEntity estimate = loadOrCreate(storyId, now);
        estimate.applyRange(request.getP10(), request.getP50(), request.getP90(), now);
        StoryEstimateEntity saved = persist(estimate);
        log.info("Range estimate saved. storyId={}, p10={}, p50={}, p90={}",
                storyId, saved.getEstimateP10(), saved.getEstimateP50(), saved.getEstimateP90());
        return planningViewAssembler.toEstimateDTO(saved);
    }

    /**
     * 调用模型生成三点估算。模型值单独保存，人工估算为空的点在补齐后仍有序时才被填充。
     */
    @Transactional(rollbackFor = Exception.class)
    public StoryEstimateDTO applyAiEstimate(Long storyId, Map<String, Object> arguments) {
        requireStory(storyId);
        if (arguments == null) {
            throw new AppException(ResponseCode.UPSTREAM_FAILURE, "模型未返回估算结果: storyId=" + storyId);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        StoryEstimateEntity estimate = loadOrCreate(storyId, now);
        boolean filled = estimate.applyAiEstimate(
                ToolCallingDomainService.getDouble(arguments, "p10_hours"),
                ToolCallingDomainService.getDouble(arguments, "p50_hours"),
                ToolCallingDomainService.getDouble(arguments, "p90_hours"),
                ToolCallingDomainService.getDouble(arguments, "confidence"),
                ToolCallingDomainService.getString(arguments, "reasoning"),
                now);
        StoryEstimateEntity saved = persist(estimate);
        log.info("AI range estimate saved. storyId={}, filledManual={}", storyId, filled);
        return planningViewAssembler.toEstimateDTO(saved);
    }

    private StoryEstimateEntity loadOrCreate(Long storyId, LocalDateTime now) {
        StoryEstimateEntity estimate = storyEstimateRepository.findByStoryId(storyId);
        return estimate == null ? StoryEstimateEntity.create(storyId, now) : estimate;
    }

    private StoryEstimateEntity persist(StoryEstimateEntity estimate) {
        if (estimate.getId() == null) {
            return storyEstimateRepository.save(estimate);
        }
        return storyEstimateRepository.update(estimate);
    }

    private CatalogStory requireStory(Long storyId) {
        CatalogStory story = storyId == null ? null : workItemCatalog.findStory(storyId);
        if (story == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "故事不存在: " + storyId);
        }
        return story;
    }

    private void requireBody(Object request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
    }
}
