package com.offerflow.domain.estimation.service;

import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;
import com.offerflow.domain.estimation.model.valobj.BacklogRankItem;
import com.offerflow.domain.workitem.model.valobj.CatalogStory;
import com.offerflow.types.enums.PrioritizationModelEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 待办排序领域服务：按模型分数降序，null 视为 0，同分保持目录顺序（稳定排序）。
 */
@Service
public class BacklogRankingDomainService {

    public List<BacklogRankItem> rank(List<CatalogStory> stories,
                                      Map<Long, StoryEstimateEntity> estimatesByStory,
                                      PrioritizationModelEnum model) {
        if (stories == null || stories.isEmpty()) {
            return Collections.emptyList();
        }
        PrioritizationModelEnum effectiveModel = model == null ? PrioritizationModelEnum.RICE : model;
        List<BacklogRankItem> items = new ArrayList<>(stories.size());
        for (CatalogStory story : stories) {
            StoryEstimateEntity estimate = estimatesByStory == null ? null : estimatesByStory.get(story.getId());
            items.add(BacklogRankItem.builder()
                    .storyId(story.getId())
                    .epicId(story.getEpicId())
                    .title(story.getTitle())
                    .storyPoints(story.getStoryPoints())
                    .estimatedHours(story.getEstimatedHours())
                    .score(estimate == null ? null : estimate.scoreOf(effectiveModel))
                    .riceScore(estimate == null ? null : estimate.getRiceScore())
                    .wsjfScore(estimate == null ? null : estimate.getWsjfScore())
                    .estimateP50(estimate == null ? null : estimate.getEstimateP50())
                    .pertExpectedHours(estimate == null ? null : estimate.pertExpectedHours())
                    .build());
        }
        // List.sort 为稳定排序
        items.sort(Comparator.comparingDouble(BacklogRankingDomainService::sortKey).reversed());
        return items;
    }

    private static double sortKey(BacklogRankItem item) {
        return item.getScore() == null ? 0D : item.getScore();
    }
}
