package com.offerflow.domain.dependency.service;

import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.types.common.Constants;
import com.offerflow.types.enums.WorkItemTypeEnum;

import java.util.Collections;
import java.util.Map;

/**
 * 故事时长解析：优先 P50 估算，其次故事粗估工时，最后默认 8 小时；Epic 与 Task 固定默认值。
 */
public class StoryDurationResolver implements NodeDurationResolver {

    private final Map<Long, Double> p50ByStory;
    private final Map<Long, Double> estimatedHoursByStory;
    private final double defaultDuration;

    public StoryDurationResolver(Map<Long, Double> p50ByStory, Map<Long, Double> estimatedHoursByStory) {
        this(p50ByStory, estimatedHoursByStory, Constants.DEFAULT_NODE_DURATION_HOURS);
    }

    public StoryDurationResolver(Map<Long, Double> p50ByStory,
                                 Map<Long, Double> estimatedHoursByStory,
                                 double defaultDuration) {
        this.p50ByStory = p50ByStory == null ? Collections.emptyMap() : p50ByStory;
        this.estimatedHoursByStory = estimatedHoursByStory == null ? Collections.emptyMap() : estimatedHoursByStory;
        this.defaultDuration = defaultDuration;
    }

    @Override
    public double durationOf(WorkItemRef item) {
        if (item == null || item.type() != WorkItemTypeEnum.STORY) {
            return defaultDuration;
        }
        Double p50 = p50ByStory.get(item.id());
        if (p50 != null) {
            return p50;
        }
        Double estimatedHours = estimatedHoursByStory.get(item.id());
        if (estimatedHours != null) {
            return estimatedHours;
        }
        return defaultDuration;
    }
}
