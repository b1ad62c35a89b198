package com.offerflow.domain.dependency.model.valobj;

import java.util.Collections;
import java.util.List;

/**
 * 关键路径计算结果。
 *
 * @param items 路径上的节点，按依赖方向排列
 * @param totalDuration 节点时长之和
 * @param cyclic 活动依赖中是否存在环
 */
public record CriticalPathResult(List<CriticalPathNode> items, double totalDuration, boolean cyclic) {

    public CriticalPathResult {
        items = items == null ? Collections.emptyList() : List.copyOf(items);
    }

    public static CriticalPathResult empty() {
        return new CriticalPathResult(Collections.emptyList(), 0D, false);
    }
}
