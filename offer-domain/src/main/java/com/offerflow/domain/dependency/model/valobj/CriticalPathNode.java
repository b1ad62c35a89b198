package com.offerflow.domain.dependency.model.valobj;

import com.offerflow.domain.workitem.model.valobj.WorkItemRef;

/**
 * 关键路径上的节点及其时长（小时）。
 */
public record CriticalPathNode(WorkItemRef item, double duration) {
}
