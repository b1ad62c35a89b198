package com.offerflow.domain.dependency.service;

import com.offerflow.domain.workitem.model.valobj.WorkItemRef;

/**
 * 关键路径节点时长解析，图本身不关心节点是什么。
 */
@FunctionalInterface
public interface NodeDurationResolver {

    double durationOf(WorkItemRef item);
}
