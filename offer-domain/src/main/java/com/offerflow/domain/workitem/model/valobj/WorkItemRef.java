package com.offerflow.domain.workitem.model.valobj;

import com.offerflow.types.enums.WorkItemTypeEnum;

import java.util.Objects;

/**
 * 工作项引用：依赖图节点键，仅包含类型与 ID，不持有工作项内容。
 *
 * @param type 工作项类型
 * @param id 工作项 ID
 */
public record WorkItemRef(WorkItemTypeEnum type, Long id) {

    public WorkItemRef {
        Objects.requireNonNull(type, "work item type");
        Objects.requireNonNull(id, "work item id");
    }

    public static WorkItemRef of(WorkItemTypeEnum type, Long id) {
        return new WorkItemRef(type, id);
    }

    public static WorkItemRef story(Long id) {
        return new WorkItemRef(WorkItemTypeEnum.STORY, id);
    }

    @Override
    public String toString() {
        return type.getCode() + ":" + id;
    }
}
