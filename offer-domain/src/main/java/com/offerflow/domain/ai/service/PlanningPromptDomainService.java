package com.offerflow.domain.ai.service;

import com.offerflow.domain.ai.model.valobj.ChatTurn;
import com.offerflow.domain.ai.model.valobj.ToolSpecification;
import com.offerflow.domain.workitem.model.valobj.CatalogProject;
import com.offerflow.domain.workitem.model.valobj.CatalogStory;
import com.offerflow.types.enums.DependencyTypeEnum;
import com.offerflow.types.enums.LifecyclePhaseEnum;
import com.offerflow.types.enums.WorkItemTypeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 规划类模型提示词与工具声明构建。
 */
@Service
public class PlanningPromptDomainService {

    public static final String TOOL_RECORD_DEPENDENCIES = "record_dependencies";
    public static final String TOOL_PROVIDE_ESTIMATES = "provide_estimates";
    public static final String TOOL_GENERATE_LIFECYCLE = "generate_offer_lifecycle_tasks";

    private static final List<String> SERVICE_TASK_CATEGORIES = List.of(
            "Legal & Compliance",
            "Finance & Pricing",
            "Marketing & Communications",
            "Sales Enablement",
            "Product Management",
            "Engineering & Technical",
            "Operations & Support",
            "Partner & Ecosystem",
            "Training & Documentation",
            "Quality & Certification");

    private static final List<String> WORK_ITEM_TYPES = Arrays.stream(WorkItemTypeEnum.values())
            .map(WorkItemTypeEnum::getCode)
            .collect(Collectors.toList());
    private static final List<String> DEPENDENCY_TYPES = Arrays.stream(DependencyTypeEnum.values())
            .map(DependencyTypeEnum::getCode)
            .collect(Collectors.toList());
    private static final List<String> PHASES = Arrays.stream(LifecyclePhaseEnum.values())
            .map(LifecyclePhaseEnum::getCode)
            .collect(Collectors.toList());

    public List<ChatTurn> buildDependencyInferenceMessages(List<CatalogStory> stories) {
        StringBuilder system = new StringBuilder();
        system.append("你是技术项目经理，负责识别工作项之间的依赖关系。");
        system.append("依据：1) 技术依赖（共享 API、数据库、服务）；2) 逻辑先后；3) 数据流；4) 同一团队的顺序工作。");
        system.append("只记录明确、高置信度的依赖。");

        StringBuilder user = new StringBuilder();
        user.append("分析以下工作项并识别依赖关系：\n");
        for (CatalogStory story : stories) {
            user.append("- type=story, id=").append(story.getId())
                    .append(", epicId=").append(story.getEpicId())
                    .append(", title=").append(StringUtils.defaultString(story.getTitle()));
            if (StringUtils.isNotBlank(story.getDescription())) {
                user.append(", description=").append(story.getDescription());
            }
            if (StringUtils.isNotBlank(story.getAcceptanceCriteria())) {
                user.append(", acceptanceCriteria=").append(story.getAcceptanceCriteria());
            }
            user.append('\n');
        }
        user.append("每条依赖给出：源工作项（依赖方）、目标工作项（被依赖方）、类型 blocks/depends_on/related、置信度 0-1、理由。");
        return List.of(ChatTurn.system(system.toString()), ChatTurn.user(user.toString()));
    }

    public ToolSpecification dependencyInferenceTool() {
        Map<String, Object> item = objectSchema(
                required("source_type", "source_id", "target_type", "target_id", "dependency_type", "confidence", "reasoning"),
                property("source_type", enumSchema(WORK_ITEM_TYPES)),
                property("source_id", typeSchema("integer", null)),
                property("target_type", enumSchema(WORK_ITEM_TYPES)),
                property("target_id", typeSchema("integer", null)),
                property("dependency_type", enumSchema(DEPENDENCY_TYPES)),
                property("confidence", typeSchema("number", null)),
                property("reasoning", typeSchema("string", null)));
        Map<String, Object> parameters = objectSchema(
                required("dependencies"),
                property("dependencies", arraySchema(item, null)));
        return new ToolSpecification(TOOL_RECORD_DEPENDENCIES, "Record inferred dependencies between work items", parameters);
    }

    public List<ChatTurn> buildRangeEstimateMessages(CatalogStory story, List<String> taskTitles) {
        String system = "你是资深工程经理，负责给出三点工时估算。"
                + "P10（乐观）：一切顺利，仅 10% 概率能这么快完成；"
                + "P50（最可能）：常规条件下的现实估算；"
                + "P90（悲观）：计入意外复杂度，90% 把握不会更久。"
                + "请综合技术复杂度、未知风险、外部依赖、测试与评审时间。";
        StringBuilder user = new StringBuilder();
        user.append("估算以下故事：\n");
        user.append("标题：").append(StringUtils.defaultString(story.getTitle())).append('\n');
        user.append("描述：").append(StringUtils.defaultString(story.getDescription(), "N/A")).append('\n');
        user.append("验收标准：").append(StringUtils.defaultString(story.getAcceptanceCriteria(), "N/A")).append('\n');
        user.append("所属 Epic：").append(StringUtils.defaultString(story.getEpicTitle(), "N/A")).append('\n');
        if (taskTitles == null || taskTitles.isEmpty()) {
            user.append("开发任务：无\n");
        } else {
            user.append("开发任务：").append(String.join("; ", taskTitles)).append('\n');
        }
        user.append("当前粗估：").append(story.getEstimatedHours() == null ? "N/A" : story.getEstimatedHours()).append(" 小时\n");
        user.append("请以小时为单位给出 P10/P50/P90。");
        return List.of(ChatTurn.system(system), ChatTurn.user(user.toString()));
    }

    public ToolSpecification rangeEstimateTool() {
        Map<String, Object> parameters = objectSchema(
                required("p10_hours", "p50_hours", "p90_hours", "confidence", "reasoning"),
                property("p10_hours", typeSchema("number", "Optimistic estimate (10th percentile)")),
                property("p50_hours", typeSchema("number", "Most likely estimate (50th percentile)")),
                property("p90_hours", typeSchema("number", "Pessimistic estimate (90th percentile)")),
                property("confidence", typeSchema("number", "Overall confidence in estimates (0-1)")),
                property("reasoning", typeSchema("string", "Explanation of estimation rationale")));
        return new ToolSpecification(TOOL_PROVIDE_ESTIMATES, "Provide three-point range estimates for the story", parameters);
    }

    public List<ChatTurn> buildLifecycleMessages(CatalogProject project) {
        StringBuilder system = new StringBuilder();
        system.append("你是服务类产品经理，擅长产品上市生命周期管理。");
        system.append("请根据 PRD 生成映射到六个顺序阶段的服务类任务清单：");
        for (LifecyclePhaseEnum phase : LifecyclePhaseEnum.values()) {
            system.append(phase.getOrder()).append('.').append(phase.getCode()).append(' ');
        }
        system.append("。每个任务给出 days_required（通常 1-15 天），同一阶段内任务可并行，");
        system.append("阶段时长取最长并行链而非任务工期之和。");
        system.append("类别覆盖：").append(String.join("、", SERVICE_TASK_CATEGORIES)).append("。");
        system.append("使用 ").append(TOOL_GENERATE_LIFECYCLE).append(" 工具返回结构化结果。");

        StringBuilder user = new StringBuilder();
        user.append("项目：").append(StringUtils.defaultString(project.getName())).append('\n');
        user.append("描述：").append(StringUtils.defaultString(project.getDescription(), "N/A")).append('\n');
        user.append("PRD：\n").append(StringUtils.defaultString(project.getPrdContent(), "N/A")).append('\n');
        user.append("请生成覆盖六个阶段的服务任务清单。");
        return List.of(ChatTurn.system(system.toString()), ChatTurn.user(user.toString()));
    }

    public ToolSpecification lifecycleTool() {
        Map<String, Object> task = objectSchema(
                required("title", "definition", "category", "days_required", "is_required"),
                property("title", typeSchema("string", "Task title")),
                property("definition", typeSchema("string", "Detailed definition of what this task entails")),
                property("category", enumSchema(SERVICE_TASK_CATEGORIES)),
                property("subcategory", typeSchema("string", "More specific subcategory")),
                property("days_required", typeSchema("integer", "Estimated days to complete this task")),
                property("owner_team", typeSchema("string", "Suggested team to own this task")),
                property("is_required", typeSchema("boolean", "Whether this task is required or optional")),
                property("confidence", typeSchema("number", "Confidence that this task is relevant (0-1)")),
                property("reasoning", typeSchema("string", "Why this task was included")));
        Map<String, Object> phase = objectSchema(
                required("phase", "tasks"),
                property("phase", enumSchema(PHASES)),
                property("target_duration_days", typeSchema("integer", "Recommended duration for this phase in days")),
                property("tasks", arraySchema(task, "Service tasks for this phase")));
        Map<String, Object> parameters = objectSchema(
                required("phases", "offer_type", "complexity_assessment", "total_estimated_days"),
                property("phases", arraySchema(phase, "List of lifecycle phases with their tasks")),
                property("offer_type", typeSchema("string", "Inferred type of offer")),
                property("complexity_assessment", enumSchema(List.of("low", "medium", "high", "very_high"))),
                property("total_estimated_days", typeSchema("integer", "Total estimated days from concept to launch")),
                property("key_risks", arraySchema(typeSchema("string", null), "Key risks identified")));
        return new ToolSpecification(TOOL_GENERATE_LIFECYCLE,
                "Generate a Services-focused task checklist mapped to offer lifecycle phases", parameters);
    }

    @SafeVarargs
    private static Map<String, Object> objectSchema(List<String> required, Map.Entry<String, Object>... properties) {
        Map<String, Object> props = new LinkedHashMap<>();
        for (Map.Entry<String, Object> property : properties) {
            props.put(property.getKey(), property.getValue());
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        schema.put("required", required);
        return schema;
    }

    private static Map<String, Object> arraySchema(Map<String, Object> items, String description) {
        Map<String, Object> schema = typeSchema("array", description);
        schema.put("items", items);
        return schema;
    }

    private static Map<String, Object> enumSchema(List<String> values) {
        Map<String, Object> schema = typeSchema("string", null);
        schema.put("enum", values);
        return schema;
    }

    private static Map<String, Object> typeSchema(String type, String description) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type);
        if (description != null) {
            schema.put("description", description);
        }
        return schema;
    }

    private static Map.Entry<String, Object> property(String name, Object schema) {
        return Map.entry(name, schema);
    }

    private static List<String> required(String... names) {
        return Arrays.asList(names);
    }
}
