package com.offerflow.domain.dependency.service;

import com.offerflow.domain.dependency.adapter.repository.IDependencyRepository;
import com.offerflow.domain.dependency.model.entity.DependencyEntity;
import com.offerflow.domain.dependency.model.valobj.CriticalPathNode;
import com.offerflow.domain.dependency.model.valobj.CriticalPathResult;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 依赖图领域服务：依赖边准入校验与关键路径计算。
 * <p>
 * 关键路径只考虑未解除（非 RESOLVED）的依赖，路径长度为路径上节点时长之和，每个节点计一次。
 * 同长路径取最先发现者：起点按首次作为依赖源出现的顺序，后继按依赖 ID 顺序，只有严格更长才替换。
 * 先用一次 DFS 去掉回边再做记忆化最长路径，有环图同样是线性时间，结果仍是原图中的一条简单路径。
 * </p>
 */
@Service
public class DependencyGraphDomainService {

    private final IDependencyRepository dependencyRepository;
    private final IWorkItemCatalog workItemCatalog;

    public DependencyGraphDomainService(IDependencyRepository dependencyRepository,
                                        IWorkItemCatalog workItemCatalog) {
        this.dependencyRepository = dependencyRepository;
        this.workItemCatalog = workItemCatalog;
    }

    /**
     * 校验待写入的依赖边。
     *
     * @param candidate 新依赖
     * @throws AppException SELF_REFERENCE / ILLEGAL_PARAMETER / NOT_FOUND / PROJECT_MISMATCH / DUPLICATE_EDGE
     */
    public void validateNewEdge(DependencyEntity candidate) {
        if (candidate == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "依赖不能为空");
        }
        try {
            candidate.validate();
        } catch (IllegalStateException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, ex.getMessage());
        }
        if (candidate.isSelfReference()) {
            throw new AppException(ResponseCode.SELF_REFERENCE, "依赖不能指向自身: " + candidate.getSource());
        }
        Double confidence = candidate.getConfidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0D || confidence > 1D)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "confidence 必须位于 [0,1]: " + confidence);
        }
        Long projectId = candidate.getProjectId();
        if (!workItemCatalog.projectExists(projectId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
        requireSameProject(projectId, candidate.getSource());
        requireSameProject(projectId, candidate.getTarget());
        if (dependencyRepository.existsEdge(projectId, candidate.getSource(), candidate.getTarget(),
                candidate.getDependencyType())) {
            throw new AppException(ResponseCode.DUPLICATE_EDGE, "依赖已存在: " + candidate.getSource()
                    + " -> " + candidate.getTarget() + " (" + candidate.getDependencyType().getCode() + ")");
        }
    }

    private void requireSameProject(Long projectId, WorkItemRef ref) {
        Long owningProjectId = workItemCatalog.findOwningProjectId(ref);
        if (owningProjectId == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "工作项不存在: " + ref);
        }
        if (!Objects.equals(projectId, owningProjectId)) {
            throw new AppException(ResponseCode.PROJECT_MISMATCH,
                    "工作项 " + ref + " 属于项目 " + owningProjectId + "，不属于项目 " + projectId);
        }
    }

    /**
     * 计算关键路径（最长时长路径）。
     *
     * @param dependencies 项目全部依赖，任意顺序
     * @param durationResolver 节点时长解析
     * @return 关键路径
     */
    public CriticalPathResult computeCriticalPath(List<DependencyEntity> dependencies,
                                                  NodeDurationResolver durationResolver) {
        if (dependencies == null || dependencies.isEmpty()) {
            return CriticalPathResult.empty();
        }
        List<DependencyEntity> active = new ArrayList<>();
        for (DependencyEntity dependency : dependencies) {
            if (dependency != null && dependency.isActive()) {
                active.add(dependency);
            }
        }
        if (active.isEmpty()) {
            return CriticalPathResult.empty();
        }
        active.sort(Comparator.comparing(DependencyEntity::getId, Comparator.nullsLast(Comparator.naturalOrder())));

        Map<WorkItemRef, Set<WorkItemRef>> successors = new LinkedHashMap<>();
        for (DependencyEntity dependency : active) {
            successors.computeIfAbsent(dependency.getSource(), key -> new LinkedHashSet<>()).add(dependency.getTarget());
            successors.computeIfAbsent(dependency.getTarget(), key -> new LinkedHashSet<>());
        }
        List<WorkItemRef> roots = new ArrayList<>();
        Set<WorkItemRef> seenRoots = new HashSet<>();
        for (DependencyEntity dependency : active) {
            if (seenRoots.add(dependency.getSource())) {
                roots.add(dependency.getSource());
            }
        }

        Map<WorkItemRef, Double> durations = new HashMap<>();
        for (WorkItemRef node : successors.keySet()) {
            durations.put(node, durationResolver == null ? 0D : durationResolver.durationOf(node));
        }

        AcyclicView view = dropBackEdges(successors, roots);
        Map<WorkItemRef, PathCandidate> memo = new HashMap<>();
        PathCandidate best = null;
        for (WorkItemRef root : roots) {
            PathCandidate candidate = longestAcyclicPath(root, view.successors, durations, memo);
            if (best == null || candidate.total > best.total) {
                best = candidate;
            }
        }
        boolean cyclic = view.cyclic;
        if (best == null) {
            return new CriticalPathResult(Collections.emptyList(), 0D, cyclic);
        }
        List<CriticalPathNode> items = new ArrayList<>();
        for (WorkItemRef node : best.nodes) {
            items.add(new CriticalPathNode(node, durations.get(node)));
        }
        return new CriticalPathResult(items, best.total, cyclic);
    }

    private PathCandidate longestAcyclicPath(WorkItemRef node,
                                             Map<WorkItemRef, Set<WorkItemRef>> successors,
                                             Map<WorkItemRef, Double> durations,
                                             Map<WorkItemRef, PathCandidate> memo) {
        PathCandidate cached = memo.get(node);
        if (cached != null) {
            return cached;
        }
        PathCandidate bestTail = null;
        for (WorkItemRef next : successors.getOrDefault(node, Collections.emptySet())) {
            PathCandidate tail = longestAcyclicPath(next, successors, durations, memo);
            if (bestTail == null || tail.total > bestTail.total) {
                bestTail = tail;
            }
        }
        PathCandidate result = PathCandidate.prepend(node, durations.get(node), bestTail);
        memo.put(node, result);
        return result;
    }

    /**
     * 迭代 DFS 去掉回边，得到无环子图。
     * <p>
     * 起点先按 roots 顺序，再按节点首次出现顺序；指向在途（灰色）节点的边视为回边。
     * 每个节点与每条边只访问一次。
     * </p>
     */
    private AcyclicView dropBackEdges(Map<WorkItemRef, Set<WorkItemRef>> successors, List<WorkItemRef> roots) {
        Map<WorkItemRef, Set<WorkItemRef>> pruned = new LinkedHashMap<>();
        for (Map.Entry<WorkItemRef, Set<WorkItemRef>> entry : successors.entrySet()) {
            pruned.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }
        List<WorkItemRef> starts = new ArrayList<>(roots);
        starts.addAll(successors.keySet());

        boolean cyclic = false;
        Map<WorkItemRef, Integer> color = new HashMap<>();
        for (WorkItemRef start : starts) {
            if (color.containsKey(start)) {
                continue;
            }
            List<WorkItemRef> stack = new ArrayList<>();
            List<Iterator<WorkItemRef>> iterators = new ArrayList<>();
            stack.add(start);
            iterators.add(successors.getOrDefault(start, Collections.emptySet()).iterator());
            color.put(start, 1);
            while (!stack.isEmpty()) {
                int top = stack.size() - 1;
                Iterator<WorkItemRef> iterator = iterators.get(top);
                if (iterator.hasNext()) {
                    WorkItemRef next = iterator.next();
                    Integer state = color.get(next);
                    if (state == null) {
                        color.put(next, 1);
                        stack.add(next);
                        iterators.add(successors.getOrDefault(next, Collections.emptySet()).iterator());
                    } else if (state == 1) {
                        pruned.get(stack.get(top)).remove(next);
                        cyclic = true;
                    }
                } else {
                    color.put(stack.remove(top), 2);
                    iterators.remove(top);
                }
            }
        }
        return new AcyclicView(pruned, cyclic);
    }

    private static final class AcyclicView {

        private final Map<WorkItemRef, Set<WorkItemRef>> successors;
        private final boolean cyclic;

        private AcyclicView(Map<WorkItemRef, Set<WorkItemRef>> successors, boolean cyclic) {
            this.successors = successors;
            this.cyclic = cyclic;
        }
    }

    private static final class PathCandidate {

        private final List<WorkItemRef> nodes;
        private final double total;

        private PathCandidate(List<WorkItemRef> nodes, double total) {
            this.nodes = nodes;
            this.total = total;
        }

        private static PathCandidate prepend(WorkItemRef head, Double duration, PathCandidate tail) {
            double headDuration = duration == null ? 0D : duration;
            List<WorkItemRef> nodes = new ArrayList<>();
            nodes.add(head);
            if (tail == null) {
                return new PathCandidate(nodes, headDuration);
            }
            nodes.addAll(tail.nodes);
            return new PathCandidate(nodes, headDuration + tail.total);
        }
    }
}
