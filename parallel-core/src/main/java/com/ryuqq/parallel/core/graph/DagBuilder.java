package com.ryuqq.parallel.core.graph;

import com.ryuqq.parallel.core.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 의존성 그래프 구성 및 검증.
 *
 * <p><strong>처리 흐름 ({@link #validateAndBuild}):</strong></p>
 * <pre>
 * tasks
 *   ↓ build()             → DuplicateTaskIdException, MissingDependencyException
 * TaskGraph
 *   ↓ detectCycle()       → CircularDependencyException
 *   ↓ topologicalLevels() → 레벨 할당
 * DagPlan(graph, levels)
 * </pre>
 *
 * <p>순환 검사는 반드시 레벨 계산보다 먼저 수행됩니다.
 * 레벨 계산 단계에서 남는 노드가 있다면 검증 누락이므로 {@link IllegalStateException}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DagBuilder {

    // Utility class - prevent instantiation
    private DagBuilder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전체 검증 후 실행 계획 생성.
     *
     * <p>Orchestrator가 호출하는 유일한 진입점입니다.</p>
     *
     * @param tasks 제출된 Task 목록
     * @return 그래프와 레벨
     * @throws IllegalArgumentException tasks가 null이거나 null 원소를 포함하는 경우
     * @throws DuplicateTaskIdException ID가 중복된 경우
     * @throws MissingDependencyException 존재하지 않는 Task에 의존하는 경우
     * @throws CircularDependencyException 순환 의존성이 있는 경우
     */
    public static DagPlan validateAndBuild(List<Task> tasks) {
        TaskGraph graph = build(tasks);

        Optional<List<String>> cycle = detectCycle(graph);
        if (cycle.isPresent()) {
            throw new CircularDependencyException(cycle.get());
        }

        return new DagPlan(graph, topologicalLevels(graph));
    }

    /**
     * 그래프 구성.
     *
     * <p>1단계에서 모든 노드를 만들며 ID 중복을 검사하고,
     * 2단계에서 의존성 대상 존재 여부를 확인하며 역방향 간선을 추가합니다.</p>
     *
     * @param tasks Task 목록
     * @return 레벨이 할당되지 않은 그래프
     * @throws IllegalArgumentException tasks가 null이거나 null 원소를 포함하는 경우
     * @throws DuplicateTaskIdException ID가 중복된 경우
     * @throws MissingDependencyException 존재하지 않는 Task에 의존하는 경우
     */
    public static TaskGraph build(List<Task> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }

        TaskGraph graph = new TaskGraph();

        // 1. 노드 생성 (간선 추가 전 ID 중복 검사)
        for (Task task : tasks) {
            if (task == null) {
                throw new IllegalArgumentException("tasks cannot contain null");
            }
            if (graph.contains(task.id())) {
                throw new DuplicateTaskIdException(task.id());
            }
            graph.add(task);
        }

        // 2. 의존성 검증 + 역방향 간선
        for (DagNode node : graph.nodes()) {
            for (String dependencyId : node.getDependencies()) {
                if (!graph.contains(dependencyId)) {
                    throw new MissingDependencyException(node.getTaskId(), dependencyId);
                }
                graph.node(dependencyId).addDependent(node.getTaskId());
            }
        }

        return graph;
    }

    /**
     * 순환 의존성 탐지 (DFS + 탐색 스택).
     *
     * <p>탐색 중인 경로에 있는 노드를 다시 만나면 그 지점부터의 경로에
     * 해당 노드를 한 번 더 붙여 반환합니다. 연결되지 않은 컴포넌트도 모두 검사합니다.</p>
     *
     * <p>재귀 대신 명시적 스택을 사용하므로 긴 의존 체인에서도 호출 스택 깊이가 늘지 않습니다.</p>
     *
     * @param graph 검사할 그래프
     * @return 순환 경로 (없으면 empty)
     */
    public static Optional<List<String>> detectCycle(TaskGraph graph) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String taskId : graph.taskIds()) {
            if (!visited.contains(taskId)) {
                List<String> cycle = visit(graph, taskId, visited, onStack);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> visit(TaskGraph graph, String rootId, Set<String> visited, Set<String> onStack) {
        Deque<Frame> frames = new ArrayDeque<>();
        List<String> path = new ArrayList<>();

        enter(graph, rootId, visited, onStack, path, frames);
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (!frame.dependencies.hasNext()) {
                frames.pop();
                path.remove(path.size() - 1);
                onStack.remove(frame.taskId);
                continue;
            }

            String dependencyId = frame.dependencies.next();
            if (onStack.contains(dependencyId)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependencyId), path.size()));
                cycle.add(dependencyId);
                return cycle;
            }
            if (!visited.contains(dependencyId)) {
                enter(graph, dependencyId, visited, onStack, path, frames);
            }
        }
        return null;
    }

    private static void enter(TaskGraph graph, String taskId, Set<String> visited, Set<String> onStack,
                              List<String> path, Deque<Frame> frames) {
        visited.add(taskId);
        onStack.add(taskId);
        path.add(taskId);
        frames.push(new Frame(taskId, graph.node(taskId).getDependencies().iterator()));
    }

    /**
     * DFS 스택 프레임: 노드와 아직 보지 않은 의존성.
     */
    private static final class Frame {

        private final String taskId;
        private final Iterator<String> dependencies;

        Frame(String taskId, Iterator<String> dependencies) {
            this.taskId = taskId;
            this.dependencies = dependencies;
        }
    }

    /**
     * 레벨 단위 위상 정렬 (Kahn 알고리즘).
     *
     * <p>진입 차수 0인 노드가 레벨 0이 되고, 각 레벨을 내보낼 때마다
     * 후행 노드의 진입 차수를 줄여 0이 된 노드로 다음 레벨을 구성합니다.
     * 노드의 level은 레벨이 내보내질 때 할당됩니다.</p>
     *
     * @param graph 순환 검사를 통과한 그래프
     * @return 레벨 목록
     * @throws IllegalStateException 모든 노드를 내보내지 못한 경우 (순환 검사 누락)
     */
    public static List<List<String>> topologicalLevels(TaskGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        List<String> frontier = new ArrayList<>();

        for (DagNode node : graph.nodes()) {
            inDegree.put(node.getTaskId(), node.getDependencies().size());
            if (node.getDependencies().isEmpty()) {
                frontier.add(node.getTaskId());
            }
        }

        List<List<String>> levels = new ArrayList<>();
        int emitted = 0;

        while (!frontier.isEmpty()) {
            int levelIndex = levels.size();
            levels.add(List.copyOf(frontier));
            emitted += frontier.size();

            List<String> next = new ArrayList<>();
            for (String taskId : frontier) {
                DagNode node = graph.node(taskId);
                node.assignLevel(levelIndex);

                for (String dependentId : node.getDependents()) {
                    int remaining = inDegree.merge(dependentId, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(dependentId);
                    }
                }
            }
            frontier = next;
        }

        if (emitted != graph.size()) {
            throw new IllegalStateException(String.format(
                "Topological sort failed: processed %d of %d tasks. This indicates a circular dependency.",
                emitted, graph.size()));
        }
        return levels;
    }

    /**
     * 간선 목록 추출 (진단용).
     *
     * @param graph 그래프
     * @return 선행 → 후행 간선 (레벨 할당 여부와 무관)
     */
    public static List<GraphEdge> extractEdges(TaskGraph graph) {
        List<GraphEdge> edges = new ArrayList<>();
        for (DagNode node : graph.nodes()) {
            for (String dependencyId : node.getDependencies()) {
                edges.add(new GraphEdge(dependencyId, node.getTaskId()));
            }
        }
        return edges;
    }
}
