package com.ryuqq.parallel.core.model;

import com.ryuqq.parallel.core.value.MapValue;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 호출자가 요청한 단위 작업.
 *
 * <p>하나의 Tool 호출과 그 파라미터, 선행 Task 의존성, 실행 옵션을 담습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>id, tool: null 또는 빈 문자열 불가</li>
 *   <li>params: null이면 빈 MapValue</li>
 *   <li>dependsOn: null이면 빈 집합, 선언 순서 유지</li>
 *   <li>priority: 지정 시 1~10</li>
 *   <li>timeoutMs: 지정 시 양수</li>
 * </ul>
 *
 * <p>ID 중복, 존재하지 않는 의존성, 순환 의존성은 요청 단위 검증이므로
 * {@link com.ryuqq.parallel.core.graph.DagBuilder}가 담당합니다.</p>
 *
 * @param id 요청 내 고유 식별자
 * @param tool 실행할 Tool 이름
 * @param params Tool 파라미터 (변수 참조 포함 가능)
 * @param dependsOn 선행 Task ID 집합
 * @param priority 우선순위 (1~10, 높을수록 먼저, null 가능)
 * @param timeoutMs Task 단위 타임아웃 (밀리초, null 가능)
 * @param retryPolicy Task 단위 재시도 정책 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Task(
    String id,
    String tool,
    MapValue params,
    Set<String> dependsOn,
    Integer priority,
    Long timeoutMs,
    RetryPolicy retryPolicy
) {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    /**
     * priority가 지정되지 않은 Task의 스케줄링 우선순위.
     */
    public static final int DEFAULT_PRIORITY = 5;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("tool cannot be null or blank (task: " + id + ")");
        }
        if (priority != null && (priority < MIN_PRIORITY || priority > MAX_PRIORITY)) {
            throw new IllegalArgumentException(
                String.format("priority must be between %d and %d (task: %s, current: %d)",
                    MIN_PRIORITY, MAX_PRIORITY, id, priority));
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (task: " + id + ", current: " + timeoutMs + ")"
            );
        }
        params = params == null ? MapValue.empty() : params;
        dependsOn = dependsOn == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }

    /**
     * 의존성 없는 Task 생성.
     *
     * @param id Task ID
     * @param tool Tool 이름
     * @param params 파라미터
     * @return Task 인스턴스
     */
    public static Task of(String id, String tool, MapValue params) {
        return new Task(id, tool, params, null, null, null, null);
    }

    /**
     * 빌더 생성.
     *
     * @param id Task ID
     * @param tool Tool 이름
     * @return Builder
     */
    public static Builder builder(String id, String tool) {
        return new Builder(id, tool);
    }

    /**
     * 스케줄링 시 사용하는 우선순위.
     *
     * @return priority, 없으면 {@link #DEFAULT_PRIORITY}
     */
    public int effectivePriority() {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }

    /**
     * Task 단위 타임아웃.
     *
     * @return 지정된 경우 타임아웃 (밀리초)
     */
    public Optional<Long> timeout() {
        return Optional.ofNullable(timeoutMs);
    }

    /**
     * Task 단위 재시도 정책.
     *
     * @return 지정된 경우 재시도 정책
     */
    public Optional<RetryPolicy> retry() {
        return Optional.ofNullable(retryPolicy);
    }

    /**
     * Task 빌더.
     */
    public static final class Builder {

        private final String id;
        private final String tool;
        private MapValue params = MapValue.empty();
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private Integer priority;
        private Long timeoutMs;
        private RetryPolicy retryPolicy;

        private Builder(String id, String tool) {
            this.id = id;
            this.tool = tool;
        }

        public Builder params(MapValue params) {
            this.params = params;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            Collections.addAll(this.dependsOn, taskIds);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Task build() {
            return new Task(id, tool, params, dependsOn, priority, timeoutMs, retryPolicy);
        }
    }
}
