package com.ryuqq.parallel.adapter.runner;

import com.ryuqq.parallel.application.execution.DagInfo;
import com.ryuqq.parallel.application.execution.ExecutionConfig;
import com.ryuqq.parallel.application.execution.ExecutionReport;
import com.ryuqq.parallel.application.execution.ExecutionRequest;
import com.ryuqq.parallel.application.execution.ExecutionStatus;
import com.ryuqq.parallel.application.execution.ExecutionSummary;
import com.ryuqq.parallel.application.execution.FailureMode;
import com.ryuqq.parallel.application.execution.ParallelExecutor;
import com.ryuqq.parallel.application.resolve.VariableResolutionException;
import com.ryuqq.parallel.application.resolve.VariableResolver;
import com.ryuqq.parallel.core.graph.DagBuilder;
import com.ryuqq.parallel.core.graph.DagPlan;
import com.ryuqq.parallel.core.model.ResultLedger;
import com.ryuqq.parallel.core.model.RetryPolicy;
import com.ryuqq.parallel.core.model.Task;
import com.ryuqq.parallel.core.model.TaskError;
import com.ryuqq.parallel.core.model.TaskResult;
import com.ryuqq.parallel.core.spi.ExecutionListener;
import com.ryuqq.parallel.core.spi.ToolInvoker;
import com.ryuqq.parallel.core.spi.noop.NoOpExecutionListener;
import com.ryuqq.parallel.core.statemachine.ExecutionPhase;
import com.ryuqq.parallel.core.statemachine.PhaseTransition;
import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 레벨 배리어 기반 병렬 실행기.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * VALIDATING  DagBuilder.validateAndBuild()  (실패 시 예외, Task 실행 없음)
 *     ↓
 * RUNNING     level 0 → level 1 → ...        (이전 레벨이 모두 끝나야 다음 레벨 시작)
 *     ↓         레벨 내: priority 내림차순 대기열, 동시 실행 ≤ maxConcurrent
 * COMPLETED   ExecutionReport 조립
 * </pre>
 *
 * <p><strong>Task 한 건의 처리:</strong></p>
 * <ol>
 *   <li>건너뛰기 판단 (STOP 이후, 또는 CONTINUE에서 의존 Task 미성공)</li>
 *   <li>파라미터 변수 해석 (선행 결과 기준)</li>
 *   <li>runWithRetry(runWithTimeout(invoke))</li>
 *   <li>결과를 정확히 한 번 기록</li>
 * </ol>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>호출 스레드: 레벨 순회와 배리어 대기</li>
 *   <li>워커 풀: Task 시작 (변수 해석 + Tool 호출)</li>
 *   <li>스케줄러: 타임아웃 타이머, 백오프 대기</li>
 * </ul>
 *
 * <p>검증을 통과한 이후 {@link #execute}는 예외를 던지지 않습니다.
 * 엔진 내부 오류는 해당 Task의 실패(ENGINE_ERROR)로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LevelBarrierExecutor implements ParallelExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LevelBarrierExecutor.class);

    public static final String ENGINE_ERROR = "ENGINE_ERROR";
    public static final String EXECUTION_INTERRUPTED = "EXECUTION_INTERRUPTED";

    static final String BUDGET_EXCEEDED_REASON = "execution timeout exceeded";
    static final String INTERRUPTED_REASON = "execution interrupted";

    private static final Comparator<Task> BY_PRIORITY_DESC =
        Comparator.comparingInt(Task::effectivePriority).reversed();

    private final ToolInvoker invoker;
    private final RunnerConfig config;
    private final ExecutionListener listener;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final TaskRunner taskRunner;

    /**
     * 생성자 (기본 설정).
     *
     * @param invoker Tool 호출기
     */
    public LevelBarrierExecutor(ToolInvoker invoker) {
        this(invoker, new RunnerConfig(), NoOpExecutionListener.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param invoker Tool 호출기
     * @param config 엔진 설정
     */
    public LevelBarrierExecutor(ToolInvoker invoker, RunnerConfig config) {
        this(invoker, config, NoOpExecutionListener.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param invoker Tool 호출기
     * @param config 엔진 설정
     * @param listener 진행 상황 리스너
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LevelBarrierExecutor(ToolInvoker invoker, RunnerConfig config, ExecutionListener listener) {
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.invoker = invoker;
        this.config = config;
        this.listener = listener;
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), namedThreads("parallel-worker"));
        this.scheduler = newScheduler(config.schedulerThreads());
        this.taskRunner = new TaskRunner(scheduler);
    }

    @Override
    public ExecutionReport execute(ExecutionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.tasks() == null || request.tasks().isEmpty()) {
            throw new IllegalArgumentException("tasks cannot be null or empty");
        }

        // 1. 검증 (예외는 호출자에게 그대로 전달)
        ExecutionPhase phase = ExecutionPhase.VALIDATING;
        DagPlan plan = DagBuilder.validateAndBuild(request.tasks());

        // 2. 실행
        phase = PhaseTransition.transition(phase, ExecutionPhase.RUNNING);
        ExecutionRun run = new ExecutionRun(UUID.randomUUID().toString(), plan, request.config());
        MdcContext.setExecution(run.executionId);
        try {
            run.runLevels();

            // 3. 보고서 조립
            phase = PhaseTransition.transition(phase, ExecutionPhase.COMPLETED);
            return run.report(request.tasks());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * 워커와 스케줄러 종료.
     *
     * <p>진행 중인 작업이 shutdownTimeoutMs 안에 끝나지 않으면 강제 종료합니다.</p>
     */
    @Override
    public void close() {
        workers.shutdown();
        scheduler.shutdown();
        try {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.shutdownTimeoutMs());
            if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!scheduler.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            scheduler.shutdownNow();
        }
    }

    private void notifyListener(String callback, Runnable invocation) {
        try {
            invocation.run();
        } catch (RuntimeException e) {
            log.warn("ExecutionListener.{} failed", callback, e);
        }
    }

    private static ScheduledExecutorService newScheduler(int threads) {
        ScheduledThreadPoolExecutor executor =
            new ScheduledThreadPoolExecutor(threads, namedThreads("parallel-scheduler"));
        // 완료된 Task의 타이머가 종료를 지연시키지 않도록
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 요청 한 건의 실행 상태.
     */
    private final class ExecutionRun {

        private final String executionId;
        private final DagPlan plan;
        private final ExecutionConfig executionConfig;
        private final ResultLedger ledger = new ResultLedger();
        private final AtomicReference<String> haltedBy = new AtomicReference<>();
        private final Instant startTime = Instant.now();
        private final long deadlineNanos;
        private boolean interrupted;

        ExecutionRun(String executionId, DagPlan plan, ExecutionConfig executionConfig) {
            this.executionId = executionId;
            this.plan = plan;
            this.executionConfig = executionConfig;
            this.deadlineNanos = executionConfig.hasBudget()
                ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(executionConfig.timeoutMs())
                : Long.MAX_VALUE;
        }

        void runLevels() {
            log.info("Execution started: {} tasks in {} levels (maxConcurrent={}, failureMode={})",
                plan.graph().size(), plan.levelCount(),
                executionConfig.maxConcurrent(), executionConfig.failureMode());
            notifyListener("onExecutionStarted",
                () -> listener.onExecutionStarted(executionId, plan.graph().size(), plan.levelCount()));

            boolean budgetLogged = false;
            for (int level = 0; level < plan.levelCount(); level++) {
                List<String> taskIds = plan.levels().get(level);

                if (interrupted) {
                    skipAll(taskIds, INTERRUPTED_REASON);
                    continue;
                }
                if (haltedBy.get() != null) {
                    skipAll(taskIds, stopReason());
                    continue;
                }
                if (budgetExhausted()) {
                    if (!budgetLogged) {
                        log.warn("Execution budget of {}ms exhausted before level {}, skipping remaining tasks",
                            executionConfig.timeoutMs(), level);
                        budgetLogged = true;
                    }
                    skipAll(taskIds, BUDGET_EXCEEDED_REASON);
                    continue;
                }

                runLevel(level, taskIds);
            }

            if (executionConfig.failureMode() == FailureMode.ROLLBACK && haltedBy.get() != null) {
                List<String> succeeded = new ArrayList<>();
                ledger.view().forEach((taskId, result) -> {
                    if (result.isSuccess()) {
                        succeeded.add(taskId);
                    }
                });
                log.warn("Rollback requested after task {} failed, but no compensation ran; "
                    + "succeeded tasks left as-is: {}", haltedBy.get(), succeeded);
            }
        }

        private void runLevel(int level, List<String> taskIds) {
            MdcContext.setLevel(executionId, level);
            log.info("Level {} started: {}", level, taskIds);
            notifyListener("onLevelStarted", () -> listener.onLevelStarted(executionId, level, taskIds));

            LevelRun levelRun = new LevelRun(level, taskIds);
            try {
                levelRun.start().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                log.warn("Interrupted while waiting on level {}, failing unfinished tasks", level);
                levelRun.abort();
            } catch (ExecutionException e) {
                // 레벨 future는 정상 완료만 하므로 여기 도달하면 엔진 결함이다
                log.error("Level {} barrier failed unexpectedly", level, e);
                levelRun.abort();
            } finally {
                MdcContext.clearLevel();
            }
        }

        private boolean budgetExhausted() {
            return System.nanoTime() - deadlineNanos >= 0;
        }

        private String stopReason() {
            return "execution stopped after task " + haltedBy.get() + " failed";
        }

        private void skipAll(List<String> taskIds, String reason) {
            for (String taskId : taskIds) {
                finish(TaskResult.skipped(taskId, reason, Instant.now()));
            }
        }

        /**
         * 결과 기록 + 리스너 통지. 이미 기록된 Task면 무시됩니다.
         */
        private boolean finish(TaskResult result) {
            boolean recorded = ledger.tryRecord(result);
            if (!recorded) {
                log.debug("Late result for task {} ignored ({})", result.taskId(), result.status());
                return false;
            }
            notifyListener("onTaskCompleted", () -> listener.onTaskCompleted(executionId, result));
            return true;
        }

        private Optional<String> skipReason(Task task) {
            if (haltedBy.get() != null) {
                return Optional.of(stopReason());
            }
            for (String dependencyId : task.dependsOn()) {
                Optional<TaskResult> dependency = ledger.get(dependencyId);
                if (dependency.isEmpty() || !dependency.get().isSuccess()) {
                    String status = dependency
                        .map(result -> result.status().name().toLowerCase(Locale.ROOT))
                        .orElse("missing");
                    return Optional.of("dependency " + dependencyId + " did not succeed (status: " + status + ")");
                }
            }
            return Optional.empty();
        }

        private TaskResult toResult(Task task, Instant start, Value value, Throwable error) {
            Instant end = Instant.now();
            if (error == null) {
                return TaskResult.success(task.id(), value, start, end);
            }
            TaskError taskError = ErrorNormalizer.normalize(error);
            log.warn("Task {} failed: {} {}", task.id(), taskError.code(), taskError.message());
            if (executionConfig.failureMode().haltsOnFailure() && haltedBy.compareAndSet(null, task.id())) {
                log.warn("Failure mode {}: no new tasks will start after task {} failed",
                    executionConfig.failureMode(), task.id());
            }
            return TaskResult.failed(task.id(), taskError, start, end);
        }

        private TaskResult engineFailure(Task task, Instant start, Throwable error) {
            log.error("Engine error while running task {}", task.id(), error);
            if (executionConfig.failureMode().haltsOnFailure()) {
                haltedBy.compareAndSet(null, task.id());
            }
            String message = error.getMessage() == null ? error.toString() : error.getMessage();
            return TaskResult.failed(task.id(), TaskError.of(ENGINE_ERROR, message), start, Instant.now());
        }

        ExecutionReport report(List<Task> submitted) {
            Instant endTime = Instant.now();
            Map<String, TaskResult> results = new LinkedHashMap<>();
            for (Task task : submitted) {
                TaskResult result = ledger.get(task.id()).orElse(null);
                if (result == null) {
                    log.error("Task {} has no recorded result, reporting as failed", task.id());
                    result = TaskResult.failed(task.id(),
                        TaskError.of(ENGINE_ERROR, "no result recorded"), endTime, endTime);
                }
                results.put(task.id(), result);
            }

            ExecutionSummary summary = ExecutionSummary.of(results.values());
            ExecutionStatus status = ExecutionStatus.from(results.values());
            long durationMs = Math.max(0, Duration.between(startTime, endTime).toMillis());

            log.info("Execution completed: status={}, succeeded={}, failed={}, skipped={}, {}ms",
                status, summary.succeeded(), summary.failed(), summary.skipped(), durationMs);
            notifyListener("onExecutionCompleted",
                () -> listener.onExecutionCompleted(executionId, List.copyOf(results.values())));

            return new ExecutionReport(executionId, status, startTime, endTime, durationMs, results, summary,
                new DagInfo(plan.levels(), DagBuilder.extractEdges(plan.graph())));
        }

        /**
         * 레벨 한 개의 우선순위 대기열과 동시 실행 제한.
         */
        private final class LevelRun {

            private final int level;
            private final Deque<Task> queue;
            private final Set<String> inFlight = new LinkedHashSet<>();
            private final CompletableFuture<Void> done = new CompletableFuture<>();
            private int remaining;
            private boolean aborted;

            LevelRun(int level, List<String> taskIds) {
                this.level = level;
                List<Task> tasks = new ArrayList<>(taskIds.size());
                for (String taskId : taskIds) {
                    tasks.add(plan.graph().task(taskId));
                }
                // 안정 정렬: 같은 priority는 제출 순서 유지
                tasks.sort(BY_PRIORITY_DESC);
                this.queue = new ArrayDeque<>(tasks);
                this.remaining = tasks.size();
            }

            CompletableFuture<Void> start() {
                if (remaining == 0) {
                    done.complete(null);
                    return done;
                }
                admit();
                return done;
            }

            /**
             * 빈 슬롯만큼 대기열에서 꺼내 시작합니다.
             */
            private void admit() {
                while (true) {
                    Task task;
                    synchronized (this) {
                        if (aborted || queue.isEmpty() || inFlight.size() >= executionConfig.maxConcurrent()) {
                            return;
                        }
                        task = queue.poll();
                        inFlight.add(task.id());
                    }

                    Optional<String> skipReason = skipReason(task);
                    if (skipReason.isPresent()) {
                        log.debug("Skipping task {}: {}", task.id(), skipReason.get());
                        finish(TaskResult.skipped(task.id(), skipReason.get(), Instant.now()));
                        settle(task, false);
                        continue;
                    }
                    dispatch(task);
                }
            }

            private void dispatch(Task task) {
                try {
                    workers.execute(() -> runTask(task));
                } catch (RejectedExecutionException e) {
                    finish(engineFailure(task, Instant.now(), e));
                    settle(task, false);
                }
            }

            private void runTask(Task task) {
                MdcContext.setTask(executionId, level, task.id());
                Instant start = Instant.now();
                try {
                    log.debug("Dispatching task {} (tool={})", task.id(), task.tool());
                    notifyListener("onTaskStarted", () -> listener.onTaskStarted(executionId, task.id()));

                    CompletableFuture<Value> future;
                    try {
                        MapValue params = VariableResolver.resolve(task.params(), ledger.view());
                        long timeoutMs = task.timeout().orElse(config.defaultTaskTimeoutMs());
                        RetryPolicy retryPolicy = task.retry().orElse(config.defaultRetryPolicy());
                        future = taskRunner.runWithRetry(
                            () -> taskRunner.runWithTimeout(
                                () -> invoker.invoke(task.tool(), params), timeoutMs, task.id()),
                            retryPolicy, task.id());
                    } catch (VariableResolutionException e) {
                        future = CompletableFuture.failedFuture(e);
                    }

                    future.whenComplete((value, error) -> complete(task, start, value, error));
                } catch (RuntimeException e) {
                    finish(engineFailure(task, start, e));
                    settle(task, true);
                } finally {
                    MdcContext.clear();
                }
            }

            private void complete(Task task, Instant start, Value value, Throwable error) {
                Map<String, String> previous = MdcContext.capture();
                MdcContext.setTask(executionId, level, task.id());
                try {
                    TaskResult result;
                    try {
                        result = toResult(task, start, value, error);
                    } catch (RuntimeException e) {
                        result = engineFailure(task, start, e);
                    }
                    finish(result);
                } finally {
                    MdcContext.restore(previous);
                }
                settle(task, true);
            }

            /**
             * Task 한 건의 종료 처리. 남은 Task가 없으면 레벨 완료.
             *
             * @param admitNext admit() 루프 밖에서 호출된 경우 true
             */
            private void settle(Task task, boolean admitNext) {
                boolean levelDone;
                synchronized (this) {
                    inFlight.remove(task.id());
                    remaining--;
                    levelDone = remaining == 0;
                }
                if (levelDone) {
                    done.complete(null);
                } else if (admitNext) {
                    admit();
                }
            }

            /**
             * 중단: 대기 중이거나 실행 중인 Task를 실패로 기록합니다.
             */
            void abort() {
                List<String> unfinished = new ArrayList<>();
                synchronized (this) {
                    aborted = true;
                    unfinished.addAll(inFlight);
                    for (Task task : queue) {
                        unfinished.add(task.id());
                    }
                    queue.clear();
                }
                Instant now = Instant.now();
                for (String taskId : unfinished) {
                    finish(TaskResult.failed(taskId,
                        TaskError.of(EXECUTION_INTERRUPTED, "Task " + taskId + " did not finish before the execution was interrupted"),
                        now, now));
                }
                done.complete(null);
            }
        }
    }
}
