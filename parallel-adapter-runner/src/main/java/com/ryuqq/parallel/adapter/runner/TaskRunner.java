package com.ryuqq.parallel.adapter.runner;

import com.ryuqq.parallel.core.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 단일 Task 실행 래퍼 (타임아웃 + 재시도).
 *
 * <p>모든 대기는 {@link ScheduledExecutorService}에서 비동기로 처리되며,
 * 백오프 중에 스레드를 점유하지 않습니다.</p>
 *
 * <p><strong>조합 순서:</strong></p>
 * <pre>
 * runWithRetry(() -> runWithTimeout(() -> invoker.invoke(tool, params), timeout, id), policy, id)
 * </pre>
 * 각 시도마다 새 타이머가 적용됩니다.
 *
 * <p>반환되는 future는 CompletionException으로 감싸지 않은 실제 원인으로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final ScheduledExecutorService scheduler;
    private final BackoffCalculator backoffCalculator;

    /**
     * 생성자 (기본 BackoffCalculator).
     *
     * @param scheduler 타이머/백오프 스케줄러
     */
    public TaskRunner(ScheduledExecutorService scheduler) {
        this(scheduler, new BackoffCalculator());
    }

    /**
     * 생성자.
     *
     * @param scheduler 타이머/백오프 스케줄러
     * @param backoffCalculator 대기 시간 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TaskRunner(ScheduledExecutorService scheduler, BackoffCalculator backoffCalculator) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.scheduler = scheduler;
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 타임아웃 적용 실행.
     *
     * <p>작업 future와 타이머가 경합하여 먼저 끝나는 쪽이 결과가 됩니다.
     * 타이머가 먼저 끝나면 {@link TaskTimeoutException}으로 실패하며,
     * 원래 작업은 취소되지 않습니다.</p>
     *
     * @param operation 작업 (호출 시 future 반환)
     * @param timeoutMs 타임아웃 (밀리초, 0 이하면 제한 없음)
     * @param taskId 오류 메시지용 Task ID
     * @param <T> 결과 타입
     * @return 결과 future
     */
    public <T> CompletableFuture<T> runWithTimeout(Supplier<CompletableFuture<T>> operation,
                                                   long timeoutMs, String taskId) {
        CompletableFuture<T> source = start(operation);
        CompletableFuture<T> result = new CompletableFuture<>();

        ScheduledFuture<?> timer = null;
        if (timeoutMs > 0 && !source.isDone()) {
            timer = scheduler.schedule(
                () -> result.completeExceptionally(new TaskTimeoutException(taskId, timeoutMs)),
                timeoutMs, TimeUnit.MILLISECONDS
            );
        }

        ScheduledFuture<?> armed = timer;
        source.whenComplete((value, error) -> {
            if (armed != null) {
                armed.cancel(false);
            }
            if (error != null) {
                result.completeExceptionally(ErrorNormalizer.unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * 재시도 적용 실행.
     *
     * <p>최대 maxAttempts번 시도하며, 마지막 실패의 원인을 그대로 전달합니다.
     * policy가 null이거나 maxAttempts가 1이면 한 번만 실행합니다.</p>
     *
     * <p>호출 시점의 MDC가 재시도 로그와 이후 시도에 그대로 적용됩니다.</p>
     *
     * @param operation 작업 (시도마다 새로 호출)
     * @param policy 재시도 정책 (null 허용)
     * @param taskId 로그용 Task ID
     * @param <T> 결과 타입
     * @return 결과 future
     */
    public <T> CompletableFuture<T> runWithRetry(Supplier<CompletableFuture<T>> operation,
                                                 RetryPolicy policy, String taskId) {
        RetryPolicy effective = policy == null ? RetryPolicy.none() : policy;
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, effective, taskId, 0, result, MdcContext.capture());
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> operation, RetryPolicy policy, String taskId,
                             int attemptIndex, CompletableFuture<T> result, Map<String, String> context) {
        start(operation).whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }

            Throwable cause = ErrorNormalizer.unwrap(error);
            if (attemptIndex + 1 >= policy.maxAttempts()) {
                result.completeExceptionally(cause);
                return;
            }

            long delayMs = backoffCalculator.calculate(policy, attemptIndex);
            MdcContext.runWith(context, () -> log.warn("Task {} attempt {}/{} failed ({}), retrying in {}ms",
                taskId, attemptIndex + 1, policy.maxAttempts(), cause.toString(), delayMs));

            try {
                scheduler.schedule(
                    () -> MdcContext.runWith(context,
                        () -> attempt(operation, policy, taskId, attemptIndex + 1, result, context)),
                    delayMs, TimeUnit.MILLISECONDS
                );
            } catch (RejectedExecutionException e) {
                cause.addSuppressed(e);
                result.completeExceptionally(cause);
            }
        });
    }

    /**
     * 작업 시작. 동기 예외와 null future는 실패 future로 변환합니다.
     */
    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("operation returned a null future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
