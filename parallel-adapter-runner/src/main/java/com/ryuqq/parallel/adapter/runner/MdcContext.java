package com.ryuqq.parallel.adapter.runner;

import org.slf4j.MDC;

import java.util.Map;

/**
 * 실행 관련 MDC 키 관리.
 *
 * <p>키: {@code executionId}, {@code level}, {@code taskId}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MdcContext {

    public static final String EXECUTION_ID = "executionId";
    public static final String LEVEL = "level";
    public static final String TASK_ID = "taskId";

    private MdcContext() {
    }

    public static void setExecution(String executionId) {
        MDC.put(EXECUTION_ID, executionId);
    }

    public static void setLevel(String executionId, int level) {
        MDC.put(EXECUTION_ID, executionId);
        MDC.put(LEVEL, String.valueOf(level));
    }

    public static void setTask(String executionId, int level, String taskId) {
        MDC.put(EXECUTION_ID, executionId);
        MDC.put(LEVEL, String.valueOf(level));
        MDC.put(TASK_ID, taskId);
    }

    public static void clearLevel() {
        MDC.remove(LEVEL);
        MDC.remove(TASK_ID);
    }

    public static void clear() {
        MDC.remove(EXECUTION_ID);
        MDC.remove(LEVEL);
        MDC.remove(TASK_ID);
    }

    /**
     * 현재 스레드의 MDC 복사본 (없으면 null).
     */
    public static Map<String, String> capture() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * 캡처한 MDC로 되돌립니다. null이면 MDC를 비웁니다.
     *
     * @param context {@link #capture()} 결과
     */
    public static void restore(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    /**
     * 주어진 MDC 아래에서 실행하고, 끝나면 스레드의 이전 MDC로 되돌립니다.
     *
     * <p>완료 콜백처럼 호출 스레드가 정해지지 않은 코드에서 사용합니다.</p>
     *
     * @param context 적용할 MDC (null이면 빈 MDC)
     * @param action 실행할 작업
     */
    public static void runWith(Map<String, String> context, Runnable action) {
        Map<String, String> previous = capture();
        restore(context);
        try {
            action.run();
        } finally {
            restore(previous);
        }
    }
}
