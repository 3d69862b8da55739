package com.ryuqq.parallel.core.spi.noop;

import com.ryuqq.parallel.core.spi.ExecutionListener;

/**
 * ExecutionListener NoOp 구현.
 *
 * <p>아무 동작도 하지 않습니다. Listener를 지정하지 않은 경우의 기본값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpExecutionListener implements ExecutionListener {

    public static final NoOpExecutionListener INSTANCE = new NoOpExecutionListener();

    private NoOpExecutionListener() {
    }
}
