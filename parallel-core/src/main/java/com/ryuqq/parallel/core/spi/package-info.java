/**
 * Service Provider Interfaces - 엔진 외부 경계.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.parallel.core.spi.ToolInvoker} - Tool 이름 + 파라미터로 비동기 호출</li>
 *   <li>{@link com.ryuqq.parallel.core.spi.ExecutionListener} - 실행 진행 Hook</li>
 * </ul>
 *
 * <p>NoOp 구현은 {@code spi.noop} 패키지에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.core.spi;
