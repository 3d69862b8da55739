package com.ryuqq.parallel.core.spi;

import com.ryuqq.parallel.core.value.MapValue;
import com.ryuqq.parallel.core.value.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Tool 호출 SPI.
 *
 * <p>엔진이 외부 Tool(브라우저, 파일, DB, 이메일, HTTP 등)에 접근하는 유일한 경계입니다.
 * 엔진은 Tool의 의미를 해석하지 않으며, 결과를 불투명한 값으로 취급합니다.</p>
 *
 * <p><strong>구현 규약:</strong></p>
 * <ul>
 *   <li>비동기: 호출 즉시 future를 반환해야 합니다 (블로킹 금지 권장)</li>
 *   <li>실패: future를 예외로 완료합니다. 동기적으로 던진 예외도 실패로 처리됩니다</li>
 *   <li>동시성: 같은 Tool이 동시에 여러 번 호출될 수 있으며, 그 안전성은 구현체 책임입니다</li>
 *   <li>취소: 엔진은 타임아웃 시 future를 기다리지 않을 뿐 취소하지 않습니다</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ToolInvoker {

    /**
     * Tool 호출.
     *
     * @param toolName Tool 이름
     * @param params 변수 해석이 완료된 파라미터
     * @return Tool 결과 future
     */
    CompletableFuture<Value> invoke(String toolName, MapValue params);
}
