/**
 * 실행 요청 생명주기 (VALIDATING → RUNNING → COMPLETED).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.core.statemachine;
