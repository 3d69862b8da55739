/**
 * JSON codec for execution requests, reports and {@code Value} trees (Jackson).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.application.codec;
