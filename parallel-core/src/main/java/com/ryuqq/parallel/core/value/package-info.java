/**
 * Tagged value model for task parameters and tool results.
 *
 * <p>{@link com.ryuqq.parallel.core.value.Value} is a sealed interface over the six
 * JSON shapes, so parameter payloads can be walked generically without reflection.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.parallel.core.value;
