/**
 * In-memory tool adapter.
 *
 * <p>{@link com.ryuqq.parallel.adapter.inmemory.tool.InMemoryToolRegistry} implements
 * {@link com.ryuqq.parallel.core.spi.ToolInvoker} over a name → tool map and is used by
 * the Contract Tests in {@code parallel-testkit}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Tools live only as long as the registry instance</li>
 *   <li>No credential or vault resolution</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.parallel.adapter.inmemory.tool;
