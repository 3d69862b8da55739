/**
 * Error code contract shared by engine exceptions.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.parallel.core.error;
