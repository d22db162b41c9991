/**
 * Per-entity workflow aggregate.
 *
 * <p>{@link com.ryuqq.fleetflow.core.workflow.Workflow} holds the state, retry/error counters,
 * stage context and transition history of one tracked entity. It is mutated only by the
 * orchestration loop, and every mutation is serialised by the workflow's own lock.</p>
 *
 * @since 1.0.0
 * @author Fleetflow Team
 */
package com.ryuqq.fleetflow.core.workflow;
