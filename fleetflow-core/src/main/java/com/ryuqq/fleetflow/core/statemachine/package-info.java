/**
 * Workflow state machine package.
 *
 * <p>Transitions are modelled as {@code (WorkflowState, WorkflowTrigger)} pairs. Only the
 * pairs listed below are accepted; everything else is rejected.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleetflow.core.statemachine.WorkflowState} - workflow lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.fleetflow.core.statemachine.WorkflowTrigger} - events with their allowed sources and target</li>
 *   <li>{@link com.ryuqq.fleetflow.core.statemachine.WorkflowTransition} - validation and execution</li>
 * </ul>
 *
 * <h2>Transition Table</h2>
 * <pre>
 * IDLE               --NEW_INPUT-----------> ANALYZING
 * ANALYZING          --ANALYSIS_RESULT-----> ASSESSING
 * ASSESSING          --ENGAGEMENT_REQUIRED-> ENGAGING
 * ASSESSING          --NO_ACTION_REQUIRED--> COMPLETED
 * ENGAGING           --ENGAGEMENT_ACCEPTED-> SCHEDULING
 * ENGAGING           --ENGAGEMENT_DECLINED-> COMPLETED
 * SCHEDULING         --BOOKING_CONFIRMED---> AWAITING_EXTERNAL
 * AWAITING_EXTERNAL  --EXTERNAL_COMPLETION-> COLLECTING_OUTCOME
 * COLLECTING_OUTCOME --OUTCOME_RECORDED----> COMPLETED
 * (any but COMPLETED/ERROR) --FAILURE-----> ERROR
 * ERROR              --RETRY---------------> IDLE
 * ERROR              --RETRIES_EXHAUSTED---> COMPLETED
 * </pre>
 *
 * @since 1.0.0
 * @author Fleetflow Team
 */
package com.ryuqq.fleetflow.core.statemachine;
