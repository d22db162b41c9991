package com.ryuqq.fleetflow.core.workflow;

import com.ryuqq.fleetflow.core.statemachine.WorkflowState;

/**
 * 워크플로 전이 이력 한 건.
 *
 * @param from 출발 상태
 * @param to 도착 상태
 * @param timestamp 전이 시각 (epoch millis)
 * @param reason 전이 사유
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record TransitionRecord(WorkflowState from, WorkflowState to, long timestamp, String reason) {

    public TransitionRecord {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (reason == null) {
            reason = "";
        }
    }
}
