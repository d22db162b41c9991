/**
 * Wire contract between the orchestrator and its collaborators.
 *
 * <p>{@link com.ryuqq.fleetflow.core.contract.Message} is the immutable envelope every
 * component publishes; {@link com.ryuqq.fleetflow.core.contract.Channel} names the delivery
 * points; {@link com.ryuqq.fleetflow.core.contract.Stage} binds each collaborator stage to its
 * request/result channel pair.</p>
 *
 * <h2>Channel Map</h2>
 * <pre>
 * analysis.request    → analysis collaborator   → analysis.result
 * engagement.request  → engagement collaborator → engagement.result
 * scheduling.request  → scheduling collaborator → scheduling.result
 * service.completion  ← external completion signal (no request)
 * feedback.request    → feedback collaborator   → feedback.result
 *
 * system.error        ← broadcast failures (orchestrator and collaborators)
 * system.timeout      ← deadline expiries published by the orchestrator
 * quality.insight     ← terminal workflow outcomes
 * </pre>
 *
 * @since 1.0.0
 * @author Fleetflow Team
 */
package com.ryuqq.fleetflow.core.contract;
