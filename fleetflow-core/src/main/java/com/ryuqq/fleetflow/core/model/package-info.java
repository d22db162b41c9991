/**
 * Value objects shared by every Fleetflow module.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleetflow.core.model.MessageId} - globally unique message identifier</li>
 *   <li>{@link com.ryuqq.fleetflow.core.model.CorrelationId} - workflow-scoped tracing identifier</li>
 *   <li>{@link com.ryuqq.fleetflow.core.model.EntityId} - key of the tracked entity (one live workflow per id)</li>
 *   <li>{@link com.ryuqq.fleetflow.core.model.Payload} - immutable key/value business data</li>
 *   <li>{@link com.ryuqq.fleetflow.core.model.Priority} - CRITICAL &gt; HIGH &gt; NORMAL &gt; LOW</li>
 *   <li>{@link com.ryuqq.fleetflow.core.model.MessageType} - closed set of message types</li>
 *   <li>{@link com.ryuqq.fleetflow.core.model.IngestionRecord} - one unit of new work from the ingestion source</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> every type is immutable once constructed</li>
 *   <li><strong>Fail-Fast:</strong> invalid values throw IllegalArgumentException at construction</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fleetflow Team
 */
package com.ryuqq.fleetflow.core.model;
