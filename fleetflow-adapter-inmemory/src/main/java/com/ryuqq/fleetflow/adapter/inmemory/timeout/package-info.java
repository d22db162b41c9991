/**
 * 데드라인 관리 in-memory 구현.
 *
 * @since 1.0.0
 */
package com.ryuqq.fleetflow.adapter.inmemory.timeout;
