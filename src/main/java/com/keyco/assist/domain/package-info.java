/**
 * Immutable domain model of the assist core.
 *
 * <p>Candidates, fingerprints and published outcomes are records; nothing in this package holds
 * mutable state. Session state lives in {@code service.orchestration} and breaker state in
 * {@code service.resilience}.
 */
package com.keyco.assist.domain;
