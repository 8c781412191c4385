/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.keyco.assist.exception.AssistException} - Base exception for all
 *       application-specific errors</li>
 *   <li>{@link com.keyco.assist.exception.TransportException} - A backend call failed; carries the
 *       {@link com.keyco.assist.domain.FailureKind} the retry and breaker policies act on</li>
 *   <li>{@link com.keyco.assist.exception.SessionNotFoundException} - Unknown or closed session</li>
 *   <li>{@link com.keyco.assist.exception.InvalidAssistRequestException} - Unusable command from
 *       the input surface</li>
 *   <li>{@link com.keyco.assist.exception.SnippetSourceException} - Shared snippet container
 *       unreadable</li>
 * </ul>
 *
 * <p>Transport exceptions never escape the orchestration layer; they are classified into an
 * {@link com.keyco.assist.domain.AssistFailure}. The others map to HTTP responses via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.keyco.assist.exception.AssistException
 */
package com.keyco.assist.exception;
