/**
 * In-memory circuit breaker.
 *
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.circuitbreaker;
