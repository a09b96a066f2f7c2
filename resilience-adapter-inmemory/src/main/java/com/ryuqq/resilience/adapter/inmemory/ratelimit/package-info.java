/**
 * In-memory burst-then-pace rate limiter.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.ratelimit;
