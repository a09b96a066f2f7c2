/**
 * Permit-based bulkhead shared by blocking and async callers.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.adapter.inmemory.bulkhead.InMemoryBulkhead}: the {@code Bulkhead} implementation</li>
 *   <li>{@code PermitPool}: FIFO permit pool with blocking and future-based acquisition</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Limits apply per instance only; nothing is coordinated across processes</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.bulkhead;
