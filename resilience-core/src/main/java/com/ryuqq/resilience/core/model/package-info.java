/**
 * 보호 계층의 기본 값 객체 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.model.ResourceId} - 보호 대상 리소스 식별자</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
