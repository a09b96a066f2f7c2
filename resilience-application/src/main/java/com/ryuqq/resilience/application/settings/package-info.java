/**
 * 리소스 단위 보호 설정.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.settings;
