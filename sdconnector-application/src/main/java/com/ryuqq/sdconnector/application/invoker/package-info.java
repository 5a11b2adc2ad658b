/**
 * Resilient Invoker.
 *
 * <p>Registry에서 조회한 Operation을 재시도 정책(기본 7회, 지수 백오프)에 따라 호출합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
package com.ryuqq.sdconnector.application.invoker;
