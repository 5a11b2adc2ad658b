/**
 * Operation Registry.
 *
 * <p>서비스 디스크립터를 한 번 가져와 Canonical 이름 → 호출 핸들로 바인딩합니다.
 * 블로킹 {@link com.ryuqq.sdconnector.application.registry.OperationRegistry}와
 * 비블로킹 {@link com.ryuqq.sdconnector.application.registry.AsyncOperationRegistry}가
 * 같은 검증/바인딩 규칙을 공유합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
package com.ryuqq.sdconnector.application.registry;
