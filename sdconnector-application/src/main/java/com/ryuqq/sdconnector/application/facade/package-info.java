/**
 * SD 조회 Facade.
 *
 * <p>{@link com.ryuqq.sdconnector.application.facade.Routes} 표에 따라
 * 정규화 후 호출만 수행하며 다른 로직은 없습니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
package com.ryuqq.sdconnector.application.facade;
