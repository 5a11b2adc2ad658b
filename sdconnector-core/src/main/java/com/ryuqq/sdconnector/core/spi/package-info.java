/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the seams that transport adapters implement so the
 * Operation Registry can discover and bind remote operations without knowing
 * how descriptors are fetched or how calls travel over the wire.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sdconnector.core.spi.OperationBinder} - blocking descriptor fetch and binding</li>
 *   <li>{@link com.ryuqq.sdconnector.core.spi.AsyncOperationBinder} - non-blocking variant that owns releasable transport resources</li>
 *   <li>{@link com.ryuqq.sdconnector.core.spi.BoundOperation} / {@link com.ryuqq.sdconnector.core.spi.AsyncBoundOperation} - callable handles</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., sdconnector-adapter-soap, sdconnector-testkit) provide
 * concrete implementations of these SPIs.</p>
 *
 * @since 1.0.0
 * @author SD Connector Team
 */
package com.ryuqq.sdconnector.core.spi;
