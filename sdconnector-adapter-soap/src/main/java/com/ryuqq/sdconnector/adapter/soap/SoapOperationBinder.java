package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.spi.BoundOperation;
import com.ryuqq.sdconnector.core.spi.OperationBinder;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;

/**
 * {@link SoapSession} 기반 블로킹 Operation Binder.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SoapOperationBinder implements OperationBinder {

    private final SoapSession session;

    public SoapOperationBinder(SoapSession session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        this.session = session;
    }

    @Override
    public ServiceDescriptor describe(String locator) {
        return session.describe(locator);
    }

    @Override
    public BoundOperation bind(OperationSpec operation) {
        return fields -> session.call(operation, fields);
    }
}
