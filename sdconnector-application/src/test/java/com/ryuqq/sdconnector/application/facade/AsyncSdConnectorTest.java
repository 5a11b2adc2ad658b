package com.ryuqq.sdconnector.application.facade;

import com.ryuqq.sdconnector.application.invoker.AsyncResilientInvoker;
import com.ryuqq.sdconnector.application.registry.AsyncOperationRegistry;
import com.ryuqq.sdconnector.core.exception.ResourceReleaseException;
import com.ryuqq.sdconnector.core.model.OperationNames;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.normalizer.ParameterNormalizer;
import com.ryuqq.sdconnector.core.query.PersonQuery;
import com.ryuqq.sdconnector.core.query.ProfessionQuery;
import com.ryuqq.sdconnector.core.retry.BackoffTimer;
import com.ryuqq.sdconnector.core.retry.RetryPolicy;
import com.ryuqq.sdconnector.core.spi.AsyncBoundOperation;
import com.ryuqq.sdconnector.core.spi.AsyncOperationBinder;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * AsyncSdConnector 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AsyncSdConnectorTest {

    @Mock
    private AsyncOperationBinder binder;

    @Mock
    private BackoffTimer timer;

    private AsyncSdConnector connector;

    @BeforeEach
    void setUp() {
        when(binder.describe(anyString())).thenAnswer(invocation -> {
            String name = invocation.getArgument(0);
            return CompletableFuture.completedFuture(new ServiceDescriptor(name, List.of(
                new OperationSpec(name + "Operation", "https://sd.example", "", "urn:sd", name)
            )));
        });
        when(binder.bind(any())).thenAnswer(invocation -> {
            OperationSpec spec = invocation.getArgument(0);
            return (AsyncBoundOperation) fields ->
                CompletableFuture.completedFuture(ResponseRecord.of(spec.requestElement(), Map.of()));
        });

        AsyncOperationRegistry registry = AsyncOperationRegistry.create(binder, OperationNames.EXPOSED).join();
        connector = new AsyncSdConnector(
            new AsyncResilientInvoker(registry, RetryPolicy.defaults(), timer),
            new ParameterNormalizer()
        );
    }

    @Test
    void getPerson_GetPerson20111201로_완료() {
        ResponseRecord response = connector.getPerson(PersonQuery.of("XY")).join();

        assertThat(response.name()).isEqualTo("GetPerson20111201");
    }

    @Test
    void null_조회조건은_실패한_Future() {
        CompletableFuture<ResponseRecord> future = connector.getProfession((ProfessionQuery) null);

        assertThatThrownBy(future::join).hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void close_전송_자원을_해제() {
        // when
        connector.close();

        // then
        verify(binder).close();
    }

    @Test
    void close_해제_실패는_ResourceReleaseException으로_전파() {
        // given
        ResourceReleaseException failure = new ResourceReleaseException("worker pool did not terminate within 60000ms");
        doThrow(failure).when(binder).close();

        // when & then
        assertThatThrownBy(connector::close).isSameAs(failure);
        connector.close();
        verify(binder, times(1)).close();
    }
}
