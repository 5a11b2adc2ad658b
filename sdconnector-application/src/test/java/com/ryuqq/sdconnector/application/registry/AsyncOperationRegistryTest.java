package com.ryuqq.sdconnector.application.registry;

import com.ryuqq.sdconnector.core.exception.RegistryConstructionException;
import com.ryuqq.sdconnector.core.spi.AsyncBoundOperation;
import com.ryuqq.sdconnector.core.spi.AsyncOperationBinder;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * AsyncOperationRegistry 유닛 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AsyncOperationRegistryTest {

    @Mock
    private AsyncOperationBinder binder;

    @Test
    void create_모든_Operation이_바인딩된_뒤_완료() {
        // given
        OperationSpec spec = new OperationSpec("GetPerson20111201Operation", "https://sd.example", "", "urn:sd", "GetPerson20111201");
        AsyncBoundOperation operation = mock(AsyncBoundOperation.class);
        when(binder.describe("person.wsdl"))
            .thenReturn(CompletableFuture.completedFuture(new ServiceDescriptor("person.wsdl", List.of(spec))));
        when(binder.bind(spec)).thenReturn(operation);

        // when
        AsyncOperationRegistry registry = AsyncOperationRegistry.create(binder, List.of("person.wsdl")).join();

        // then
        assertThat(registry.names()).containsExactly("GetPerson20111201");
        assertThat(registry.lookup("GetPerson20111201")).isSameAs(operation);
    }

    @Test
    void create_디스크립터_실패시_Binder를_해제하고_실패() {
        // given
        when(binder.describe("down.wsdl"))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));

        // when
        CompletableFuture<AsyncOperationRegistry> future = AsyncOperationRegistry.create(binder, List.of("down.wsdl"));

        // then
        assertThatThrownBy(future::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(RegistryConstructionException.class);
        verify(binder).close();
        verify(binder, never()).bind(any());
    }

    @Test
    void close_두번_호출해도_Binder는_한번만_해제() {
        // given
        OperationSpec spec = new OperationSpec("GetPerson20111201Operation", "https://sd.example", "", "urn:sd", "GetPerson20111201");
        when(binder.describe("person.wsdl"))
            .thenReturn(CompletableFuture.completedFuture(new ServiceDescriptor("person.wsdl", List.of(spec))));
        when(binder.bind(spec)).thenReturn(mock(AsyncBoundOperation.class));
        AsyncOperationRegistry registry = AsyncOperationRegistry.create(binder, List.of("person.wsdl")).join();

        // when
        registry.close();
        registry.close();

        // then
        verify(binder, times(1)).close();
        assertThat(registry.isClosed()).isTrue();
        assertThatThrownBy(() -> registry.lookup("GetPerson20111201"))
            .isInstanceOf(IllegalStateException.class);
    }
}
