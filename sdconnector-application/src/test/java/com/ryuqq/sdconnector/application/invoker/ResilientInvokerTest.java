package com.ryuqq.sdconnector.application.invoker;

import com.ryuqq.sdconnector.application.registry.OperationRegistry;
import com.ryuqq.sdconnector.core.exception.InvocationInterruptedException;
import com.ryuqq.sdconnector.core.exception.UnknownOperationException;
import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.retry.BackoffTimer;
import com.ryuqq.sdconnector.core.retry.RetryPolicy;
import com.ryuqq.sdconnector.core.spi.BoundOperation;
import com.ryuqq.sdconnector.core.spi.OperationBinder;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResilientInvoker 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>기본 정책은 최대 7회 시도</li>
 *   <li>대기 시간은 1초 이상이며 감소하지 않음</li>
 *   <li>모든 시도가 실패하면 마지막 예외를 그대로 다시 던짐</li>
 *   <li>Operation 조회 실패는 재시도하지 않음</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResilientInvokerTest {

    private static final String OPERATION = "GetPerson20111201";

    @Mock
    private OperationBinder binder;

    @Mock
    private BoundOperation operation;

    @Mock
    private BackoffTimer timer;

    private ResilientInvoker invoker;

    @BeforeEach
    void setUp() {
        OperationSpec spec = new OperationSpec(OPERATION + "Operation", "https://sd.example", "", "urn:sd", OPERATION);
        when(binder.describe("person.wsdl")).thenReturn(new ServiceDescriptor("person.wsdl", List.of(spec)));
        when(binder.bind(spec)).thenReturn(operation);
        invoker = new ResilientInvoker(
            new OperationRegistry(binder, List.of("person.wsdl")),
            RetryPolicy.defaults(),
            timer
        );
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void call_첫_시도에_성공하면_대기하지_않는다() throws Exception {
        // given
        ResponseRecord response = ResponseRecord.of(OPERATION, Map.of());
        when(operation.call(FieldMap.empty())).thenReturn(response);

        // when
        ResponseRecord result = invoker.call(OPERATION, FieldMap.empty());

        // then
        assertThat(result).isSameAs(response);
        verify(timer, never()).pause(any());
    }

    @Test
    void call_일시적_실패_후_성공() throws Exception {
        // given
        ResponseRecord response = ResponseRecord.of(OPERATION, Map.of());
        when(operation.call(any()))
            .thenThrow(new IllegalStateException("transient 1"))
            .thenThrow(new IllegalStateException("transient 2"))
            .thenReturn(response);

        // when
        ResponseRecord result = invoker.call(OPERATION, FieldMap.empty());

        // then
        assertThat(result).isSameAs(response);
        verify(operation, times(3)).call(any());
        verify(timer, times(2)).pause(any());
    }

    @Test
    void call_항상_실패하면_7회_시도_후_마지막_예외를_그대로_던진다() throws Exception {
        // given
        IllegalStateException last = new IllegalStateException("attempt 7");
        when(operation.call(any()))
            .thenThrow(new IllegalStateException("attempt 1"))
            .thenThrow(new IllegalStateException("attempt 2"))
            .thenThrow(new IllegalStateException("attempt 3"))
            .thenThrow(new IllegalStateException("attempt 4"))
            .thenThrow(new IllegalStateException("attempt 5"))
            .thenThrow(new IllegalStateException("attempt 6"))
            .thenThrow(last);

        // when & then
        assertThatThrownBy(() -> invoker.call(OPERATION, FieldMap.empty())).isSameAs(last);
        verify(operation, times(7)).call(any());

        ArgumentCaptor<Duration> delays = ArgumentCaptor.forClass(Duration.class);
        verify(timer, times(6)).pause(delays.capture());
        List<Duration> observed = delays.getAllValues();
        assertThat(observed).allSatisfy(delay -> assertThat(delay).isGreaterThanOrEqualTo(Duration.ofSeconds(1)));
        for (int i = 1; i < observed.size(); i++) {
            assertThat(observed.get(i)).isGreaterThanOrEqualTo(observed.get(i - 1));
        }
        assertThat(observed.get(0)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void call_바인딩되지_않은_이름은_재시도하지_않는다() throws Exception {
        assertThatThrownBy(() -> invoker.call("GetNothing", FieldMap.empty()))
            .isInstanceOf(UnknownOperationException.class);
        verify(operation, never()).call(any());
        verify(timer, never()).pause(any());
    }

    @Test
    void call_대기_중_인터럽트되면_InvocationInterruptedException() throws Exception {
        // given
        IllegalStateException failure = new IllegalStateException("down");
        when(operation.call(any())).thenThrow(failure);
        doThrow(new InterruptedException()).when(timer).pause(any());

        // when & then
        assertThatThrownBy(() -> invoker.call(OPERATION, FieldMap.empty()))
            .isInstanceOf(InvocationInterruptedException.class)
            .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(failure));
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(operation, times(1)).call(any());
    }

    @Test
    void call_Error는_재시도하지_않는다() throws Exception {
        // given
        AssertionError error = new AssertionError("bug");
        when(operation.call(any())).thenThrow(error);

        // when & then
        assertThatThrownBy(() -> invoker.call(OPERATION, FieldMap.empty())).isSameAs(error);
        verify(timer, never()).pause(any());
    }

    @Test
    void call_noRetry_정책은_한번만_시도() throws Exception {
        // given
        ResilientInvoker single = new ResilientInvoker(invoker.registry(), RetryPolicy.noRetry(), timer);
        IllegalStateException failure = new IllegalStateException("down");
        when(operation.call(any())).thenThrow(failure);

        // when & then
        assertThatThrownBy(() -> single.call(OPERATION, FieldMap.empty())).isSameAs(failure);
        verify(operation, times(1)).call(any());
        verify(timer, never()).pause(any());
    }
}
