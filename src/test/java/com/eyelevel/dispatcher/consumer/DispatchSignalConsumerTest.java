package com.eyelevel.dispatcher.consumer;

import com.eyelevel.dispatcher.dispatch.DispatchOutcome;
import com.eyelevel.dispatcher.dispatch.Dispatcher;
import com.eyelevel.dispatcher.dto.message.DispatchSignal;
import com.eyelevel.dispatcher.dto.message.ResultPayload;
import com.eyelevel.dispatcher.dto.message.ServiceTask;
import com.eyelevel.dispatcher.dto.message.SignalType;
import com.eyelevel.dispatcher.exception.MessageProcessingFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchSignalConsumerTest {

    private static final ServiceTask TASK = new ServiceTask("sid-1", "abc", "text/plain", "Strings", "1", "h",
                                                            Map.of(), 1);

    @Mock
    private Dispatcher dispatcher;

    @InjectMocks
    private DispatchSignalConsumer consumer;

    @Test
    void onSignal_routesEachSignalType() {
        ResultPayload result = new ResultPayload(Map.of("score", 1), List.of());
        when(dispatcher.serviceFinished(TASK, result)).thenReturn(DispatchOutcome.ACCEPTED);
        when(dispatcher.serviceFailed(TASK, "boom")).thenReturn(DispatchOutcome.RETRIED);
        when(dispatcher.cancelTask("sid-1", "abc", "Strings")).thenReturn(DispatchOutcome.CANCELLED);
        when(dispatcher.cancelSubmission("sid-1")).thenReturn(DispatchOutcome.IGNORED_DUPLICATE);

        consumer.onSignal(DispatchSignal.finished(TASK, result));
        consumer.onSignal(DispatchSignal.failed(TASK, "boom"));
        consumer.onSignal(DispatchSignal.cancelTask("sid-1", "abc", "Strings"));
        consumer.onSignal(DispatchSignal.cancelSubmission("sid-1"));

        verify(dispatcher).serviceFinished(TASK, result);
        verify(dispatcher).serviceFailed(TASK, "boom");
        verify(dispatcher).cancelTask("sid-1", "abc", "Strings");
        verify(dispatcher).cancelSubmission("sid-1");
    }

    @Test
    void onSignal_dropsIncompleteSignals() {
        consumer.onSignal(null);
        consumer.onSignal(new DispatchSignal(null, TASK, null, null, "sid-1", null, null));
        consumer.onSignal(new DispatchSignal(SignalType.FINISHED, null, null, null, "sid-1", "abc", "Strings"));
        consumer.onSignal(new DispatchSignal(SignalType.FAILED, new ServiceTask("sid-1", "", "text/plain", "Strings",
                                                                                "1", "h", Map.of(), 1),
                                             null, "boom", "sid-1", "", "Strings"));
        consumer.onSignal(DispatchSignal.cancelTask("sid-1", "abc", " "));
        consumer.onSignal(DispatchSignal.cancelSubmission(""));

        verifyNoInteractions(dispatcher);
    }

    @Test
    void onSignal_rethrowsDispatchErrorsForRedelivery() {
        when(dispatcher.serviceFinished(any(), any())).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> consumer.onSignal(DispatchSignal.finished(TASK, null)))
                .isInstanceOf(MessageProcessingFailedException.class)
                .hasRootCauseMessage("db down");
    }
}
