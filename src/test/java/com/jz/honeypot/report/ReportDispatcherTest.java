package com.jz.honeypot.report;

import com.jz.honeypot.config.CallbackProperties;
import com.jz.honeypot.domain.dto.FinalReportDTO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ReportDispatcherTest {

    @Mock
    private FinalReportClient client;

    private final FinalReportDTO report = FinalReportDTO.builder().sessionId("d1").build();

    @Test
    void disabledCallbackSkipsClient() {
        CallbackProperties props = new CallbackProperties();
        props.setUrl("http://callback.test");

        new ReportDispatcher(client, props).dispatch(report);

        verify(client, never()).send(any());
    }

    @Test
    void blankUrlSkipsClient() {
        CallbackProperties props = new CallbackProperties();
        props.setEnabled(true);
        props.setUrl(" ");

        new ReportDispatcher(client, props).dispatch(report);

        verify(client, never()).send(any());
    }

    @Test
    void enabledCallbackSends() {
        CallbackProperties props = new CallbackProperties();
        props.setEnabled(true);
        props.setUrl("http://callback.test");

        new ReportDispatcher(client, props).dispatch(report);

        verify(client).send(report);
    }
}
