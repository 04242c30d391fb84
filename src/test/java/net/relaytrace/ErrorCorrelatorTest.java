package net.relaytrace;

import io.opentelemetry.api.trace.SpanKind;
import net.relaytrace.ErrorCorrelation.ErrorCorrelator;
import net.relaytrace.ErrorCorrelation.ErrorFingerprintGenerator;
import net.relaytrace.ErrorCorrelation.ErrorReport;
import net.relaytrace.ErrorCorrelation.ErrorReporter;
import net.relaytrace.Message.MessageKind;
import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Tracing.AttributeValue;
import net.relaytrace.Tracing.RecordingSpan;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.SpanProcessor;
import net.relaytrace.Tracing.SpanStatus;
import net.relaytrace.Tracing.TraceContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ErrorCorrelatorTest {

    @Mock
    private ErrorReporter errorReporter;

    @Mock
    private TracingMetricsRecorder metricsRecorder;

    private ErrorCorrelator errorCorrelator;
    private RecordingSpan span;

    @BeforeEach
    void setUp() {
        errorCorrelator = new ErrorCorrelator(errorReporter, new ErrorFingerprintGenerator(), metricsRecorder);
        span = new RecordingSpan("Handle: CreateOrder", SpanKind.SERVER, TraceContext.newRoot(true), null,
                Clock.systemUTC(), true, SpanProcessor.NOOP);
    }

    @Test
    void testExceptionIsRecordedOnSpan() {
        IllegalStateException failure = new IllegalStateException("Account 42 not found");

        errorCorrelator.recordException(span, failure);

        assertEquals(SpanStatus.ERROR, span.getStatus());
        assertEquals("Account 42 not found", span.getStatusDescription());
        assertEquals(AttributeValue.of(true), span.getAttribute(SpanAttributes.ERROR));
        assertEquals(AttributeValue.of(IllegalStateException.class.getName()), span.getAttribute(SpanAttributes.ERROR_TYPE));
        assertEquals(AttributeValue.of("Account 42 not found"), span.getAttribute(SpanAttributes.ERROR_MESSAGE));
        assertEquals(1, span.getExceptionEvents().size());
        assertNotNull(span.getExceptionEvents().get(0).getStacktrace());
    }

    @Test
    void testExceptionWithoutMessageUsesTypeName() {
        errorCorrelator.recordException(span, new NullPointerException());

        assertEquals("NullPointerException", span.getStatusDescription());
    }

    @Test
    void testReportCarriesSpanIdsAndMessageTags() {
        TracedMessage message = TracedMessage.builder()
                .identifier("msg-1")
                .kind(MessageKind.COMMAND)
                .name("CreateOrder")
                .payload("p")
                .build();
        IllegalArgumentException failure = new IllegalArgumentException("Insufficient funds");

        errorCorrelator.recordException(span, failure, message);

        ArgumentCaptor<ErrorReport> captor = ArgumentCaptor.forClass(ErrorReport.class);
        verify(errorReporter).reportError(captor.capture());
        ErrorReport report = captor.getValue();
        assertEquals(span.getTraceId(), report.getTraceId());
        assertEquals(span.getSpanId(), report.getSpanId());
        assertTrue(report.isSampled());
        assertEquals(IllegalArgumentException.class.getName(), report.getErrorType());
        assertEquals("Insufficient funds", report.getErrorMessage());
        assertSame(failure, report.getThrowable());
        assertEquals(Map.of(
                SpanAttributes.MESSAGE_KIND, "command",
                SpanAttributes.MESSAGING_MESSAGE_ID, "msg-1",
                SpanAttributes.MESSAGE_NAME, "CreateOrder"), report.getTags());
        assertEquals("IllegalArgumentException", report.getFingerprint().get(0));
        assertTrue(report.getFingerprint().contains(MessageKind.COMMAND.getVerb()));
    }

    @Test
    void testReporterFailureIsCountedAndSwallowed() {
        doThrow(new RuntimeException("backend unreachable")).when(errorReporter).reportError(any());

        assertDoesNotThrow(() -> errorCorrelator.recordException(span, new IllegalStateException("boom")));

        assertEquals(SpanStatus.ERROR, span.getStatus());
        verify(metricsRecorder).recordErrorReportFailure();
    }

    @Test
    void testReporterLinkageErrorIsCountedAndSwallowed() {
        doThrow(new NoClassDefFoundError("io/sentry/Sentry")).when(errorReporter).reportError(any());

        assertDoesNotThrow(() -> errorCorrelator.recordException(span, new IllegalStateException("boom")));

        assertEquals(SpanStatus.ERROR, span.getStatus());
        assertEquals(1, span.getExceptionEvents().size());
        verify(metricsRecorder).recordErrorReportFailure();
    }

    @Test
    void testReportCarriesMessageMetadataAndCorrelationIds() {
        TracedMessage message = TestMessages.message(MessageKind.EVENT, "p", Map.of(
                "traceparent", "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01",
                "baggage", "tenant=acme",
                "correlationId", "corr-1",
                "transactionId", "tx-1",
                "userId", "u-7"));

        errorCorrelator.recordException(span, new IllegalStateException("projection failed"), message);

        ArgumentCaptor<ErrorReport> captor = ArgumentCaptor.forClass(ErrorReport.class);
        verify(errorReporter).reportError(captor.capture());
        ErrorReport report = captor.getValue();
        assertEquals(Map.of("correlationId", "corr-1", "transactionId", "tx-1", "userId", "u-7"), report.getMetadata());
        assertEquals("corr-1", report.getTags().get(SpanAttributes.CORRELATION_ID));
        assertEquals("tx-1", report.getTags().get(SpanAttributes.TRANSACTION_ID));
    }
}
