package net.relaytrace.Tracing;

/**
 * Attribute keys and well-known values written on message spans.
 */
public final class SpanAttributes {

    private SpanAttributes() {
    }

    // OpenTelemetry messaging conventions
    public static final String MESSAGING_SYSTEM = "messaging.system";
    public static final String MESSAGING_OPERATION = "messaging.operation";
    public static final String MESSAGING_MESSAGE_ID = "messaging.message.id";

    // Message specific
    /** The message-kind tag: one of command, query or event. */
    public static final String MESSAGE_KIND = "message.kind";
    public static final String MESSAGE_NAME = "message.name";
    public static final String MESSAGE_PAYLOAD_TYPE = "message.payload_type";
    public static final String MESSAGE_PAYLOAD = "message.payload";
    public static final String MESSAGE_HANDLER = "message.handler";
    public static final String MESSAGE_DURATION_NS = "message.duration_ns";
    public static final String MESSAGE_RESULT_TYPE = "message.result_type";
    public static final String MESSAGE_RESULT = "message.result";
    public static final String MESSAGE_RESULT_COUNT = "message.result_count";

    // Correlation
    public static final String CORRELATION_ID = "correlation.id";
    public static final String TRANSACTION_ID = "transaction.id";

    // Error tracking
    public static final String ERROR = "error";
    public static final String ERROR_TYPE = "error.type";
    public static final String ERROR_MESSAGE = "error.message";

    public static final String SYSTEM_NAME = "relaytrace";

    public static final String OPERATION_SEND = "send";
    public static final String OPERATION_PROCESS = "process";

    public static final String RESULT_TYPE_VOID = "void";
}
