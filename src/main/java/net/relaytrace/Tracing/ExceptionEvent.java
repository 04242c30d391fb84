package net.relaytrace.Tracing;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;

/**
 * An exception recorded on a span.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "stacktrace")
public final class ExceptionEvent {

    /** Fully qualified class name of the exception. */
    private final String type;

    @Nullable
    private final String message;

    @Nullable
    private final String stacktrace;

    private final Instant timestamp;

    public ExceptionEvent(String type, @Nullable String message, @Nullable String stacktrace, Instant timestamp) {
        this.type = type;
        this.message = message;
        this.stacktrace = stacktrace;
        this.timestamp = timestamp;
    }

    public static ExceptionEvent of(Throwable exception, Instant timestamp, boolean attachStacktrace) {
        return new ExceptionEvent(
                exception.getClass().getName(),
                exception.getMessage(),
                attachStacktrace ? stacktraceOf(exception) : null,
                timestamp);
    }

    private static String stacktraceOf(Throwable exception) {
        StringWriter writer = new StringWriter();
        exception.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
