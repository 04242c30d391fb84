package net.relaytrace.ErrorCorrelation;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * What the error-monitoring backend receives for one failed message: the error itself
 * and the ids of the span it was recorded on, so the two systems can be cross-referenced.
 */
@Getter
@Builder
@ToString(exclude = "throwable")
public class ErrorReport {

    private final String traceId;
    private final String spanId;
    private final boolean sampled;
    /** Fully qualified class name of the error. */
    private final String errorType;
    private final String errorMessage;
    /** Grouping key components, see {@link ErrorFingerprintGenerator}. */
    @Singular("fingerprintComponent")
    private final List<String> fingerprint;
    /** Message context, e.g. message.kind and message.name. */
    @Singular
    private final Map<String, String> tags;
    /** Metadata of the failed message, minus the trace context carrier keys. */
    @Singular("metadataEntry")
    private final Map<String, String> metadata;
    private final Throwable throwable;
}
