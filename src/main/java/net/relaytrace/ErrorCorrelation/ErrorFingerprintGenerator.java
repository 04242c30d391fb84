package net.relaytrace.ErrorCorrelation;

import net.relaytrace.Message.MessageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds a stable grouping key for an error, so "Account 123 not found" and
 * "Account 456 not found" land in the same group while different exception types or
 * throw sites stay apart.
 *
 * Components, in order and without duplicates: exception simple name, message kind verb
 * (when known), normalised message, top stack frame.
 */
public class ErrorFingerprintGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ErrorFingerprintGenerator.class);

    private static final Pattern UUID_PATTERN =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\b\\d+(\\.\\d+)?\\b");
    private static final Pattern QUOTED_STRING_PATTERN = Pattern.compile("\"[^\"]*\"");

    static final int MAX_MESSAGE_LENGTH = 100;

    public List<String> generateFingerprint(Throwable exception) {
        return generateFingerprint(exception, null);
    }

    public List<String> generateFingerprint(Throwable exception, @Nullable MessageKind kind) {
        try {
            List<String> components = new ArrayList<>();
            components.add(exception.getClass().getSimpleName());
            if (kind != null) {
                components.add(kind.getVerb());
            }
            if (exception.getMessage() != null) {
                String normalized = normalizeMessage(exception.getMessage());
                if (!normalized.isEmpty()) {
                    components.add(normalized);
                }
            }
            StackTraceElement[] stackTrace = exception.getStackTrace();
            if (stackTrace.length > 0) {
                components.add(stackTrace[0].getClassName() + "." + stackTrace[0].getMethodName());
            }
            return components.stream().distinct().toList();
        } catch (RuntimeException e) {
            logger.warn("failed to generate error fingerprint: {}", e.getMessage());
            return List.of(exception.getClass().getSimpleName());
        }
    }

    static String normalizeMessage(String message) {
        // UUIDs first, their digit groups would otherwise match as numbers
        String normalized = UUID_PATTERN.matcher(message).replaceAll("{uuid}");
        normalized = NUMBER_PATTERN.matcher(normalized).replaceAll("{number}");
        normalized = QUOTED_STRING_PATTERN.matcher(normalized).replaceAll("{string}");
        if (normalized.length() > MAX_MESSAGE_LENGTH) {
            normalized = normalized.substring(0, MAX_MESSAGE_LENGTH);
        }
        return normalized;
    }
}
