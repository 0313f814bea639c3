package work.lcod.foundation.config;

import java.nio.file.Path;

/**
 * Failure while loading, resolving or binding a configuration.
 *
 * <p>{@link #kind()} tells which step failed; {@link #detail()} carries the offending dotted path,
 * reference text or file path when there is one.
 */
public final class ConfigException extends RuntimeException {
    public enum Kind {
        FILE_NOT_FOUND,
        READ_ERROR,
        PARSE_ERROR,
        DESERIALIZE_ERROR,
        CIRCULAR_REFERENCE,
        REFERENCE_NOT_FOUND,
        INVALID_REFERENCE_PATH,
        NON_SCALAR_REFERENCE,
        UNCLOSED_REFERENCE
    }

    private final Kind kind;
    private final String detail;

    private ConfigException(Kind kind, String detail, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public Kind kind() {
        return kind;
    }

    public String detail() {
        return detail;
    }

    public static ConfigException fileNotFound(Path path) {
        return new ConfigException(Kind.FILE_NOT_FOUND, path.toString(), "required config file not found: " + path, null);
    }

    public static ConfigException readError(Path path, Throwable cause) {
        return new ConfigException(
            Kind.READ_ERROR,
            path.toString(),
            "failed to read config file '" + path + "': " + cause.getMessage(),
            cause
        );
    }

    public static ConfigException parseError(Path path, String reason, Throwable cause) {
        return new ConfigException(
            Kind.PARSE_ERROR,
            path.toString(),
            "failed to parse config file '" + path + "': " + reason,
            cause
        );
    }

    public static ConfigException deserializeError(Throwable cause) {
        return new ConfigException(Kind.DESERIALIZE_ERROR, null, "failed to deserialize config: " + cause.getMessage(), cause);
    }

    public static ConfigException circularReference() {
        return new ConfigException(Kind.CIRCULAR_REFERENCE, null, "circular reference detected in configuration", null);
    }

    public static ConfigException referenceNotFound(String path) {
        return new ConfigException(Kind.REFERENCE_NOT_FOUND, path, "referenced path not found: " + path, null);
    }

    public static ConfigException invalidReferencePath(String text) {
        return new ConfigException(Kind.INVALID_REFERENCE_PATH, text, "invalid reference path: " + text, null);
    }

    public static ConfigException nonScalarReference(String path) {
        return new ConfigException(Kind.NON_SCALAR_REFERENCE, path, "cannot reference non-scalar value: " + path, null);
    }

    public static ConfigException unclosedReference(String text) {
        return new ConfigException(Kind.UNCLOSED_REFERENCE, text, "unclosed reference (missing '}'): " + text, null);
    }
}
