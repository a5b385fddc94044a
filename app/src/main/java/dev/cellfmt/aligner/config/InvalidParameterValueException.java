package dev.cellfmt.aligner.config;

/**
 * Runtime exception raised when a configuration value is rejected before any document is processed.
 */
public class InvalidParameterValueException extends RuntimeException {

    private final String parameter;
    private final String value;

    public InvalidParameterValueException(String parameter, String value, String allowedValues) {
        super("Invalid value '" + value + "' for parameter '" + parameter + "'. " + allowedValues);
        this.parameter = parameter;
        this.value = value;
    }

    public InvalidParameterValueException(String parameter, String value, String allowedValues, Throwable cause) {
        this(parameter, value, allowedValues);
        initCause(cause);
    }

    public String parameter() {
        return parameter;
    }

    public String value() {
        return value;
    }
}
