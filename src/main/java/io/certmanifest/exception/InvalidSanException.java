package io.certmanifest.exception;

/**
 * Subject alternative name with an unknown type prefix or an unparseable value.
 */
public class InvalidSanException extends ValidationException {
    private final String value;

    public InvalidSanException(String message, String value) {
        this(message, value, null);
    }

    public InvalidSanException(String message, String value, Throwable cause) {
        super(message, ErrorCode.INVALID_SAN, "sans", cause);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
