package com.synthetic.cycleengine.domain.exception;

/**
 * Thrown by every guard in the engine before any state is touched, so a caught
 * exception always means the operation had no effect.
 */
public class ProtocolException extends RuntimeException {

    private final ErrorCode code;

    public ProtocolException(ErrorCode code) {
        this(code, code.defaultMessage());
    }

    public ProtocolException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static ProtocolException of(ErrorCode code, String format, Object... args) {
        return new ProtocolException(code, code.defaultMessage() + ": " + String.format(format, args));
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return code.kind();
    }
}
