package com.synthetic.solvency.domain.exception;

/**
 * Terminal failure of a single solvency operation. Whatever the code, the
 * operation that raised it has left no state behind.
 */
public class SolvencyException extends RuntimeException {

    private final SolvencyErrorCode code;

    public SolvencyException(SolvencyErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public SolvencyException(SolvencyErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public SolvencyErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "SolvencyException{code=" + code + ", message=" + getMessage() + "}";
    }
}
