package com.dcruver.docguide.exception;

/** Base exception for failures resolving or operating on a document address. */
public class AddressingException extends RuntimeException {

    private final String code;

    public AddressingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public AddressingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
