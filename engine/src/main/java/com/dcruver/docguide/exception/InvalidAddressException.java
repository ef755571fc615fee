package com.dcruver.docguide.exception;

/** Exception thrown when an address string is malformed or unsafe. */
public class InvalidAddressException extends AddressingException {

    private final String input;

    public InvalidAddressException(String input, String reason) {
        super("INVALID_ADDRESS", "Invalid address '" + input + "': " + reason);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
