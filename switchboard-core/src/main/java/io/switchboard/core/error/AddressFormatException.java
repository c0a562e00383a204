package io.switchboard.core.error;

public final class AddressFormatException extends RelayException {

    public AddressFormatException(String message) {
        super("invalid_address", 400, message);
    }
}
