package io.switchboard.core.external;

public enum VendorEventKind {
    TEXT,
    STRUCTURED,
    RECEIPT,
    TYPING,
    UNKNOWN;

    /**
     * Kinds that carry text for the customer.
     */
    public boolean carriesText() {
        return this == TEXT || this == STRUCTURED;
    }
}
