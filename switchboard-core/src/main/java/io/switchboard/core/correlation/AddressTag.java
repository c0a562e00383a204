package io.switchboard.core.correlation;

import io.switchboard.core.error.AddressFormatException;

/**
 * An owner's email address with a conversation id embedded in the local part,
 * {@code local+conversationId@domain}. The live-agent platform echoes the
 * address back on every event, which lets the relay recover the conversation
 * without any lookup table.
 */
public record AddressTag(String baseAddress, String conversationId) {
    private static final char DELIMITER = '+';

    public static String encode(String conversationId, String baseAddress) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new AddressFormatException("conversation id must not be blank");
        }
        if (conversationId.indexOf('@') >= 0) {
            throw new AddressFormatException("conversation id must not contain '@'");
        }
        String[] parts = splitAddress(baseAddress);
        return parts[0] + DELIMITER + conversationId + "@" + parts[1];
    }

    public static AddressTag decode(String token) {
        String[] parts = splitAddress(token);
        String local = parts[0];
        int delimiter = local.lastIndexOf(DELIMITER);
        if (delimiter < 0) {
            throw new AddressFormatException("address carries no conversation id: " + token);
        }
        String base = local.substring(0, delimiter);
        String conversationId = local.substring(delimiter + 1);
        if (base.isEmpty() || conversationId.isEmpty()) {
            throw new AddressFormatException("address has an empty base or conversation id: " + token);
        }
        return new AddressTag(base + "@" + parts[1], conversationId);
    }

    public String encoded() {
        return encode(conversationId, baseAddress);
    }

    private static String[] splitAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new AddressFormatException("address must not be blank");
        }
        String trimmed = address.trim();
        int at = trimmed.indexOf('@');
        if (at < 0 || at != trimmed.lastIndexOf('@')) {
            throw new AddressFormatException("address must contain exactly one '@': " + address);
        }
        String local = trimmed.substring(0, at);
        String domain = trimmed.substring(at + 1);
        if (local.isEmpty() || domain.isEmpty()) {
            throw new AddressFormatException("address has an empty local part or domain: " + address);
        }
        return new String[] {local, domain};
    }
}
