package io.switchboard.core.routing;

/**
 * @param historyWindow number of recent transcript entries given to the oracle
 * @param fromAddress   sender address used for every message sent to the live-agent platform
 */
public record RelaySettings(int historyWindow, String fromAddress) {
    public static final int DEFAULT_HISTORY_WINDOW = 5;

    public RelaySettings {
        historyWindow = historyWindow <= 0 ? DEFAULT_HISTORY_WINDOW : historyWindow;
        fromAddress = fromAddress == null ? "" : fromAddress.trim();
    }
}
