package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingConfig(@JsonAlias({"history_window"}) int historyWindow) {

    public static RoutingConfig defaults() {
        return new RoutingConfig(5);
    }
}
