package io.switchboard.core.api;

import io.switchboard.core.error.UnauthorizedException;
import io.switchboard.core.model.Owner;
import io.switchboard.core.owner.OwnerStore;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Resolves the caller's owner identity from a bearer token. HTTP requests are
 * authenticated per call; WebSocket connections once at connect.
 */
public final class RequestAuthenticator {
    private static final Logger LOG = LoggerFactory.getLogger(RequestAuthenticator.class);
    private static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");
    private static final String BEARER_PREFIX = "bearer ";

    private final OwnerStore owners;

    public RequestAuthenticator(OwnerStore owners) {
        this.owners = Objects.requireNonNull(owners, "owners must not be null");
    }

    /**
     * @param authorizationHeader raw {@code Authorization} header, may be blank
     * @param queryToken          {@code token} query parameter, may be blank
     */
    public Owner authenticate(String authorizationHeader, String queryToken) throws IOException {
        String token = extractToken(authorizationHeader, queryToken);
        if (token.isBlank()) {
            throw new UnauthorizedException("Missing API token");
        }
        return owners.findByToken(token).orElseThrow(() -> {
            LOG.warn(SECURITY, "Rejected request with unknown API token");
            return new UnauthorizedException("Unknown API token");
        });
    }

    static String extractToken(String authorizationHeader, String queryToken) {
        if (authorizationHeader != null) {
            String header = authorizationHeader.trim();
            if (header.length() > BEARER_PREFIX.length()
                && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
                return header.substring(BEARER_PREFIX.length()).trim();
            }
        }
        return queryToken == null ? "" : queryToken.trim();
    }
}
