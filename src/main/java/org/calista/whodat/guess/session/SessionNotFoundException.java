package org.calista.whodat.guess.session;

/**
 * Unknown or expired session id.
 */
public final class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session ID '" + sessionId + "' not found.");
    }
}
