package io.stationkeeper.worker;

/**
 * A remote peer rejected or presented a wrong credential. Escaping a worker
 * step, it is reported apart from ordinary step failures (see
 * {@link Worker#AUTHENTICATION_FAILURE_TAG}).
 */
public final class AuthenticationException extends RuntimeException {
    public AuthenticationException(String message) {
        super(message);
    }
}
