package io.github.riemr.production.domain.exception;

public class PersistenceFailureException extends SchedulingException {

    private static final long serialVersionUID = 1L;

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
