package io.github.riemr.production.domain.exception;

public class GenerationTimeoutException extends SchedulingException {

    private static final long serialVersionUID = 1L;

    public GenerationTimeoutException(String message) {
        super(ErrorCode.GENERATION_TIMEOUT, message);
    }
}
