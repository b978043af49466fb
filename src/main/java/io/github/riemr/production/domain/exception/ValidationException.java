package io.github.riemr.production.domain.exception;

/** 入力値が不正。永続化前に検出される。 */
public class ValidationException extends SchedulingException {

    private static final long serialVersionUID = 1L;

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
