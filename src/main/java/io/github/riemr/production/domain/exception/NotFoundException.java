package io.github.riemr.production.domain.exception;

public class NotFoundException extends SchedulingException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String entity, Object id) {
        super(ErrorCode.NOT_FOUND, entity + " not found: " + id);
    }
}
