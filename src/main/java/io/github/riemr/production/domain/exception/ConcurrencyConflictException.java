package io.github.riemr.production.domain.exception;

/** 同一キーに対する処理が既に実行中、または楽観ロックのバージョン不一致。 */
public class ConcurrencyConflictException extends SchedulingException {

    private static final long serialVersionUID = 1L;

    public ConcurrencyConflictException(String message) {
        super(ErrorCode.CONCURRENCY_CONFLICT, message);
    }
}
