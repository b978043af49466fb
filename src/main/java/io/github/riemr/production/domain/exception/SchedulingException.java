package io.github.riemr.production.domain.exception;

import lombok.Getter;

/**
 * スケジューリング処理の業務例外の基底クラス。
 * <p>
 * 例外コード（{@link ErrorCode}）を保持し、上位層（コントローラ）で HTTP ステータスに変換される。
 * </p>
 */
@Getter
public class SchedulingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    public SchedulingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public SchedulingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
