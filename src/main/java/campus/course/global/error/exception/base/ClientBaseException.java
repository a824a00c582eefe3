package campus.course.global.error.exception.base;

import campus.course.global.error.ErrorCode;
import campus.course.global.error.exception.BaseException;

/**
 * ClientBaseException: 호출자의 입력이나 조회 대상이 잘못되었을 때 발생하는 '비즈니스 예외'.
 * 호출자에게 구체적인 실패 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

    public ClientBaseException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
