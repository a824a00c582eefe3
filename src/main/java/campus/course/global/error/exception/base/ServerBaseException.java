package campus.course.global.error.exception.base;

import campus.course.global.error.ErrorCode;
import campus.course.global.error.exception.BaseException;

/**
 * ServerBaseException: 저장소(DB)가 쓰기를 거부하는 등 시스템 내부에서 발생하는 '서버 예외'
 */
public abstract class ServerBaseException extends BaseException {

    public ServerBaseException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
