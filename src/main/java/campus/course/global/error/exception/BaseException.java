package campus.course.global.error.exception;

import campus.course.global.error.ErrorCode;
import lombok.Getter;

@Getter
public abstract class BaseException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String message;

    /**
     * 메시지가 이미 완성된 경우 (예: {@code CourseFailure}가 만든 메시지를 그대로 넘길 때)
     */
    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.message = message;
    }
}
