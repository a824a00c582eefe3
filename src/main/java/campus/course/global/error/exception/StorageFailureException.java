package campus.course.global.error.exception;

import campus.course.global.error.CourseErrorCode;
import campus.course.global.error.exception.base.ServerBaseException;

public class StorageFailureException extends ServerBaseException {
    public StorageFailureException(String message) {
        super(CourseErrorCode.STORAGE_FAILURE, message);
    }
}
