package campus.course.global.error.exception;

import campus.course.global.error.CourseErrorCode;
import campus.course.global.error.exception.base.ClientBaseException;

public class RecordNotFoundException extends ClientBaseException {
    public RecordNotFoundException(String message) {
        super(CourseErrorCode.RECORD_NOT_FOUND, message);
    }
}
