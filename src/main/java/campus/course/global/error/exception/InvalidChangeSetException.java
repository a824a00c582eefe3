package campus.course.global.error.exception;

import campus.course.global.changeset.ChangeSet;
import campus.course.global.error.CourseErrorCode;
import campus.course.global.error.exception.base.ClientBaseException;
import lombok.Getter;

@Getter
public class InvalidChangeSetException extends ClientBaseException {

    private final transient ChangeSet<?, ?> changeSet;

    public InvalidChangeSetException(String message, ChangeSet<?, ?> changeSet) {
        super(CourseErrorCode.INVALID_CHANGE_SET, message);
        this.changeSet = changeSet;
    }
}
