package campus.course.global.result;

import campus.course.global.changeset.ChangeSet;
import campus.course.global.error.CourseErrorCode;
import campus.course.global.error.exception.BaseException;
import campus.course.global.error.exception.InvalidChangeSetException;
import campus.course.global.error.exception.RecordNotFoundException;
import campus.course.global.error.exception.StorageFailureException;

/**
 * 실패 결과의 상세 (Immutable Record)
 *
 * @param errorCode 실패 분류 (NOT_FOUND / INVALID_CHANGE_SET / STORAGE_FAILURE)
 * @param message   사람이 읽을 수 있는 짧은 메시지 (예: "Unable to Delete Program!")
 * @param changeSet 검증 실패일 때만 존재하는 무효 ChangeSet, 그 외에는 null
 */
public record CourseFailure(CourseErrorCode errorCode, String message, ChangeSet<?, ?> changeSet) {

    public static CourseFailure notFound(String recordLabel) {
        return new CourseFailure(CourseErrorCode.RECORD_NOT_FOUND,
                CourseErrorCode.RECORD_NOT_FOUND.format(recordLabel), null);
    }

    public static CourseFailure invalid(String recordLabel, ChangeSet<?, ?> changeSet) {
        return new CourseFailure(CourseErrorCode.INVALID_CHANGE_SET,
                CourseErrorCode.INVALID_CHANGE_SET.format(recordLabel), changeSet);
    }

    public static CourseFailure storage(WriteAction action, String recordLabel) {
        return new CourseFailure(CourseErrorCode.STORAGE_FAILURE,
                CourseErrorCode.STORAGE_FAILURE.format(action.getVerb(), recordLabel), null);
    }

    public boolean is(CourseErrorCode code) {
        return errorCode == code;
    }

    public BaseException toException() {
        return switch (errorCode) {
            case RECORD_NOT_FOUND -> new RecordNotFoundException(message);
            case INVALID_CHANGE_SET -> new InvalidChangeSetException(message, changeSet);
            case STORAGE_FAILURE -> new StorageFailureException(message);
        };
    }

    public enum WriteAction {
        CREATE("Create"),
        UPDATE("Update"),
        DELETE("Delete");

        private final String verb;

        WriteAction(String verb) {
            this.verb = verb;
        }

        public String getVerb() {
            return verb;
        }
    }
}
