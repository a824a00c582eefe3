package campus.course.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CourseErrorCode implements ErrorCode {
    // === Client Errors ===
    RECORD_NOT_FOUND("C001", "%s Does Not Exist"),
    INVALID_CHANGE_SET("C002", "%s Is Invalid"),

    // === Server Errors ===
    STORAGE_FAILURE("S001", "Unable to %s %s!");

    private final String code;
    private final String message;

    public String format(Object... args) {
        return String.format(message, args);
    }
}
