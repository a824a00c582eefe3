package campus.course.global.error;

public interface ErrorCode {
    String getCode();
    String getMessage();
}
