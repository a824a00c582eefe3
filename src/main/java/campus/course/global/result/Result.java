package campus.course.global.result;

import java.util.Optional;
import java.util.function.Function;

/**
 * 조회/명령의 결과 (성공 또는 실패)
 *
 * <p>이 계층은 실패를 던지지 않고 값으로 돌려줍니다. 실패를 받은 후속 명령은
 * 아무 작업 없이 같은 실패를 그대로 전달합니다.</p>
 *
 * <pre>{@code
 * Result<Program> found = courseContext.getProgram(id);
 * Result<Program> updated = courseContext.updateProgram(found, attrs); // found가 실패면 그대로 전달
 * }</pre>
 */
public sealed interface Result<T> permits Result.Ok, Result.Failure {

    record Ok<T>(T value) implements Result<T> {
    }

    record Failure<T>(CourseFailure failure) implements Result<T> {
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> failure(CourseFailure failure) {
        return new Failure<>(failure);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isFailure() {
        return !isOk();
    }

    default Optional<T> toOptional() {
        return (this instanceof Ok<T> ok) ? Optional.ofNullable(ok.value()) : Optional.empty();
    }

    default Optional<CourseFailure> error() {
        return (this instanceof Failure<T> failed) ? Optional.of(failed.failure()) : Optional.empty();
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Failure<>(((Failure<T>) this).failure());
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> next) {
        if (this instanceof Ok<T> ok) {
            return next.apply(ok.value());
        }
        return new Failure<>(((Failure<T>) this).failure());
    }

    /**
     * 예외 흐름을 선호하는 호출자를 위한 변환. 실패는 {@link CourseFailure#toException()}으로 던집니다.
     */
    default T getOrThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw ((Failure<T>) this).failure().toException();
    }
}
