package campus.course.domain.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 학기 기간 검증 어노테이션 (클래스 레벨)
 *
 * <p>종료일이 시작일보다 앞서면 {@code endsOn} 필드에 오류를 남깁니다.
 * 둘 중 하나라도 비어 있으면 통과합니다.</p>
 *
 * @see SemesterPeriodValidator
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = SemesterPeriodValidator.class)
@Documented
public @interface ValidSemesterPeriod {

    String message() default "ends_on can't precede starts_on";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
