package campus.course.domain.validation;

import campus.course.domain.SemesterAttrs;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * {@link ValidSemesterPeriod}의 검증기. 오류 경로는 {@code endsOn}입니다.
 */
public class SemesterPeriodValidator implements ConstraintValidator<ValidSemesterPeriod, SemesterAttrs> {

    @Override
    public boolean isValid(SemesterAttrs attrs, ConstraintValidatorContext context) {
        if (attrs == null || attrs.startsOn() == null || attrs.endsOn() == null) {
            return true;
        }
        if (!attrs.endsOn().isBefore(attrs.startsOn())) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                .addPropertyNode("endsOn")
                .addConstraintViolation();
        return false;
    }
}
