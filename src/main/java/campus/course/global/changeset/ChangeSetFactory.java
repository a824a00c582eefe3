package campus.course.global.changeset;

import campus.course.aop.annotation.TraceLog;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 검증된 생성 단계 (validated construction step)
 *
 * <p>레코드의 현재 값에 입력값을 병합하고, 병합된 필드 집합 전체를 Bean Validation으로 검증합니다.
 * 신규 레코드는 현재 값이 모두 비어 있으므로 필수 필드 누락이 그대로 오류가 됩니다.</p>
 */
@TraceLog
@Component
@RequiredArgsConstructor
public class ChangeSetFactory {

    private final Validator validator;

    public <E extends Changeable<A>, A extends Attributes<A>> ChangeSet<E, A> build(E data, A patch) {
        A current = data.currentAttributes();
        A merged = (patch == null) ? current : current.mergedWith(patch);

        return new ChangeSet<>(data, merged, diff(current, merged), validate(merged));
    }

    private Map<String, Object> diff(Attributes<?> before, Attributes<?> after) {
        Map<String, Object> previous = before.asMap();
        Map<String, Object> changes = new LinkedHashMap<>();

        after.asMap().forEach((field, value) -> {
            if (!Objects.equals(previous.get(field), value)) {
                changes.put(field, value);
            }
        });
        return Collections.unmodifiableMap(changes);
    }

    private <A> Map<String, List<String>> validate(A attributes) {
        Map<String, List<String>> errors = new TreeMap<>();

        for (ConstraintViolation<A> violation : validator.validate(attributes)) {
            errors.computeIfAbsent(violation.getPropertyPath().toString(), k -> new ArrayList<>())
                    .add(violation.getMessage());
        }
        errors.replaceAll((field, messages) -> messages.stream().sorted().toList());
        return Collections.unmodifiableMap(errors);
    }
}
