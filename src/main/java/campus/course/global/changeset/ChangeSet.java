package campus.course.global.changeset;

import java.util.List;
import java.util.Map;

/**
 * 제안된 변경 사항의 검증 결과 (Immutable Record)
 *
 * <h4>사용 예시</h4>
 *
 * <pre>{@code
 * ChangeSet<Program, ProgramAttrs> changeSet = courseContext.changeProgram(program, attrs);
 * if (!changeSet.isValid()) {
 *     changeSet.errorsOn("name"); // ["can't be blank"]
 * }
 * }</pre>
 *
 * @param data       변경 대상 레코드 (신규 생성이면 비어 있는 레코드)
 * @param attributes 현재 값 위에 입력값을 병합한 최종 필드 집합
 * @param changes    현재 값과 달라지는 필드만 (필드명 → 새 값)
 * @param errors     필드명 → 검증 메시지 목록
 */
public record ChangeSet<E, A>(
        E data,
        A attributes,
        Map<String, Object> changes,
        Map<String, List<String>> errors
) {

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public List<String> errorsOn(String field) {
        return errors.getOrDefault(field, List.of());
    }
}
