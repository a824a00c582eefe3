package campus.course.global.changeset;

import java.util.Map;

/**
 * 레코드 하나의 쓰기 가능한 필드 집합.
 *
 * <p>{@code null} 컴포넌트는 "입력되지 않음"을 뜻합니다. {@link #mergedWith(Attributes)}는
 * patch에서 null이 아닌 값만 덮어씁니다.</p>
 */
public interface Attributes<A extends Attributes<A>> {

    A mergedWith(A patch);

    /**
     * 필드명 → 값. 순서는 선언 순서를 따르며 null 값을 허용합니다.
     */
    Map<String, Object> asMap();

    /**
     * patch 값이 있으면 patch, 없으면 현재 값
     */
    static <V> V pick(V patched, V current) {
        return (patched != null) ? patched : current;
    }
}
