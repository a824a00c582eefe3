package campus.course.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * service 패키지 밖의 빈을 TraceAspect 추적 대상에 추가합니다.
 */
@Target({ElementType.METHOD, ElementType.TYPE}) // 메서드와 클래스 모두 붙일 수 있음
@Retention(RetentionPolicy.RUNTIME)
public @interface TraceLog {}
