package campus.course.aop.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 서비스 호출 트리를 DEBUG로 남깁니다. {@code app.aop.trace.enabled=true}일 때만 동작합니다.
 *
 * <pre>
 * --> [START] CourseContext.getProgram(args: [1])
 * |  --> [START] ProgramService.get(args: [1])
 * |  <-- [END] ProgramService.get (Return: Ok[value=Program(id=1, ...)]) [3ms]
 * <-- [END] CourseContext.getProgram (Return: Ok[value=Program(id=1, ...)]) [4ms]
 * </pre>
 */
@Slf4j
@Aspect
@Component
public class TraceAspect {

    private static final int MAX_RESULT_LENGTH = 100;

    @Value("${app.aop.trace.enabled:false}")
    private boolean isTraceEnabled;

    private final ThreadLocal<Integer> depthHolder = ThreadLocal.withInitial(() -> 0);

    @Pointcut("execution(* campus.course.service..*.*(..))")
    public void autoLog() {}

    @Pointcut("@annotation(campus.course.aop.annotation.TraceLog) || @within(campus.course.aop.annotation.TraceLog)")
    public void manualLog() {}

    @Around("autoLog() || manualLog()")
    public Object doTrace(ProceedingJoinPoint joinPoint) throws Throwable {
        if (!isTraceEnabled) {
            return joinPoint.proceed();
        }

        int depth = depthHolder.get();
        String indent = "|  ".repeat(depth);
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String methodName = joinPoint.getSignature().getName();

        String args = Arrays.stream(joinPoint.getArgs())
                .map(arg -> arg == null ? "null" : arg.toString())
                .collect(Collectors.joining(", "));

        log.debug("{}--> [START] {}.{}(args: [{}])", indent, className, methodName, args);

        depthHolder.set(depth + 1);
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();

        Object result = null;
        try {
            result = joinPoint.proceed();
            return result;
        } catch (Throwable e) {
            log.debug("{}<X- [EXCEPTION] {}.{} throws {}", indent, className, methodName, e.getClass().getSimpleName());
            throw e;
        } finally {
            stopWatch.stop();
            if (depth > 0) {
                depthHolder.set(depth);
            } else {
                depthHolder.remove();
            }

            log.debug("{}<-- [END] {}.{} (Return: {}) [{}ms]",
                    indent, className, methodName, describe(result), stopWatch.getTotalTimeMillis());
        }
    }

    private String describe(Object result) {
        if (result == null) return "void";
        if (result instanceof Collection<?> collection) return "Collection(size=" + collection.size() + ")";

        String text = result.toString();
        return text.length() > MAX_RESULT_LENGTH ? text.substring(0, MAX_RESULT_LENGTH) + "..." : text;
    }
}
