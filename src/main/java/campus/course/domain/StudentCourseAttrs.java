package campus.course.domain;

import campus.course.global.changeset.Attributes;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.LinkedHashMap;
import java.util.Map;

public record StudentCourseAttrs(
        @NotNull(message = "can't be blank")
        @Positive(message = "must be a valid id")
        Long studentId,

        @NotNull(message = "can't be blank")
        @Positive(message = "must be a valid id")
        Long courseId
) implements Attributes<StudentCourseAttrs> {

    public static StudentCourseAttrs empty() {
        return new StudentCourseAttrs(null, null);
    }

    @Override
    public StudentCourseAttrs mergedWith(StudentCourseAttrs patch) {
        return new StudentCourseAttrs(
                Attributes.pick(patch.studentId, studentId),
                Attributes.pick(patch.courseId, courseId));
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("studentId", studentId);
        fields.put("courseId", courseId);
        return fields;
    }
}
