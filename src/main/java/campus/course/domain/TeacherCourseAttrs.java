package campus.course.domain;

import campus.course.global.changeset.Attributes;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.LinkedHashMap;
import java.util.Map;

public record TeacherCourseAttrs(
        @NotNull(message = "can't be blank")
        @Positive(message = "must be a valid id")
        Long teacherId,

        @NotNull(message = "can't be blank")
        @Positive(message = "must be a valid id")
        Long courseId
) implements Attributes<TeacherCourseAttrs> {

    public static TeacherCourseAttrs empty() {
        return new TeacherCourseAttrs(null, null);
    }

    @Override
    public TeacherCourseAttrs mergedWith(TeacherCourseAttrs patch) {
        return new TeacherCourseAttrs(
                Attributes.pick(patch.teacherId, teacherId),
                Attributes.pick(patch.courseId, courseId));
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("teacherId", teacherId);
        fields.put("courseId", courseId);
        return fields;
    }
}
