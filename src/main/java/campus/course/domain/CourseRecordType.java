package campus.course.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 실패 메시지에 쓰이는 레코드 종류별 표시 이름
 */
@Getter
@AllArgsConstructor
public enum CourseRecordType {
    PROGRAM("Program"),
    SEMESTER("Semester"),
    TEACHER_COURSE("Teacher Course"),
    STUDENT_COURSE("Student Course");

    private final String label;
}
