package campus.course.domain;

import campus.course.global.changeset.Changeable;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 학생 ↔ 강좌 배정. students / courses 테이블은 이 모듈에서 다루지 않으므로 id만 보관합니다.
 */
@Entity
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "student_courses")
public class StudentCourse extends BaseTimeEntity implements Changeable<StudentCourseAttrs> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "course_id", nullable = false)
    private Long courseId;

    public static StudentCourse blank() {
        return new StudentCourse();
    }

    @Override
    public StudentCourseAttrs currentAttributes() {
        return new StudentCourseAttrs(studentId, courseId);
    }

    @Override
    public void applyAttributes(StudentCourseAttrs attributes) {
        this.studentId = attributes.studentId();
        this.courseId = attributes.courseId();
    }
}
