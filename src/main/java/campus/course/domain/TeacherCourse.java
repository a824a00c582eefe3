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
 * 교사 ↔ 강좌 배정. teachers / courses 테이블은 이 모듈에서 다루지 않으므로 id만 보관합니다.
 */
@Entity
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "teacher_courses")
public class TeacherCourse extends BaseTimeEntity implements Changeable<TeacherCourseAttrs> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "teacher_id", nullable = false)
    private Long teacherId;

    @Column(name = "course_id", nullable = false)
    private Long courseId;

    public static TeacherCourse blank() {
        return new TeacherCourse();
    }

    @Override
    public TeacherCourseAttrs currentAttributes() {
        return new TeacherCourseAttrs(teacherId, courseId);
    }

    @Override
    public void applyAttributes(TeacherCourseAttrs attributes) {
        this.teacherId = attributes.teacherId();
        this.courseId = attributes.courseId();
    }
}
