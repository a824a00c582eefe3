package campus.course.repository;

import campus.course.domain.TeacherCourse;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface TeacherCourseRepository extends JpaRepository<TeacherCourse, Long> {

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM TeacherCourse tc WHERE tc.id = :id")
    int deleteRowById(@Param("id") Long id);
}
