package campus.course.repository;

import campus.course.domain.StudentCourse;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface StudentCourseRepository extends JpaRepository<StudentCourse, Long> {

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM StudentCourse sc WHERE sc.id = :id")
    int deleteRowById(@Param("id") Long id);
}
