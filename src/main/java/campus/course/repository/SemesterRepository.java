package campus.course.repository;

import campus.course.domain.Semester;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

public interface SemesterRepository extends JpaRepository<Semester, Long> {

    // 부모 Program을 함께 로딩 (preload)
    @EntityGraph(attributePaths = "program")
    Optional<Semester> findByIdAndProgramId(Long id, Long programId);

    List<Semester> findAllByProgramIdOrderByIdAsc(Long programId);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM Semester s WHERE s.id = :id")
    int deleteRowById(@Param("id") Long id);
}
