package campus.course.repository;

import campus.course.domain.Program;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface ProgramRepository extends JpaRepository<Program, Long> {

    // 최신 등록순. inserted_at이 같으면 id 역순으로 고정
    List<Program> findAllByOrderByInsertedAtDescIdDesc();

    /**
     * 단일 DELETE 문. 이미 지워진 행이면 0을 반환합니다.
     * (SimpleJpaRepository#delete는 없는 엔티티를 조용히 무시하므로 사용하지 않음)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM Program p WHERE p.id = :id")
    int deleteRowById(@Param("id") Long id);
}
