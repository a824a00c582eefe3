package campus.course.service;

import campus.course.domain.CourseRecordType;
import campus.course.domain.Semester;
import campus.course.domain.SemesterAttrs;
import campus.course.global.changeset.ChangeSetFactory;
import campus.course.global.result.Result;
import campus.course.repository.SemesterRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Program 존재 여부는 DB FK로 보장합니다. 없는 Program을 참조하면 create/update가 STORAGE_FAILURE가 됩니다.
 */
@Service
public class SemesterService extends AbstractCourseRecordService<Semester, SemesterAttrs> {

    private final SemesterRepository semesterRepository;

    public SemesterService(SemesterRepository semesterRepository, ChangeSetFactory changeSetFactory) {
        super(semesterRepository, changeSetFactory, CourseRecordType.SEMESTER);
        this.semesterRepository = semesterRepository;
    }

    public List<Semester> list() {
        return semesterRepository.findAll();
    }

    public List<Semester> listByProgram(Long programId) {
        if (programId == null) {
            return List.of();
        }
        return semesterRepository.findAllByProgramIdOrderByIdAsc(programId);
    }

    /**
     * 학기 id와 부모 Program id가 모두 일치해야 조회되며, Program이 함께 로딩됩니다.
     */
    public Result<Semester> get(Long semesterId, Long programId) {
        if (semesterId == null || programId == null) {
            return notFound();
        }
        return found(semesterRepository.findByIdAndProgramId(semesterId, programId));
    }

    /**
     * merge된 사본의 {@code program}은 이전 부모를 가리키는 미초기화 프록시이므로,
     * 현재 programId 기준으로 Program과 함께 다시 읽습니다.
     */
    @Override
    protected Semester refreshed(Semester saved) {
        return semesterRepository.findByIdAndProgramId(saved.getId(), saved.getProgramId()).orElse(saved);
    }

    @Override
    protected Semester newRecord() {
        return Semester.blank();
    }

    @Override
    protected int deleteRow(Long id) {
        return semesterRepository.deleteRowById(id);
    }
}
