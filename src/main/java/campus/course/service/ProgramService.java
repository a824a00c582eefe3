package campus.course.service;

import campus.course.domain.CourseRecordType;
import campus.course.domain.Program;
import campus.course.domain.ProgramAttrs;
import campus.course.global.changeset.ChangeSetFactory;
import campus.course.global.result.Result;
import campus.course.repository.ProgramRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ProgramService extends AbstractCourseRecordService<Program, ProgramAttrs> {

    private final ProgramRepository programRepository;

    public ProgramService(ProgramRepository programRepository, ChangeSetFactory changeSetFactory) {
        super(programRepository, changeSetFactory, CourseRecordType.PROGRAM);
        this.programRepository = programRepository;
    }

    /**
     * 최신 등록순
     */
    public List<Program> list() {
        return programRepository.findAllByOrderByInsertedAtDescIdDesc();
    }

    public Result<Program> get(Long id) {
        return findOne(id);
    }

    @Override
    protected Program newRecord() {
        return Program.blank();
    }

    @Override
    protected int deleteRow(Long id) {
        return programRepository.deleteRowById(id);
    }
}
