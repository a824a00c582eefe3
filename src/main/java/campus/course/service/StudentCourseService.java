package campus.course.service;

import campus.course.domain.CourseRecordType;
import campus.course.domain.StudentCourse;
import campus.course.domain.StudentCourseAttrs;
import campus.course.global.changeset.ChangeSetFactory;
import campus.course.global.result.Result;
import campus.course.repository.StudentCourseRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class StudentCourseService extends AbstractCourseRecordService<StudentCourse, StudentCourseAttrs> {

    private final StudentCourseRepository studentCourseRepository;

    public StudentCourseService(StudentCourseRepository studentCourseRepository, ChangeSetFactory changeSetFactory) {
        super(studentCourseRepository, changeSetFactory, CourseRecordType.STUDENT_COURSE);
        this.studentCourseRepository = studentCourseRepository;
    }

    public List<StudentCourse> list() {
        return studentCourseRepository.findAll();
    }

    public Result<StudentCourse> get(Long id) {
        return findOne(id);
    }

    @Override
    protected StudentCourse newRecord() {
        return StudentCourse.blank();
    }

    @Override
    protected int deleteRow(Long id) {
        return studentCourseRepository.deleteRowById(id);
    }
}
