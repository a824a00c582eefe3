package campus.course.service;

import campus.course.domain.CourseRecordType;
import campus.course.domain.TeacherCourse;
import campus.course.domain.TeacherCourseAttrs;
import campus.course.global.changeset.ChangeSetFactory;
import campus.course.global.result.Result;
import campus.course.repository.TeacherCourseRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TeacherCourseService extends AbstractCourseRecordService<TeacherCourse, TeacherCourseAttrs> {

    private final TeacherCourseRepository teacherCourseRepository;

    public TeacherCourseService(TeacherCourseRepository teacherCourseRepository, ChangeSetFactory changeSetFactory) {
        super(teacherCourseRepository, changeSetFactory, CourseRecordType.TEACHER_COURSE);
        this.teacherCourseRepository = teacherCourseRepository;
    }

    public List<TeacherCourse> list() {
        return teacherCourseRepository.findAll();
    }

    public Result<TeacherCourse> get(Long id) {
        return findOne(id);
    }

    @Override
    protected TeacherCourse newRecord() {
        return TeacherCourse.blank();
    }

    @Override
    protected int deleteRow(Long id) {
        return teacherCourseRepository.deleteRowById(id);
    }
}
