package campus.course.service.facade;

import campus.course.domain.Program;
import campus.course.domain.ProgramAttrs;
import campus.course.domain.Semester;
import campus.course.domain.SemesterAttrs;
import campus.course.domain.StudentCourse;
import campus.course.domain.StudentCourseAttrs;
import campus.course.domain.TeacherCourse;
import campus.course.domain.TeacherCourseAttrs;
import campus.course.global.changeset.ChangeSet;
import campus.course.global.result.Result;
import campus.course.service.ProgramService;
import campus.course.service.SemesterService;
import campus.course.service.StudentCourseService;
import campus.course.service.TeacherCourseService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Courses 컨텍스트 (Program / Semester / TeacherCourse / StudentCourse)
 *
 * <p>레코드 종류별로 같은 호출 규약을 따릅니다.</p>
 * <ul>
 *   <li>{@code get*}: {@link Result} 반환, 없으면 NOT_FOUND</li>
 *   <li>{@code update*}, {@code delete*}: 조회된 레코드를 받거나, 조회 결과({@link Result})를 받아 실패를 그대로 전달</li>
 *   <li>{@code change*}: 쓰기 없이 {@link ChangeSet}만 생성</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
public class CourseContext {

    private final ProgramService programService;
    private final SemesterService semesterService;
    private final TeacherCourseService teacherCourseService;
    private final StudentCourseService studentCourseService;

    // ---------------------------------------------------------------- Program

    public List<Program> listPrograms() {
        return programService.list();
    }

    public Result<Program> getProgram(Long id) {
        return programService.get(id);
    }

    public Result<Program> createProgram(ProgramAttrs attrs) {
        return programService.create(attrs);
    }

    public Result<Program> updateProgram(Program program, ProgramAttrs attrs) {
        return programService.update(program, attrs);
    }

    public Result<Program> updateProgram(Result<Program> lookup, ProgramAttrs attrs) {
        return programService.update(lookup, attrs);
    }

    public Result<Program> deleteProgram(Program program) {
        return programService.delete(program);
    }

    public Result<Program> deleteProgram(Result<Program> lookup) {
        return programService.delete(lookup);
    }

    public ChangeSet<Program, ProgramAttrs> changeProgram(Program program) {
        return programService.change(program);
    }

    public ChangeSet<Program, ProgramAttrs> changeProgram(Program program, ProgramAttrs attrs) {
        return programService.change(program, attrs);
    }

    // ---------------------------------------------------------------- Semester

    public List<Semester> listSemesters() {
        return semesterService.list();
    }

    public List<Semester> listSemesters(Long programId) {
        return semesterService.listByProgram(programId);
    }

    public Result<Semester> getSemester(Long semesterId, Long programId) {
        return semesterService.get(semesterId, programId);
    }

    public Result<Semester> createSemester(SemesterAttrs attrs) {
        return semesterService.create(attrs);
    }

    public Result<Semester> updateSemester(Semester semester, SemesterAttrs attrs) {
        return semesterService.update(semester, attrs);
    }

    public Result<Semester> updateSemester(Result<Semester> lookup, SemesterAttrs attrs) {
        return semesterService.update(lookup, attrs);
    }

    public Result<Semester> deleteSemester(Semester semester) {
        return semesterService.delete(semester);
    }

    public Result<Semester> deleteSemester(Result<Semester> lookup) {
        return semesterService.delete(lookup);
    }

    public ChangeSet<Semester, SemesterAttrs> changeSemester(Semester semester) {
        return semesterService.change(semester);
    }

    public ChangeSet<Semester, SemesterAttrs> changeSemester(Semester semester, SemesterAttrs attrs) {
        return semesterService.change(semester, attrs);
    }

    // ---------------------------------------------------------------- TeacherCourse

    public List<TeacherCourse> listTeacherCourses() {
        return teacherCourseService.list();
    }

    public Result<TeacherCourse> getTeacherCourse(Long id) {
        return teacherCourseService.get(id);
    }

    public Result<TeacherCourse> createTeacherCourse(TeacherCourseAttrs attrs) {
        return teacherCourseService.create(attrs);
    }

    public Result<TeacherCourse> updateTeacherCourse(TeacherCourse teacherCourse, TeacherCourseAttrs attrs) {
        return teacherCourseService.update(teacherCourse, attrs);
    }

    public Result<TeacherCourse> updateTeacherCourse(Result<TeacherCourse> lookup, TeacherCourseAttrs attrs) {
        return teacherCourseService.update(lookup, attrs);
    }

    public Result<TeacherCourse> deleteTeacherCourse(TeacherCourse teacherCourse) {
        return teacherCourseService.delete(teacherCourse);
    }

    public Result<TeacherCourse> deleteTeacherCourse(Result<TeacherCourse> lookup) {
        return teacherCourseService.delete(lookup);
    }

    public ChangeSet<TeacherCourse, TeacherCourseAttrs> changeTeacherCourse(TeacherCourse teacherCourse) {
        return teacherCourseService.change(teacherCourse);
    }

    public ChangeSet<TeacherCourse, TeacherCourseAttrs> changeTeacherCourse(TeacherCourse teacherCourse,
                                                                            TeacherCourseAttrs attrs) {
        return teacherCourseService.change(teacherCourse, attrs);
    }

    // ---------------------------------------------------------------- StudentCourse

    public List<StudentCourse> listStudentCourses() {
        return studentCourseService.list();
    }

    public Result<StudentCourse> getStudentCourse(Long id) {
        return studentCourseService.get(id);
    }

    public Result<StudentCourse> createStudentCourse(StudentCourseAttrs attrs) {
        return studentCourseService.create(attrs);
    }

    public Result<StudentCourse> updateStudentCourse(StudentCourse studentCourse, StudentCourseAttrs attrs) {
        return studentCourseService.update(studentCourse, attrs);
    }

    public Result<StudentCourse> updateStudentCourse(Result<StudentCourse> lookup, StudentCourseAttrs attrs) {
        return studentCourseService.update(lookup, attrs);
    }

    public Result<StudentCourse> deleteStudentCourse(StudentCourse studentCourse) {
        return studentCourseService.delete(studentCourse);
    }

    public Result<StudentCourse> deleteStudentCourse(Result<StudentCourse> lookup) {
        return studentCourseService.delete(lookup);
    }

    public ChangeSet<StudentCourse, StudentCourseAttrs> changeStudentCourse(StudentCourse studentCourse) {
        return studentCourseService.change(studentCourse);
    }

    public ChangeSet<StudentCourse, StudentCourseAttrs> changeStudentCourse(StudentCourse studentCourse,
                                                                            StudentCourseAttrs attrs) {
        return studentCourseService.change(studentCourse, attrs);
    }
}
