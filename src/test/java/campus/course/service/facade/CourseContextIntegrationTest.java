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
import campus.course.global.error.CourseErrorCode;
import campus.course.global.error.exception.RecordNotFoundException;
import campus.course.global.result.CourseFailure;
import campus.course.global.result.Result;
import campus.course.repository.ProgramRepository;
import campus.course.repository.SemesterRepository;
import campus.course.repository.StudentCourseRepository;
import campus.course.repository.TeacherCourseRepository;
import org.hibernate.Hibernate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

/**
 * CourseContext 통합 테스트 (H2, MySQL 모드)
 *
 * <p>서비스 레벨 트랜잭션이 없으므로 테스트도 @Transactional 없이 실제 커밋된 상태를 검증하고,
 * 매 테스트 전에 테이블을 비웁니다.</p>
 */
@SpringBootTest
@ActiveProfiles("test")
class CourseContextIntegrationTest {

    @Autowired
    private CourseContext courseContext;

    @Autowired
    private ProgramRepository programRepository;

    @Autowired
    private SemesterRepository semesterRepository;

    @Autowired
    private TeacherCourseRepository teacherCourseRepository;

    @Autowired
    private StudentCourseRepository studentCourseRepository;

    @BeforeEach
    void setUp() {
        semesterRepository.deleteAllInBatch();
        programRepository.deleteAllInBatch();
        teacherCourseRepository.deleteAllInBatch();
        studentCourseRepository.deleteAllInBatch();
    }

    private Program createProgram(String name) {
        return courseContext.createProgram(new ProgramAttrs(name, null)).getOrThrow();
    }

    private CourseFailure failureOf(Result<?> result) {
        return result.error().orElseThrow();
    }

    @Test
    @DisplayName("행이 없으면 모든 목록 조회는 빈 리스트")
    void whenNoRows_listsShouldBeEmpty() {
        assertThat(courseContext.listPrograms()).isEmpty();
        assertThat(courseContext.listSemesters()).isEmpty();
        assertThat(courseContext.listTeacherCourses()).isEmpty();
        assertThat(courseContext.listStudentCourses()).isEmpty();
    }

    @Nested
    @DisplayName("Program")
    class ProgramTest {

        @Test
        @DisplayName("생성 → id로 조회 → 같은 필드")
        void createThenGet_shouldRoundTrip() {
            // given
            Program created = courseContext.createProgram(new ProgramAttrs("Computer Science", "BSc")).getOrThrow();

            // when
            Program found = courseContext.getProgram(created.getId()).getOrThrow();

            // then
            assertThat(found.getName()).isEqualTo("Computer Science");
            assertThat(found.getDescription()).isEqualTo("BSc");
            assertThat(found)
                    .usingRecursiveComparison()
                    .ignoringFields("insertedAt", "updatedAt")
                    .isEqualTo(created);
            assertThat(found.getInsertedAt()).isCloseTo(created.getInsertedAt(), within(1, ChronoUnit.SECONDS));
        }

        @Test
        @DisplayName("필수 필드가 없으면 VALIDATION 실패, 행이 생기지 않는다")
        void createInvalid_shouldPersistNothing() {
            // when
            Result<Program> result = courseContext.createProgram(ProgramAttrs.empty());

            // then
            assertThat(failureOf(result).errorCode()).isEqualTo(CourseErrorCode.INVALID_CHANGE_SET);
            assertThat(programRepository.count()).isZero();
        }

        @Test
        @DisplayName("목록은 최신 등록순")
        void list_shouldBeNewestFirst() {
            // given
            createProgram("First");
            createProgram("Second");

            // when & then
            assertThat(courseContext.listPrograms()).extracting(Program::getName).containsExactly("Second", "First");
        }

        @Test
        @DisplayName("없는 Program 조회 결과로 수정하면 실패가 그대로 전달된다")
        void updateNotFoundLookup_shouldPropagate() {
            // when
            Result<Program> result = courseContext.updateProgram(courseContext.getProgram(-1L), new ProgramAttrs("X", null));

            // then
            assertThat(failureOf(result).errorCode()).isEqualTo(CourseErrorCode.RECORD_NOT_FOUND);
            assertThat(failureOf(result).message()).isEqualTo("Program Does Not Exist");
            assertThat(programRepository.count()).isZero();
        }

        @Test
        @DisplayName("조회 결과로 수정하면 DB에 반영된다")
        void updateFoundLookup_shouldPersist() {
            // given
            Program program = createProgram("Physics");

            // when
            Result<Program> result = courseContext.updateProgram(courseContext.getProgram(program.getId()),
                    new ProgramAttrs("Applied Physics", null));

            // then
            assertThat(result.getOrThrow().getName()).isEqualTo("Applied Physics");
            assertThat(courseContext.getProgram(program.getId()).getOrThrow().getName()).isEqualTo("Applied Physics");
        }

        @Test
        @DisplayName("두 번 삭제하면 두 번째는 STORAGE_FAILURE (예외 없음)")
        void deleteTwice_shouldFailSecondTime() {
            // given
            Program program = createProgram("Physics");

            // when
            Result<Program> first = courseContext.deleteProgram(program);
            Result<Program> second = courseContext.deleteProgram(program);

            // then
            assertThat(first.isOk()).isTrue();
            assertThat(failureOf(second).errorCode()).isEqualTo(CourseErrorCode.STORAGE_FAILURE);
            assertThat(failureOf(second).message()).isEqualTo("Unable to Delete Program!");
            assertThat(courseContext.getProgram(program.getId()).isFailure()).isTrue();
        }

        @Test
        @DisplayName("학기가 남아 있는 Program은 FK 때문에 삭제되지 않는다")
        void deleteWithSemesters_shouldBeRejected() {
            // given
            Program program = createProgram("Physics");
            courseContext.createSemester(new SemesterAttrs("Spring 2025", program.getId(), null, null)).getOrThrow();

            // when
            Result<Program> result = courseContext.deleteProgram(courseContext.getProgram(program.getId()));

            // then
            assertThat(failureOf(result).message()).isEqualTo("Unable to Delete Program!");
            assertThat(courseContext.getProgram(program.getId()).isOk()).isTrue();
        }

        @Test
        @DisplayName("변경 사항이 없는 수정은 쓰기 없이 같은 레코드를 반환")
        void updateWithoutChanges_shouldReturnSameRecord() {
            // given
            Program program = createProgram("Physics");

            // when
            Result<Program> result = courseContext.updateProgram(program, new ProgramAttrs("Physics", null));

            // then
            assertThat(result.getOrThrow()).isSameAs(program);
        }

        @Test
        @DisplayName("getOrThrow는 NOT_FOUND를 RecordNotFoundException으로 던진다")
        void getOrThrow_shouldThrowForMissingProgram() {
            assertThatThrownBy(() -> courseContext.getProgram(-1L).getOrThrow())
                    .isInstanceOf(RecordNotFoundException.class)
                    .hasMessage("Program Does Not Exist");
        }

        @Test
        @DisplayName("changeProgram은 쓰기 없이 ChangeSet만 만든다")
        void change_shouldNotWrite() {
            // given
            Program program = createProgram("Physics");

            // when
            ChangeSet<Program, ProgramAttrs> changeSet = courseContext.changeProgram(program, new ProgramAttrs("Biology", null));

            // then
            assertThat(changeSet.changes()).containsExactly(entry("name", "Biology"));
            assertThat(courseContext.getProgram(program.getId()).getOrThrow().getName()).isEqualTo("Physics");
            assertThat(courseContext.changeProgram(program).hasChanges()).isFalse();
        }
    }

    @Nested
    @DisplayName("Semester")
    class SemesterTest {

        @Test
        @DisplayName("id와 Program id가 맞으면 Program이 함께 로딩된 채로 조회")
        void get_shouldAttachProgram() {
            // given
            Program program = createProgram("Mathematics");
            Semester created = courseContext.createSemester(new SemesterAttrs("Spring 2025", program.getId(),
                    LocalDate.of(2025, 3, 1), LocalDate.of(2025, 6, 30))).getOrThrow();

            // when
            Semester found = courseContext.getSemester(created.getId(), program.getId()).getOrThrow();

            // then
            assertThat(found.getName()).isEqualTo("Spring 2025");
            assertThat(found.getStartsOn()).isEqualTo(LocalDate.of(2025, 3, 1));
            assertThat(found.getEndsOn()).isEqualTo(LocalDate.of(2025, 6, 30));
            assertThat(Hibernate.isInitialized(found.getProgram())).isTrue();
            assertThat(found.getProgram().getName()).isEqualTo("Mathematics");
        }

        @Test
        @DisplayName("Program id가 다르면 NOT_FOUND")
        void getWithWrongProgram_shouldReturnNotFound() {
            // given
            Program owner = createProgram("Mathematics");
            Program other = createProgram("History");
            Semester semester = courseContext.createSemester(new SemesterAttrs("Spring 2025", owner.getId(), null, null))
                    .getOrThrow();

            // when
            Result<Semester> result = courseContext.getSemester(semester.getId(), other.getId());

            // then
            assertThat(failureOf(result).message()).isEqualTo("Semester Does Not Exist");
        }

        @Test
        @DisplayName("없는 Program을 참조하면 STORAGE_FAILURE, 행이 생기지 않는다")
        void createWithUnknownProgram_shouldBeRejected() {
            // when
            Result<Semester> result = courseContext.createSemester(new SemesterAttrs("Spring 2025", 999_999L, null, null));

            // then
            assertThat(failureOf(result).message()).isEqualTo("Unable to Create Semester!");
            assertThat(semesterRepository.count()).isZero();
        }

        @Test
        @DisplayName("listSemesters(programId)는 해당 Program의 학기만")
        void listByProgram_shouldFilter() {
            // given
            Program math = createProgram("Mathematics");
            Program history = createProgram("History");
            courseContext.createSemester(new SemesterAttrs("Spring 2025", math.getId(), null, null));
            courseContext.createSemester(new SemesterAttrs("Fall 2025", math.getId(), null, null));
            courseContext.createSemester(new SemesterAttrs("Spring 2025", history.getId(), null, null));

            // when & then
            assertThat(courseContext.listSemesters(math.getId()))
                    .extracting(Semester::getName)
                    .containsExactly("Spring 2025", "Fall 2025");
            assertThat(courseContext.listSemesters()).hasSize(3);
        }

        @Test
        @DisplayName("조회 결과로 수정/삭제")
        void updateAndDeleteThroughLookup() {
            // given
            Program program = createProgram("Mathematics");
            Semester semester = courseContext.createSemester(new SemesterAttrs("Spring 2025", program.getId(), null, null))
                    .getOrThrow();

            // when
            Result<Semester> updated = courseContext.updateSemester(
                    courseContext.getSemester(semester.getId(), program.getId()),
                    new SemesterAttrs("Spring 2026", null, null, null));
            Result<Semester> deleted = courseContext.deleteSemester(courseContext.getSemester(semester.getId(), program.getId()));
            Result<Semester> deletedAgain = courseContext.deleteSemester(courseContext.getSemester(semester.getId(), program.getId()));

            // then
            assertThat(updated.getOrThrow().getName()).isEqualTo("Spring 2026");
            assertThat(deleted.isOk()).isTrue();
            assertThat(failureOf(deletedAgain).message()).isEqualTo("Semester Does Not Exist");
        }

        @Test
        @DisplayName("수정 결과의 Program은 초기화되어 있어 트랜잭션 밖에서도 접근 가능")
        void update_shouldReturnAttachedProgram() {
            // given
            Program program = createProgram("Mathematics");
            Semester semester = courseContext.createSemester(new SemesterAttrs("Spring 2025", program.getId(), null, null))
                    .getOrThrow();

            // when
            Semester updated = courseContext.updateSemester(
                    courseContext.getSemester(semester.getId(), program.getId()),
                    new SemesterAttrs("Spring 2026", null, null, null)).getOrThrow();

            // then
            assertThat(updated.getName()).isEqualTo("Spring 2026");
            assertThat(Hibernate.isInitialized(updated.getProgram())).isTrue();
            assertThat(updated.getProgram().getName()).isEqualTo("Mathematics");
        }

        @Test
        @DisplayName("다른 Program으로 옮기면 결과는 새 Program을 가리킨다")
        void reparent_shouldAttachNewProgram() {
            // given
            Program math = createProgram("Mathematics");
            Program history = createProgram("History");
            Semester semester = courseContext.createSemester(new SemesterAttrs("Spring 2025", math.getId(), null, null))
                    .getOrThrow();

            // when
            Semester moved = courseContext.updateSemester(
                    courseContext.getSemester(semester.getId(), math.getId()),
                    new SemesterAttrs(null, history.getId(), null, null)).getOrThrow();

            // then
            assertThat(moved.getProgramId()).isEqualTo(history.getId());
            assertThat(moved.getProgram().getId()).isEqualTo(history.getId());
            assertThat(moved.getProgram().getName()).isEqualTo("History");
            assertThat(courseContext.getSemester(semester.getId(), math.getId()).isFailure()).isTrue();
        }

        @Test
        @DisplayName("쓰기가 거부된 수정은 호출자의 레코드를 바꾸지 않는다")
        void rejectedUpdate_shouldLeaveCallerUntouched() {
            // given
            Program program = createProgram("Mathematics");
            Semester semester = courseContext.getSemester(
                    courseContext.createSemester(new SemesterAttrs("Spring 2025", program.getId(), null, null))
                            .getOrThrow().getId(),
                    program.getId()).getOrThrow();

            // when
            Result<Semester> result = courseContext.updateSemester(semester,
                    new SemesterAttrs("Renamed", 999_999L, null, null));

            // then
            assertThat(failureOf(result).message()).isEqualTo("Unable to Update Semester!");
            assertThat(semester.getName()).isEqualTo("Spring 2025");
            assertThat(semester.getProgramId()).isEqualTo(program.getId());
            assertThat(semester.getProgram().getName()).isEqualTo("Mathematics");
            assertThat(courseContext.getSemester(semester.getId(), program.getId()).getOrThrow().getName())
                    .isEqualTo("Spring 2025");
        }

        @Test
        @DisplayName("기간이 뒤집힌 수정은 VALIDATION 실패")
        void updateWithInvertedPeriod_shouldBeInvalid() {
            // given
            Program program = createProgram("Mathematics");
            Semester semester = courseContext.createSemester(new SemesterAttrs("Spring 2025", program.getId(),
                    LocalDate.of(2025, 3, 1), null)).getOrThrow();

            // when
            Result<Semester> result = courseContext.updateSemester(semester,
                    new SemesterAttrs(null, null, null, LocalDate.of(2025, 1, 1)));

            // then
            assertThat(failureOf(result).changeSet().errorsOn("endsOn")).containsExactly("ends_on can't precede starts_on");
        }
    }

    @Nested
    @DisplayName("TeacherCourse")
    class TeacherCourseTest {

        @Test
        @DisplayName("생성 → 조회 → 수정 → 삭제")
        void crudCycle() {
            // given
            TeacherCourse created = courseContext.createTeacherCourse(new TeacherCourseAttrs(7L, 101L)).getOrThrow();

            // when
            TeacherCourse found = courseContext.getTeacherCourse(created.getId()).getOrThrow();
            TeacherCourse updated = courseContext.updateTeacherCourse(found, new TeacherCourseAttrs(null, 202L)).getOrThrow();
            Result<TeacherCourse> deleted = courseContext.deleteTeacherCourse(updated);

            // then
            assertThat(found.getTeacherId()).isEqualTo(7L);
            assertThat(updated.getTeacherId()).isEqualTo(7L);
            assertThat(updated.getCourseId()).isEqualTo(202L);
            assertThat(deleted.isOk()).isTrue();
            assertThat(courseContext.listTeacherCourses()).isEmpty();
        }

        @Test
        @DisplayName("없는 id 조회는 예외 대신 NOT_FOUND")
        void getMissing_shouldReturnNotFound() {
            // when
            Result<TeacherCourse> result = courseContext.getTeacherCourse(12_345L);

            // then
            assertThat(failureOf(result).message()).isEqualTo("Teacher Course Does Not Exist");
            assertThat(failureOf(courseContext.deleteTeacherCourse(result)).message())
                    .isEqualTo("Teacher Course Does Not Exist");
        }

        @Test
        @DisplayName("필수 id가 없으면 VALIDATION 실패")
        void createInvalid_shouldFail() {
            // when
            Result<TeacherCourse> result = courseContext.createTeacherCourse(new TeacherCourseAttrs(7L, null));

            // then
            assertThat(failureOf(result).changeSet().errorsOn("courseId")).containsExactly("can't be blank");
            assertThat(teacherCourseRepository.count()).isZero();
        }
    }

    @Nested
    @DisplayName("StudentCourse")
    class StudentCourseTest {

        @Test
        @DisplayName("생성 → 조회 → 수정 → 두 번 삭제")
        void crudCycle() {
            // given
            StudentCourse created = courseContext.createStudentCourse(new StudentCourseAttrs(42L, 101L)).getOrThrow();

            // when
            Result<StudentCourse> updated = courseContext.updateStudentCourse(
                    courseContext.getStudentCourse(created.getId()), new StudentCourseAttrs(43L, null));
            Result<StudentCourse> first = courseContext.deleteStudentCourse(created);
            Result<StudentCourse> second = courseContext.deleteStudentCourse(created);

            // then
            assertThat(updated.getOrThrow().getStudentId()).isEqualTo(43L);
            assertThat(updated.getOrThrow().getCourseId()).isEqualTo(101L);
            assertThat(first.isOk()).isTrue();
            assertThat(failureOf(second).message()).isEqualTo("Unable to Delete Student Course!");
        }

        @Test
        @DisplayName("changeStudentCourse는 바뀌는 필드만 담는다")
        void change_shouldContainOnlyChangedFields() {
            // given
            StudentCourse created = courseContext.createStudentCourse(new StudentCourseAttrs(42L, 101L)).getOrThrow();

            // when
            ChangeSet<StudentCourse, StudentCourseAttrs> changeSet =
                    courseContext.changeStudentCourse(created, new StudentCourseAttrs(42L, 102L));

            // then
            assertThat(changeSet.isValid()).isTrue();
            assertThat(changeSet.changes()).containsExactly(entry("courseId", 102L));
        }
    }
}
