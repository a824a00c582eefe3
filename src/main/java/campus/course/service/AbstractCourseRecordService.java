package campus.course.service;

import campus.course.domain.CourseRecordType;
import campus.course.global.changeset.Attributes;
import campus.course.global.changeset.ChangeSet;
import campus.course.global.changeset.ChangeSetFactory;
import campus.course.global.changeset.Changeable;
import campus.course.global.result.CourseFailure;
import campus.course.global.result.CourseFailure.WriteAction;
import campus.course.global.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 레코드 종류와 무관하게 동일한 명령 템플릿 (create / update / delete / change)
 *
 * <h4>규칙</h4>
 * <ul>
 *   <li>모든 실패는 {@link Result.Failure}로 반환하며 예외를 던지지 않습니다.</li>
 *   <li>쓰기는 검증을 통과한 ChangeSet으로만 수행합니다.</li>
 *   <li>실패한 조회 결과를 받은 update/delete는 검증·저장 단계를 호출하지 않고 그대로 전달합니다.</li>
 *   <li>서비스 레벨 트랜잭션은 열지 않습니다. 각 Repository 호출이 하나의 문장(트랜잭션)입니다.</li>
 * </ul>
 *
 * @param <E> 영속 레코드
 * @param <A> 레코드의 필드 집합
 */
@Slf4j
public abstract class AbstractCourseRecordService<E extends Changeable<A>, A extends Attributes<A>> {

    private final JpaRepository<E, Long> repository;
    private final ChangeSetFactory changeSetFactory;
    private final CourseRecordType recordType;

    protected AbstractCourseRecordService(JpaRepository<E, Long> repository,
                                          ChangeSetFactory changeSetFactory,
                                          CourseRecordType recordType) {
        this.repository = repository;
        this.changeSetFactory = changeSetFactory;
        this.recordType = recordType;
    }

    /** create 시 ChangeSet의 바탕이 되는 빈 레코드 */
    protected abstract E newRecord();

    /** 단일 DELETE 문을 실행하고 삭제된 행 수를 반환 */
    protected abstract int deleteRow(Long id);

    /**
     * 수정 직후 결과로 돌려줄 레코드. 연관관계를 다시 읽어야 하는 레코드만 재정의합니다.
     */
    protected E refreshed(E saved) {
        return saved;
    }

    public ChangeSet<E, A> change(E record) {
        return change(record, null);
    }

    public ChangeSet<E, A> change(E record, A attributes) {
        return changeSetFactory.build(record, attributes);
    }

    public Result<E> create(A attributes) {
        ChangeSet<E, A> changeSet = change(newRecord(), attributes);
        if (!changeSet.isValid()) {
            return invalid(changeSet);
        }

        E record = changeSet.data();
        record.applyAttributes(changeSet.attributes());
        return write(WriteAction.CREATE, () -> repository.saveAndFlush(record));
    }

    public Result<E> update(Result<E> lookup, A attributes) {
        return lookup.flatMap(record -> update(record, attributes));
    }

    /**
     * 호출자가 이미 조회한 레코드를 수정합니다.
     *
     * <p>변경 사항이 없으면 쓰기 없이 레코드를 그대로 돌려줍니다.
     * 조회 이후 행이 사라졌다면 NOT_FOUND 입니다.</p>
     *
     * <p>준영속 레코드는 merge된 사본으로 저장되므로 호출자의 인스턴스는 원래 값으로 되돌리고,
     * 쓰기가 거부된 경우에도 되돌립니다. 결과는 {@link #refreshed(Changeable)}를 거친 레코드입니다.</p>
     */
    public Result<E> update(E record, A attributes) {
        ChangeSet<E, A> changeSet = change(record, attributes);
        if (!changeSet.isValid()) {
            return invalid(changeSet);
        }
        if (!changeSet.hasChanges()) {
            return Result.ok(record);
        }
        if (record.getId() == null || !repository.existsById(record.getId())) {
            return notFound();
        }

        A previous = record.currentAttributes();
        record.applyAttributes(changeSet.attributes());
        Result<E> result = write(WriteAction.UPDATE, () -> {
            E saved = repository.saveAndFlush(record);
            if (saved != record) {
                record.applyAttributes(previous);
            }
            return refreshed(saved);
        });
        if (result.isFailure()) {
            record.applyAttributes(previous);
        }
        return result;
    }

    public Result<E> delete(Result<E> lookup) {
        return lookup.flatMap(this::delete);
    }

    /**
     * 이미 삭제된 레코드를 다시 지우면 영향받은 행이 0이므로 STORAGE_FAILURE 입니다.
     */
    public Result<E> delete(E record) {
        if (record.getId() == null) {
            return Result.failure(CourseFailure.storage(WriteAction.DELETE, recordType.getLabel()));
        }
        return write(WriteAction.DELETE, () -> deleteRow(record.getId()) > 0 ? record : null);
    }

    protected Result<E> found(Optional<E> row) {
        return row.<Result<E>>map(Result::ok).orElseGet(this::notFound);
    }

    protected Result<E> findOne(Long id) {
        if (id == null) {
            return notFound();
        }
        return found(repository.findById(id));
    }

    protected Result<E> notFound() {
        return Result.failure(CourseFailure.notFound(recordType.getLabel()));
    }

    private Result<E> invalid(ChangeSet<E, A> changeSet) {
        log.debug("[{}] ChangeSet 검증 실패: {}", recordType.getLabel(), changeSet.errors());
        return Result.failure(CourseFailure.invalid(recordType.getLabel(), changeSet));
    }

    /**
     * 저장소 호출을 실행하고 결과를 Result로 감쌉니다.
     * statement가 null을 반환하면 반영된 행이 없다는 뜻입니다.
     */
    private Result<E> write(WriteAction action, Supplier<E> statement) {
        String label = recordType.getLabel();
        try {
            E written = statement.get();
            if (written == null) {
                log.warn("[{}] {} 반영된 행 없음", label, action);
                return Result.failure(CourseFailure.storage(action, label));
            }
            log.info("[{}] {} 완료 (id: {})", label, action, written.getId());
            return Result.ok(written);
        } catch (DataAccessException e) {
            log.warn("[{}] {} 거부됨: {}", label, action, e.getMostSpecificCause().getMessage());
            return Result.failure(CourseFailure.storage(action, label));
        }
    }
}
