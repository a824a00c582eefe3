package campus.course.domain;

import campus.course.global.changeset.Changeable;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;

/**
 * 하나의 {@link Program}에 속한 학기
 *
 * <p>FK는 {@code programId} 컬럼으로 쓰고, {@code program} 연관관계는 읽기 전용입니다.
 * {@code program}은 {@code SemesterRepository#findByIdAndProgramId}로 조회한 경우에만 초기화되어 있습니다.</p>
 */
@Entity
@Getter
@ToString(exclude = "program") // LAZY 연관관계 초기화 방지
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "semesters", indexes = @Index(name = "idx_semesters_program_id", columnList = "program_id"))
public class Semester extends BaseTimeEntity implements Changeable<SemesterAttrs> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "program_id", nullable = false)
    private Long programId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "program_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_semesters_program_id"))
    private Program program;

    @Column(name = "starts_on")
    private LocalDate startsOn;

    @Column(name = "ends_on")
    private LocalDate endsOn;

    public static Semester blank() {
        return new Semester();
    }

    @Override
    public SemesterAttrs currentAttributes() {
        return new SemesterAttrs(name, programId, startsOn, endsOn);
    }

    @Override
    public void applyAttributes(SemesterAttrs attributes) {
        this.name = attributes.name();
        this.programId = attributes.programId();
        this.startsOn = attributes.startsOn();
        this.endsOn = attributes.endsOn();
    }
}
