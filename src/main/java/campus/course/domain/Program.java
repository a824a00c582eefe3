package campus.course.domain;

import campus.course.global.changeset.Changeable;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 최상위 학업 과정. 여러 {@link Semester}를 가집니다.
 */
@Entity
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "programs", indexes = @Index(name = "idx_programs_inserted_at", columnList = "inserted_at"))
public class Program extends BaseTimeEntity implements Changeable<ProgramAttrs> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(length = 1000)
    private String description;

    /**
     * ChangeSet 생성용 빈 레코드. 필드는 {@link #applyAttributes}로만 채워집니다.
     */
    public static Program blank() {
        return new Program();
    }

    @Override
    public ProgramAttrs currentAttributes() {
        return new ProgramAttrs(name, description);
    }

    @Override
    public void applyAttributes(ProgramAttrs attributes) {
        this.name = attributes.name();
        this.description = attributes.description();
    }
}
