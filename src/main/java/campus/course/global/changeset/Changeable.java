package campus.course.global.changeset;

/**
 * ChangeSet을 통해서만 변경되는 영속 레코드
 */
public interface Changeable<A extends Attributes<A>> {

    Long getId();

    A currentAttributes();

    void applyAttributes(A attributes);
}
