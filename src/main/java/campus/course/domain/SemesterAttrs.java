package campus.course.domain;

import campus.course.domain.validation.ValidSemesterPeriod;
import campus.course.global.changeset.Attributes;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@ValidSemesterPeriod
public record SemesterAttrs(
        @NotBlank(message = "can't be blank")
        @Size(max = 255, message = "should be at most 255 character(s)")
        String name,

        @NotNull(message = "can't be blank")
        @Positive(message = "must be a valid id")
        Long programId,

        LocalDate startsOn,
        LocalDate endsOn
) implements Attributes<SemesterAttrs> {

    public static SemesterAttrs empty() {
        return new SemesterAttrs(null, null, null, null);
    }

    @Override
    public SemesterAttrs mergedWith(SemesterAttrs patch) {
        return new SemesterAttrs(
                Attributes.pick(patch.name, name),
                Attributes.pick(patch.programId, programId),
                Attributes.pick(patch.startsOn, startsOn),
                Attributes.pick(patch.endsOn, endsOn));
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("programId", programId);
        fields.put("startsOn", startsOn);
        fields.put("endsOn", endsOn);
        return fields;
    }
}
