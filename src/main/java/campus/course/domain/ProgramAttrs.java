package campus.course.domain;

import campus.course.global.changeset.Attributes;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.LinkedHashMap;
import java.util.Map;

public record ProgramAttrs(
        @NotBlank(message = "can't be blank")
        @Size(max = 255, message = "should be at most 255 character(s)")
        String name,

        @Size(max = 1000, message = "should be at most 1000 character(s)")
        String description
) implements Attributes<ProgramAttrs> {

    public static ProgramAttrs empty() {
        return new ProgramAttrs(null, null);
    }

    @Override
    public ProgramAttrs mergedWith(ProgramAttrs patch) {
        return new ProgramAttrs(
                Attributes.pick(patch.name, name),
                Attributes.pick(patch.description, description));
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("description", description);
        return fields;
    }
}
