package io.apipipeline.server.core.validation;

import io.apipipeline.server.spi.ValidationResult;
import io.apipipeline.server.spi.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemasTest {

    @Test
    void requiredAndDefault() {
        assertThat(Schemas.string().required().validate(null).violations())
                .extracting(Violation::message)
                .containsExactly("Value is required");
        assertThat(Schemas.string().validate(null).isValid()).isTrue();
        assertThat(Schemas.number().defaultValue(10).validate(null).value()).isEqualTo(10);
    }

    @Test
    void typeMismatchNamesBothTypes() {
        ValidationResult<Number> r = Schemas.number().validate("12");

        assertThat(r.violations()).singleElement().satisfies(v -> {
            assertThat(v.message()).isEqualTo("Expected number, received string");
            assertThat(v.type()).isEqualTo("type");
        });
        assertThat(Schemas.object().validate(List.of()).violations().get(0).message())
                .isEqualTo("Expected object, received array");
    }

    @Test
    void stringConstraints() {
        Schemas.StringSchema schema = Schemas.string().minLength(3).maxLength(5).pattern("^[a-z]+$");

        assertThat(schema.validate("abcd").isValid()).isTrue();
        assertThat(schema.validate("ab").violations()).extracting(Violation::type).containsExactly("minLength");
        assertThat(schema.validate("ABCDEF").violations()).extracting(Violation::type)
                .containsExactly("maxLength", "pattern");
    }

    @Test
    void numberBounds() {
        Schemas.NumberSchema schema = Schemas.number().min(1).max(2.5);

        assertThat(schema.validate(2).isValid()).isTrue();
        assertThat(schema.validate(0).violations()).extracting(Violation::message)
                .containsExactly("Number must be greater than or equal to 1");
        assertThat(schema.validate(3L).violations()).extracting(Violation::message)
                .containsExactly("Number must be less than or equal to 2.5");
    }

    @Test
    void oneOfComparesNumbersByValue() {
        assertThat(Schemas.number().oneOf(1, 2).validate(2.0).isValid()).isTrue();
        assertThat(Schemas.string().oneOf("asc", "desc").validate("up").violations())
                .extracting(Violation::message)
                .containsExactly("Value must be one of: asc, desc");
    }

    @Test
    void objectKeepsDeclaredPropertiesAndNestsPaths() {
        Schemas.ObjectSchema schema = Schemas.object()
                .property("name", Schemas.string().required())
                .property("role", Schemas.string().defaultValue("user"))
                .property("tags", Schemas.array(Schemas.string().minLength(2)));

        ValidationResult<Map<String, Object>> ok = schema.validate(Map.of("name", "Ann", "extra", true));
        assertThat(ok.isValid()).isTrue();
        assertThat(ok.value()).containsExactly(Map.entry("name", "Ann"), Map.entry("role", "user"));

        ValidationResult<Map<String, Object>> bad = schema.validate(Map.of("tags", List.of("ok", "x")));
        assertThat(bad.violations()).extracting(Violation::path)
                .containsExactly(List.of("name"), List.of("tags", 1));
    }

    @Test
    void arrayLengthBounds() {
        Schemas.ArraySchema schema = Schemas.array(Schemas.number()).minLength(1).maxLength(2);

        assertThat(schema.validate(List.of()).violations()).extracting(Violation::message)
                .containsExactly("Array must contain at least 1 items");
        assertThat(schema.validate(List.of(1, 2, 3)).violations()).extracting(Violation::type)
                .containsExactly("maxLength");
    }
}
