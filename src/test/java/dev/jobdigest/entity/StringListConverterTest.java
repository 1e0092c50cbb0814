package dev.jobdigest.entity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringListConverterTest {

    private final StringListConverter converter = new StringListConverter();

    @Test
    void shouldStoreListAsJsonArray() {
        assertThat(converter.convertToDatabaseColumn(List.of("Java", "Spring \"Boot\"")))
                .isEqualTo("[\"Java\",\"Spring \\\"Boot\\\"\"]");
        assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("[]");
    }

    @Test
    void shouldReadBlankColumnAsEmptyList() {
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
        assertThat(converter.convertToEntityAttribute("  ")).isEmpty();
    }

    @Test
    void shouldReturnMutableList() {
        List<String> skills = converter.convertToEntityAttribute("[\"Java\",\"Kotlin\"]");
        skills.add("Go");

        assertThat(skills).containsExactly("Java", "Kotlin", "Go");
    }

    @Test
    void shouldRejectCorruptColumn() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{oops"))
                .isInstanceOf(IllegalStateException.class);
    }
}
