package com.adlanda.perema.entity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CirclesConverterTest {

    private CirclesConverter converter;

    @BeforeEach
    void setUp() {
        converter = new CirclesConverter();
    }

    @Test
    void convertToDatabaseColumn_writesJsonArray() {
        assertThat(converter.convertToDatabaseColumn(List.of("family", "work")))
                .isEqualTo("[\"family\",\"work\"]");
    }

    @Test
    void convertToDatabaseColumn_emptyList_isNull() {
        assertThat(converter.convertToDatabaseColumn(List.of())).isNull();
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
    }

    @Test
    void convertToEntityAttribute_readsJsonArray() {
        assertThat(converter.convertToEntityAttribute("[\"family\",\"book club\"]"))
                .containsExactly("family", "book club");
    }

    @Test
    void convertToEntityAttribute_null_isEmptyMutableList() {
        List<String> circles = converter.convertToEntityAttribute(null);

        assertThat(circles).isEmpty();
        circles.add("work");  // must stay mutable for JPA dirty checking
        assertThat(circles).containsExactly("work");
    }

    @Test
    void convertToEntityAttribute_garbage_throws() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("family,work"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
