package com.mapper.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class AttributeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void scalar_shouldOnlyKeepSensitivityOnStrings() {
        assertThat(Attribute.scalar("pw", AttributeKind.STRING, ComputedOptionalRequired.REQUIRED, null, true).getSensitive()).isTrue();
        assertThat(Attribute.scalar("pin", AttributeKind.INT64, ComputedOptionalRequired.REQUIRED, null, true).getSensitive()).isNull();
    }

    @Test
    void factories_shouldRejectKindsOfTheWrongVariant() {
        assertThatThrownBy(() -> Attribute.scalar("a", AttributeKind.LIST, ComputedOptionalRequired.OPTIONAL, null, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Attribute.collection("a", AttributeKind.MAP, ComputedOptionalRequired.OPTIONAL, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Attribute.nested("a", AttributeKind.STRING, ComputedOptionalRequired.OPTIONAL, null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ElementType.scalar(AttributeKind.MAP_NESTED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void json_shouldOnlyContainThePopulatedVariant() throws Exception {
        Attribute attribute = Attribute.nested("labels_by_zone", AttributeKind.MAP_NESTED, ComputedOptionalRequired.COMPUTED_OPTIONAL,
                "zones", List.of(
                        Attribute.collection("labels", AttributeKind.MAP, ComputedOptionalRequired.REQUIRED, null,
                                ElementType.mapOf(ElementType.scalar(AttributeKind.STRING))),
                        Attribute.scalar("size", AttributeKind.INT64, ComputedOptionalRequired.COMPUTED_OPTIONAL, null, false)
                                .withDefaultValue(3L)));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(attribute));

        assertThat(json.get("kind").asText()).isEqualTo("map_nested");
        assertThat(json.get("computed_optional_required").asText()).isEqualTo("computed_optional");
        assertThat(json.has("element_type")).isFalse();
        assertThat(json.has("sensitive")).isFalse();
        JsonNode labels = json.get("attributes").get(0);
        assertThat(labels.get("element_type").get("kind").asText()).isEqualTo("map");
        assertThat(labels.get("element_type").get("element_type").get("kind").asText()).isEqualTo("string");
        assertThat(labels.has("attributes")).isFalse();
        assertThat(json.get("attributes").get(1).get("default").asLong()).isEqualTo(3L);
    }

    @Test
    void computability_shouldParseJsonAndConstantNames() {
        assertThat(ComputedOptionalRequired.fromString("computed_optional")).isEqualTo(ComputedOptionalRequired.COMPUTED_OPTIONAL);
        assertThat(ComputedOptionalRequired.fromString("Computed-Optional")).isEqualTo(ComputedOptionalRequired.COMPUTED_OPTIONAL);
        assertThat(ComputedOptionalRequired.fromString("REQUIRED")).isEqualTo(ComputedOptionalRequired.REQUIRED);
    }

    @Test
    void path_shouldRenderAsDottedNames() {
        assertThat(AttributePath.root()).hasToString("<root>");
        assertThat(AttributePath.of("a", "b").child("c")).hasToString("a.b.c");
        assertThat(AttributePath.of("a", "b")).isEqualTo(AttributePath.root().child("a").child("b"));
    }
}
