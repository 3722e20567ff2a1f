package com.mapper.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mapper.exception.MapperException;
import com.mapper.model.AttributeOverride;
import com.mapper.model.ComputedOptionalRequired;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OverrideLoaderTest {

    private final OverrideLoader overrideLoader = new OverrideLoader();

    @Test
    void load_shouldReadOverridesKeyedByPath() throws Exception {
        URL resource = getClass().getClassLoader().getResource("test-overrides.json");
        assertThat(resource).isNotNull();

        Map<String, AttributeOverride> overrides = overrideLoader.load(Paths.get(resource.toURI()).toString());

        assertThat(overrides.keySet()).containsExactly("disks.size_gb", "name");
        assertThat(overrides.get("disks.size_gb")).isEqualTo(new AttributeOverride(ComputedOptionalRequired.COMPUTED, null));
        assertThat(overrides.get("name")).isEqualTo(new AttributeOverride(null, true));
    }

    @Test
    void load_shouldReturnNoOverridesForBlankLocation() {
        assertThat(overrideLoader.load("")).isEmpty();
        assertThat(overrideLoader.load(null)).isEmpty();
    }

    @Test
    void load_shouldFailForMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> overrideLoader.load(tempDir.resolve("missing.json").toString()))
                .isInstanceOf(MapperException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_shouldFailForMalformedFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("overrides.json");
        Files.writeString(file, "{\"name\": {\"computability\": \"sometimes\"}}");

        assertThatThrownBy(() -> overrideLoader.load(file.toString()))
                .isInstanceOf(MapperException.class)
                .hasMessageContaining("Failed to read overrides file");
    }
}
