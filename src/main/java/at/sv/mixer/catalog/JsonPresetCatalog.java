package at.sv.mixer.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads presets from JSON of the form {@code {"presets": [{"name": .., "category": .., "L": .., "a": .., "b": ..}]}}.
 */
@Slf4j
public final class JsonPresetCatalog implements PresetCatalog {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private final List<Preset> presets;

    private JsonPresetCatalog(List<Preset> presets) {
        this.presets = List.copyOf(presets);
    }

    public static JsonPresetCatalog load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            JsonPresetCatalog catalog = read(in);
            log.info("Loaded {} presets from '{}'", catalog.presets.size(), file);
            return catalog;
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read presets '" + file + "': " + e.getMessage(), e);
        }
    }

    public static JsonPresetCatalog read(InputStream in) throws IOException {
        PresetFile presetFile = MAPPER.readValue(in, PresetFile.class);
        if (presetFile.presets() == null) {
            throw new CatalogLoadException("Preset file does not contain a 'presets' list");
        }
        for (Preset preset : presetFile.presets()) {
            if (preset.name() == null || preset.name().isBlank()) {
                throw new CatalogLoadException("Preset without name: " + preset);
            }
        }
        return new JsonPresetCatalog(presetFile.presets());
    }

    @Override
    public List<Preset> getPresets() {
        return presets;
    }

    @Override
    public Optional<Preset> findByName(String name) {
        String normalized = normalize(name);
        return presets.stream()
                      .filter(preset -> normalize(preset.name()).equals(normalized))
                      .findFirst();
    }

    @Override
    public List<Preset> getPresetsByCategory(String category) {
        String normalized = normalize(category);
        return presets.stream()
                      .filter(preset -> preset.category() != null && normalize(preset.category()).equals(normalized))
                      .collect(Collectors.toList());
    }

    private static String normalize(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PresetFile(@JsonProperty("presets") List<Preset> presets) {
    }
}
