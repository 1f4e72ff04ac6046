package at.sv.mixer.catalog;

import java.util.List;
import java.util.Optional;

public interface PresetCatalog {

    List<Preset> getPresets();

    /**
     * @param name the preset name, compared case-insensitive
     */
    Optional<Preset> findByName(String name);

    List<Preset> getPresetsByCategory(String category);
}
