package at.sv.mixer.catalog;

import at.sv.mixer.color.ColorTriple;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@AllArgsConstructor
@Builder
public final class PigmentEntry {
    private final String code;
    private final String name;
    private final String manufacturer;
    /**
     * E.g. basic, metallic, clear, character.
     */
    private final String category;
    private final ColorTriple lab;

    public boolean isInCategory(String otherCategory) {
        return category != null && category.equalsIgnoreCase(otherCategory);
    }
}
