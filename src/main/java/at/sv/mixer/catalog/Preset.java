package at.sv.mixer.catalog;

import at.sv.mixer.color.ColorTriple;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named reference color, e.g. an aircraft or tank camouflage color.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Preset(@JsonProperty("name") String name,
                     @JsonProperty("category") String category,
                     @JsonProperty("L") double L,
                     @JsonProperty("a") double a,
                     @JsonProperty("b") double b) {

    public ColorTriple color() {
        return new ColorTriple(L, a, b);
    }
}
