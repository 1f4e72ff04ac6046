package at.sv.mixer.recipe;

import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.color.DeltaEMethod;
import at.sv.mixer.color.LabConverter;
import at.sv.mixer.color.RGBColor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
@Builder
public final class RecipeResult {
    private final ColorTriple target;
    private final List<RecipeLine> lines;
    /**
     * The predicted color of the recipe as written, i.e. after dropping small shares and rounding.
     */
    private final ColorTriple mixed;
    private final double deltaE;
    private final DeltaEMethod metric;
    private final double batchMassGrams;
    private final double dilutionFraction;

    public int getPercentageSum() {
        return lines.stream().mapToInt(RecipeLine::percentage).sum();
    }

    public double getGramsSum() {
        return lines.stream().mapToDouble(RecipeLine::grams).sum();
    }

    public MatchQuality getMatchQuality() {
        return MatchQuality.of(deltaE);
    }

    public RGBColor getTargetPreview() {
        return LabConverter.labToRgb(target);
    }

    public RGBColor getMixedPreview() {
        return LabConverter.labToRgb(mixed);
    }
}
