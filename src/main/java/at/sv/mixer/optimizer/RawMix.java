package at.sv.mixer.optimizer;

import at.sv.mixer.catalog.PigmentEntry;

import java.util.List;

/**
 * The best mix found by the search, before it is turned into a recipe.
 *
 * @param pigments the mixed pigments
 * @param ratios   the ratios of the pigments, summing up to 1
 * @param distance the distance to the target under the search metric
 */
public record RawMix(List<PigmentEntry> pigments, double[] ratios, double distance) {

    public RawMix {
        pigments = List.copyOf(pigments);
        ratios = ratios.clone();
    }

    public int size() {
        return pigments.size();
    }
}
