package at.sv.mixer.recipe;

import at.sv.mixer.catalog.PigmentEntry;
import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.mixing.PigmentMixer;
import at.sv.mixer.optimizer.MixConstraints;
import at.sv.mixer.optimizer.RawMix;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the raw search result into a recipe that can be mixed: shares below 5% are dropped, the rest is rounded to
 * whole percentages summing up to exactly 100 and converted to grams of the batch. The mixed color and its distance
 * are predicted again from the final percentages.
 */
public final class RecipeFormatter {

    public static final double MIN_SHARE = 0.05;

    public RecipeResult format(ColorTriple target, RawMix mix, MixConstraints constraints) {
        List<Integer> kept = keptIndices(mix.ratios());
        int[] percentages = toPercentages(mix.ratios(), kept);

        double batchMass = constraints.getBatchMassGrams();
        List<RecipeLine> lines = new ArrayList<>(kept.size());
        List<ColorTriple> colors = new ArrayList<>(kept.size());
        double[] ratios = new double[kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            PigmentEntry pigment = mix.pigments().get(kept.get(i));
            lines.add(new RecipeLine(pigment, percentages[i], percentages[i] / 100.0 * batchMass));
            colors.add(pigment.getLab());
            ratios[i] = percentages[i] / 100.0 * constraints.getColorShare();
        }
        lines.sort(Comparator.comparingInt(RecipeLine::percentage).reversed());

        ColorTriple mixed = new PigmentMixer(constraints.getGamma()).mix(colors, ratios, constraints.getMixingModel());
        return RecipeResult.builder()
                           .target(target)
                           .lines(List.copyOf(lines))
                           .mixed(mixed)
                           .deltaE(ColorDifference.colorDifference(target, mixed, constraints.getReportMetric()))
                           .metric(constraints.getReportMetric())
                           .batchMassGrams(batchMass)
                           .dilutionFraction(constraints.getDilutionFraction())
                           .build();
    }

    /**
     * @return the indices of all shares of at least 5%, or the index of the largest share if there are none
     */
    private static List<Integer> keptIndices(double[] ratios) {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < ratios.length; i++) {
            if (ratios[i] >= MIN_SHARE) {
                kept.add(i);
            }
        }
        if (kept.isEmpty()) {
            int largest = 0;
            for (int i = 1; i < ratios.length; i++) {
                if (ratios[i] > ratios[largest]) {
                    largest = i;
                }
            }
            kept.add(largest);
        }
        return kept;
    }

    /**
     * Rounds the renormalized shares to whole percentages. The rounding remainder goes to the largest share.
     */
    private static int[] toPercentages(double[] ratios, List<Integer> kept) {
        double total = 0;
        for (int index : kept) {
            total += ratios[index];
        }
        int[] percentages = new int[kept.size()];
        int sum = 0;
        int largest = 0;
        for (int i = 0; i < kept.size(); i++) {
            percentages[i] = total > 0 ? (int) Math.round(ratios[kept.get(i)] / total * 100) : 100 / kept.size();
            sum += percentages[i];
            if (percentages[i] > percentages[largest]) {
                largest = i;
            }
        }
        percentages[largest] += 100 - sum;
        return percentages;
    }
}
