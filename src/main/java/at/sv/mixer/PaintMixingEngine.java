package at.sv.mixer;

import at.sv.mixer.catalog.PigmentEntry;
import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.color.DeltaEMethod;
import at.sv.mixer.mixing.MixingModel;
import at.sv.mixer.mixing.PigmentMixer;
import at.sv.mixer.optimizer.MixConstraints;
import at.sv.mixer.optimizer.RawMix;
import at.sv.mixer.optimizer.RecipeOptimizer;
import at.sv.mixer.recipe.RecipeFormatter;
import at.sv.mixer.recipe.RecipeResult;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Entry point for mixing predictions, color differences and recipe searches.
 */
public final class PaintMixingEngine {

    private final RecipeOptimizer optimizer;
    private final RecipeFormatter formatter;

    /**
     * @param executor runs the evaluation of pigment combinations, use {@code Runnable::run} to search on the
     *                 calling thread
     */
    public PaintMixingEngine(Executor executor) {
        this(new RecipeOptimizer(executor), new RecipeFormatter());
    }

    public PaintMixingEngine(RecipeOptimizer optimizer, RecipeFormatter formatter) {
        this.optimizer = optimizer;
        this.formatter = formatter;
    }

    public ColorTriple mix(List<ColorTriple> colors, double[] ratios, MixingModel model) {
        return mix(colors, ratios, model, PigmentMixer.DEFAULT_GAMMA);
    }

    public ColorTriple mix(List<ColorTriple> colors, double[] ratios, MixingModel model, double gamma) {
        return new PigmentMixer(gamma).mix(colors, ratios, model);
    }

    public double colorDifference(ColorTriple a, ColorTriple b, DeltaEMethod method) {
        return ColorDifference.colorDifference(a, b, method);
    }

    /**
     * @throws at.sv.mixer.optimizer.EmptyCatalogException       if no pigment passes the filters of the constraints
     * @throws at.sv.mixer.optimizer.InvalidConstraintsException if the constraints are invalid
     */
    public RecipeResult optimizeRecipe(ColorTriple target, List<PigmentEntry> catalog, MixConstraints constraints) {
        RawMix mix = optimizer.search(target, catalog, constraints);
        return formatter.format(target, mix, constraints);
    }
}
