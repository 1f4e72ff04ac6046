package at.sv.mixer.optimizer;

import at.sv.mixer.catalog.PigmentEntry;
import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.mixing.PigmentMixer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Searches the pigment combinations and mixing ratios that come closest to a target color.
 * <p>
 * The search walks through tiers of 1, 2 and 3 pigments drawn from the candidate pool. Pairs are mixed on a 5% ratio
 * grid, triples on a 10% grid where every pigment gets at least 10%. The best mix over all tiers wins; between
 * equally good mixes the one found first wins, in the order of tiers, then ascending candidate indices, then ascending
 * ratios. Each combination is evaluated as a separate task on the given executor, results are reduced in enumeration
 * order, so the outcome does not depend on the executor.
 * <p>
 * Combinations of more than {@link #SEARCH_CEILING} pigments are never explored, even if the constraints allow more.
 */
@Slf4j
public final class RecipeOptimizer {

    public static final int SEARCH_CEILING = 3;

    private static final int PAIR_GRID_STEPS = 20;
    private static final int TRIPLE_GRID_STEPS = 10;

    private final CandidateSelector candidateSelector;
    private final Executor executor;

    public RecipeOptimizer(Executor executor) {
        this(new CandidateSelector(), executor);
    }

    public RecipeOptimizer(CandidateSelector candidateSelector, Executor executor) {
        this.candidateSelector = candidateSelector;
        this.executor = executor;
    }

    public static int effectiveTierLimit(MixConstraints constraints) {
        return Math.min(constraints.getMaxPigments(), SEARCH_CEILING);
    }

    /**
     * @throws EmptyCatalogException       if no pigment is left after filtering the catalog
     * @throws InvalidConstraintsException if the constraints are invalid
     */
    public RawMix search(ColorTriple target, List<PigmentEntry> catalog, MixConstraints constraints) {
        constraints.validate();
        List<PigmentEntry> candidates = candidateSelector.selectCandidates(target, catalog, constraints);
        if (candidates.isEmpty()) {
            throw new EmptyCatalogException("No pigments left to mix from. Catalog size: " + catalog.size() +
                                            ", excluded categories: " + constraints.getExcludedCategories() +
                                            ", excluded codes: " + constraints.getExcludedCodes() +
                                            ", manufacturers: " + constraints.getManufacturers());
        }
        int tierLimit = effectiveTierLimit(constraints);
        if (constraints.getMaxPigments() > SEARCH_CEILING) {
            log.warn("Max pigments is {}, but only combinations of up to {} pigments are searched",
                    constraints.getMaxPigments(), SEARCH_CEILING);
        }
        MixEvaluator evaluator = new MixEvaluator(target, candidates, constraints);

        long start = System.nanoTime();
        RawMix best = null;
        for (int tier = 1; tier <= tierLimit; tier++) {
            RawMix tierBest = searchTier(evaluator, tier);
            if (tierBest == null) {
                log.debug("Tier {}: not enough candidates", tier);
                continue;
            }
            log.debug("Tier {}: best distance {} with {}", tier, tierBest.distance(), codes(tierBest));
            if (best == null || improves(tierBest.distance(), best.distance())) {
                best = tierBest;
            }
        }
        log.info("Searched {} candidates up to {} pigments in {} ms: best distance {} with {}",
                candidates.size(), tierLimit, (System.nanoTime() - start) / 1_000_000, best.distance(), codes(best));
        return best;
    }

    /**
     * @return the best mix of the tier, or null if there are fewer candidates than pigments in the tier
     */
    private RawMix searchTier(MixEvaluator evaluator, int tier) {
        List<CompletableFuture<RawMix>> tasks = new ArrayList<>();
        for (int[] combination : combinations(evaluator.candidateCount(), tier)) {
            tasks.add(CompletableFuture.supplyAsync(() -> evaluator.searchCombination(combination), executor));
        }
        RawMix best = null;
        for (CompletableFuture<RawMix> task : tasks) {
            RawMix result = join(task);
            if (best == null || improves(result.distance(), best.distance())) {
                best = result;
            }
        }
        return best;
    }

    /**
     * Strictly smaller wins, so ties keep the mix found first. An undefined distance never beats a defined one.
     */
    static boolean improves(double distance, double bestDistance) {
        return distance < bestDistance || Double.isNaN(bestDistance) && !Double.isNaN(distance);
    }

    private static RawMix join(CompletableFuture<RawMix> task) {
        try {
            return task.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * All k-subsets of {0..n-1} as ascending index arrays, in lexicographic order.
     */
    static List<int[]> combinations(int n, int k) {
        List<int[]> result = new ArrayList<>();
        if (k > n || k < 1) {
            return result;
        }
        int[] indices = new int[k];
        for (int i = 0; i < k; i++) {
            indices[i] = i;
        }
        while (true) {
            result.add(indices.clone());
            int i = k - 1;
            while (i >= 0 && indices[i] == n - k + i) {
                i--;
            }
            if (i < 0) {
                return result;
            }
            indices[i]++;
            for (int j = i + 1; j < k; j++) {
                indices[j] = indices[j - 1] + 1;
            }
        }
    }

    private static String codes(RawMix mix) {
        return mix.pigments().stream().map(PigmentEntry::getCode).collect(Collectors.joining("+"));
    }

    /**
     * Scans the ratio grid of single combinations. Holds no mutable state, so combinations can be evaluated in
     * parallel.
     */
    private static final class MixEvaluator {
        private final ColorTriple target;
        private final List<PigmentEntry> candidates;
        private final MixConstraints constraints;
        private final PigmentMixer mixer;

        private MixEvaluator(ColorTriple target, List<PigmentEntry> candidates, MixConstraints constraints) {
            this.target = target;
            this.candidates = candidates;
            this.constraints = constraints;
            this.mixer = new PigmentMixer(constraints.getGamma());
        }

        int candidateCount() {
            return candidates.size();
        }

        RawMix searchCombination(int[] combination) {
            List<PigmentEntry> pigments = new ArrayList<>(combination.length);
            List<ColorTriple> colors = new ArrayList<>(combination.length);
            for (int index : combination) {
                pigments.add(candidates.get(index));
                colors.add(candidates.get(index).getLab());
            }
            return switch (combination.length) {
                case 1 -> new RawMix(pigments, new double[]{1.0}, distance(colors, new double[]{1.0}));
                case 2 -> searchPairGrid(pigments, colors);
                case 3 -> searchTripleGrid(pigments, colors);
                default -> throw new IllegalStateException("Unsupported combination size " + combination.length);
            };
        }

        private RawMix searchPairGrid(List<PigmentEntry> pigments, List<ColorTriple> colors) {
            double[] bestRatios = null;
            double bestDistance = Double.MAX_VALUE;
            for (int i = 1; i < PAIR_GRID_STEPS; i++) {
                double[] ratios = {(double) i / PAIR_GRID_STEPS, (double) (PAIR_GRID_STEPS - i) / PAIR_GRID_STEPS};
                double distance = distance(colors, ratios);
                if (bestRatios == null || improves(distance, bestDistance)) {
                    bestDistance = distance;
                    bestRatios = ratios;
                }
            }
            return new RawMix(pigments, bestRatios, bestDistance);
        }

        private RawMix searchTripleGrid(List<PigmentEntry> pigments, List<ColorTriple> colors) {
            double[] bestRatios = null;
            double bestDistance = Double.MAX_VALUE;
            for (int i = 1; i < TRIPLE_GRID_STEPS; i++) {
                for (int j = 1; j < TRIPLE_GRID_STEPS; j++) {
                    int k = TRIPLE_GRID_STEPS - i - j;
                    if (k < 1 || k >= TRIPLE_GRID_STEPS) {
                        continue;
                    }
                    double[] ratios = {(double) i / TRIPLE_GRID_STEPS, (double) j / TRIPLE_GRID_STEPS,
                            (double) k / TRIPLE_GRID_STEPS};
                    double distance = distance(colors, ratios);
                    if (bestRatios == null || improves(distance, bestDistance)) {
                        bestDistance = distance;
                        bestRatios = ratios;
                    }
                }
            }
            return new RawMix(pigments, bestRatios, bestDistance);
        }

        private double distance(List<ColorTriple> colors, double[] ratios) {
            double[] effective = new double[ratios.length];
            for (int i = 0; i < ratios.length; i++) {
                effective[i] = ratios[i] * constraints.getColorShare();
            }
            ColorTriple mixed = mixer.mix(colors, effective, constraints.getMixingModel());
            return ColorDifference.colorDifference(target, mixed, constraints.getSearchMetric());
        }
    }
}
