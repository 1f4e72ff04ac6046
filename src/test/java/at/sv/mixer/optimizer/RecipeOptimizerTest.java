package at.sv.mixer.optimizer;

import at.sv.mixer.catalog.PigmentEntry;
import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.color.LabConverter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static at.sv.mixer.optimizer.PigmentFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class RecipeOptimizerTest {

    private static final ColorTriple MID_GRAY = LabConverter.rgbToLab(128, 128, 128);

    private final RecipeOptimizer optimizer = new RecipeOptimizer(Runnable::run);

    private RawMix search(ColorTriple target, List<PigmentEntry> catalog, MixConstraints constraints) {
        return optimizer.search(target, catalog, constraints);
    }

    @Test
    void search_whiteAndBlackForMidGray_mostlyWhiteWithSomeBlack() {
        RawMix mix = search(MID_GRAY, List.of(WHITE, BLACK), MixConstraints.defaults());

        // black is slightly closer to the target, so it comes first in the candidate pool
        assertThat(mix.pigments()).containsExactly(BLACK, WHITE);
        assertThat(mix.ratios()).containsExactly(new double[]{0.05, 0.95}, within(1e-12));
        assertThat(mix.distance()).isCloseTo(4.7159, within(1e-4));
        assertThat(mix.distance()).isLessThan(ColorDifference.deltaE76(MID_GRAY, WHITE.getLab()))
                                  .isLessThan(ColorDifference.deltaE76(MID_GRAY, BLACK.getLab()));
    }

    @Test
    void search_targetInCatalog_singlePigmentExactMatch() {
        RawMix mix = search(RED.getLab(), ALL, MixConstraints.defaults());

        assertThat(mix.pigments()).containsExactly(RED);
        assertThat(mix.ratios()).containsExactly(1.0);
        assertThat(mix.distance()).isZero();
    }

    @Test
    void search_metallicExcluded_noMetallicPigments() {
        MixConstraints constraints = MixConstraints.builder().excludedCategories(Set.of("metallic")).build();

        RawMix mix = search(SILVER.getLab(), ALL, constraints);

        assertThat(mix.pigments()).isNotEmpty()
                                  .noneMatch(p -> p.isInCategory("metallic"));
        assertThat(mix.distance()).isPositive();
    }

    @Test
    void search_maxPigmentsAboveCeiling_searchesUpToThree() {
        ColorTriple olive = ColorTriple.of(38.0, -2.0, 18.0);
        MixConstraints three = MixConstraints.defaults();
        MixConstraints five = three.toBuilder().maxPigments(5).build();

        RawMix withThree = search(olive, ALL, three);
        RawMix withFive = search(olive, ALL, five);

        assertThat(withFive.size()).isLessThanOrEqualTo(RecipeOptimizer.SEARCH_CEILING);
        assertThat(withFive.pigments()).isEqualTo(withThree.pigments());
        assertThat(withFive.distance()).isEqualTo(withThree.distance());
    }

    @Test
    void search_morePigmentsAllowed_neverWorse() {
        ColorTriple olive = ColorTriple.of(38.0, -2.0, 18.0);

        RawMix one = search(olive, ALL, MixConstraints.builder().maxPigments(1).build());
        RawMix two = search(olive, ALL, MixConstraints.builder().maxPigments(2).build());
        RawMix three = search(olive, ALL, MixConstraints.builder().maxPigments(3).build());

        assertThat(one.size()).isEqualTo(1);
        assertThat(two.size()).isLessThanOrEqualTo(2);
        assertThat(two.distance()).isLessThanOrEqualTo(one.distance());
        assertThat(three.distance()).isLessThanOrEqualTo(two.distance());
    }

    @Test
    void search_ratiosSumUpToOne() {
        RawMix mix = search(ColorTriple.of(60, 20, 30), ALL, MixConstraints.defaults());

        double sum = 0;
        for (double ratio : mix.ratios()) {
            assertThat(ratio).isGreaterThan(0);
            sum += ratio;
        }
        assertThat(sum).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void search_dilution_sameRecipe() {
        ColorTriple target = ColorTriple.of(60, 20, 30);

        RawMix undiluted = search(target, ALL, MixConstraints.defaults());
        RawMix diluted = search(target, ALL, MixConstraints.builder().dilutionFraction(0.2).build());

        assertThat(diluted.pigments()).isEqualTo(undiluted.pigments());
        assertThat(diluted.ratios()).containsExactly(undiluted.ratios(), within(1e-12));
    }

    @Test
    void search_parallelExecutor_sameResultAsSequential() {
        ColorTriple target = ColorTriple.of(38.0, -2.0, 18.0);
        RawMix sequential = search(target, ALL, MixConstraints.defaults());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            RawMix parallel = new RecipeOptimizer(executor).search(target, ALL, MixConstraints.defaults());

            assertThat(parallel.pigments()).isEqualTo(sequential.pigments());
            assertThat(parallel.ratios()).containsExactly(sequential.ratios(), within(0.0));
            assertThat(parallel.distance()).isEqualTo(sequential.distance());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void search_equallyCloseSinglePigments_firstInCatalogWins() {
        PigmentEntry reddish = pigment("A", "Reddish Gray", "basic", 50, 10, 0);
        PigmentEntry greenish = pigment("B", "Greenish Gray", "basic", 50, -10, 0);
        MixConstraints singleOnly = MixConstraints.builder().maxPigments(1).build();
        ColorTriple target = ColorTriple.of(40, 0, 0);

        assertThat(search(target, List.of(reddish, greenish), singleOnly).pigments()).containsExactly(reddish);
        assertThat(search(target, List.of(greenish, reddish), singleOnly).pigments()).containsExactly(greenish);
    }

    @Test
    void search_equallyGoodPairs_firstCombinationWins() {
        PigmentEntry light = pigment("L1", "Light Gray", "basic", 90, 0, 0);
        PigmentEntry lightCopy = pigment("L2", "Light Gray Copy", "basic", 90, 0, 0);
        PigmentEntry dark = pigment("D1", "Dark Gray", "basic", 20, 0, 0);
        MixConstraints pairs = MixConstraints.builder().maxPigments(2).build();

        RawMix mix = search(ColorTriple.of(60, 0, 0), List.of(light, lightCopy, dark), pairs);

        // (L1, D1) and (L2, D1) mix to the same color, L1 comes first in the candidate pool
        assertThat(mix.pigments()).containsExactly(light, dark);
    }

    @Test
    void search_pigmentWithUndefinedColor_neverWins() {
        PigmentEntry broken = pigment("X", "Broken", "basic", Double.NaN, 0, 0);

        RawMix mix = search(ColorTriple.of(50, 0, 0), List.of(WHITE, broken), MixConstraints.defaults());

        assertThat(mix.pigments()).containsExactly(WHITE);
        assertThat(mix.ratios()).containsExactly(1.0);
        assertThat(mix.distance()).isCloseTo(42.5, within(1e-3));
    }

    @Test
    void improves_strictlySmallerOnly_undefinedLoses() {
        assertThat(RecipeOptimizer.improves(1.0, 2.0)).isTrue();
        assertThat(RecipeOptimizer.improves(2.0, 2.0)).isFalse();
        assertThat(RecipeOptimizer.improves(3.0, 2.0)).isFalse();
        assertThat(RecipeOptimizer.improves(Double.NaN, 2.0)).isFalse();
        assertThat(RecipeOptimizer.improves(2.0, Double.NaN)).isTrue();
        assertThat(RecipeOptimizer.improves(Double.NaN, Double.NaN)).isFalse();
    }

    @Test
    void search_nothingLeftAfterFiltering_exception() {
        MixConstraints constraints = MixConstraints.builder().manufacturers(Set.of("Vallejo")).build();

        assertThatThrownBy(() -> search(MID_GRAY, ALL, constraints))
                .isInstanceOf(EmptyCatalogException.class)
                .hasMessageContaining("Vallejo");
        assertThatThrownBy(() -> search(MID_GRAY, List.of(), MixConstraints.defaults()))
                .isInstanceOf(EmptyCatalogException.class);
    }

    @Test
    void search_invalidConstraints_exception() {
        MixConstraints constraints = MixConstraints.builder().maxPigments(0).build();

        assertThatThrownBy(() -> search(MID_GRAY, ALL, constraints)).isInstanceOf(InvalidConstraintsException.class);
    }

    @Test
    void search_usesCandidatesFromSelector() {
        CandidateSelector selector = mock(CandidateSelector.class);
        MixConstraints constraints = MixConstraints.defaults();
        when(selector.selectCandidates(any(), any(), any())).thenReturn(List.of(BLUE));

        RawMix mix = new RecipeOptimizer(selector, Runnable::run).search(MID_GRAY, ALL, constraints);

        assertThat(mix.pigments()).containsExactly(BLUE);
        verify(selector).selectCandidates(eq(MID_GRAY), eq(ALL), same(constraints));
    }

    @Test
    void effectiveTierLimit_cappedAtCeiling() {
        assertThat(RecipeOptimizer.effectiveTierLimit(MixConstraints.builder().maxPigments(1).build())).isEqualTo(1);
        assertThat(RecipeOptimizer.effectiveTierLimit(MixConstraints.builder().maxPigments(3).build())).isEqualTo(3);
        assertThat(RecipeOptimizer.effectiveTierLimit(MixConstraints.builder().maxPigments(5).build())).isEqualTo(3);
    }

    @Test
    void combinations_lexicographicOrder() {
        List<int[]> combinations = RecipeOptimizer.combinations(5, 3);

        assertThat(combinations).hasSize(10);
        assertThat(combinations.get(0)).containsExactly(0, 1, 2);
        assertThat(combinations.get(1)).containsExactly(0, 1, 3);
        assertThat(combinations.get(9)).containsExactly(2, 3, 4);
        assertThat(RecipeOptimizer.combinations(4, 1)).hasSize(4);
        assertThat(RecipeOptimizer.combinations(2, 3)).isEmpty();
    }
}
