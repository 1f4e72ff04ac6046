package at.sv.mixer.recipe;

import at.sv.mixer.catalog.PigmentEntry;
import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.color.DeltaEMethod;
import at.sv.mixer.color.LabConverter;
import at.sv.mixer.mixing.MixingModel;
import at.sv.mixer.mixing.PigmentMixer;
import at.sv.mixer.optimizer.MixConstraints;
import at.sv.mixer.optimizer.RawMix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RecipeFormatterTest {

    private static final ColorTriple MID_GRAY = LabConverter.rgbToLab(128, 128, 128);
    private static final PigmentEntry WHITE = pigment("C62", "Flat White", 92.5, 0.1, 0.2);
    private static final PigmentEntry BLACK = pigment("C33", "Flat Black", 15.3, 0.2, 0.1);
    private static final PigmentEntry RED = pigment("C3", "Red", 45.0, 62.0, 40.0);

    private RecipeFormatter formatter;

    private static PigmentEntry pigment(String code, String name, double L, double a, double b) {
        return new PigmentEntry(code, name, "Mr.Color", "basic", ColorTriple.of(L, a, b));
    }

    @BeforeEach
    void setUp() {
        formatter = new RecipeFormatter();
    }

    private RecipeResult format(List<PigmentEntry> pigments, double... ratios) {
        return format(MixConstraints.defaults(), pigments, ratios);
    }

    private RecipeResult format(MixConstraints constraints, List<PigmentEntry> pigments, double... ratios) {
        return formatter.format(MID_GRAY, new RawMix(pigments, ratios, 0.0), constraints);
    }

    private static void assertLine(RecipeLine line, PigmentEntry pigment, int percentage, double grams) {
        assertThat(line.pigment()).isEqualTo(pigment);
        assertThat(line.percentage()).isEqualTo(percentage);
        assertThat(line.grams()).isCloseTo(grams, within(1e-9));
    }

    @Test
    void format_whiteAndBlack_sortedByShare_gramsOfBatch() {
        RecipeResult result = format(List.of(BLACK, WHITE), 0.05, 0.95);

        assertThat(result.getLines()).hasSize(2);
        assertLine(result.getLines().get(0), WHITE, 95, 9.5);
        assertLine(result.getLines().get(1), BLACK, 5, 0.5);
        assertThat(result.getPercentageSum()).isEqualTo(100);
        assertThat(result.getGramsSum()).isCloseTo(10.0, within(1e-9));
        assertThat(result.getTarget()).isEqualTo(MID_GRAY);
        assertThat(result.getMixed().L()).isCloseTo(48.873, within(0.001));
        assertThat(result.getMetric()).isEqualTo(DeltaEMethod.DE00);
        assertThat(result.getDeltaE()).isEqualTo(ColorDifference.deltaE2000(MID_GRAY, result.getMixed()));
    }

    @Test
    void format_shareBelowFivePercent_droppedAndRenormalized() {
        RecipeResult result = format(List.of(WHITE, BLACK, RED), 0.6, 0.37, 0.03);

        assertThat(result.getLines()).extracting(RecipeLine::pigment).containsExactly(WHITE, BLACK);
        assertThat(result.getLines()).extracting(RecipeLine::percentage).containsExactly(62, 38);
        assertThat(result.getPercentageSum()).isEqualTo(100);
    }

    @Test
    void format_exactlyFivePercent_kept() {
        RecipeResult result = format(List.of(WHITE, RED), 0.95, 0.05);

        assertThat(result.getLines()).extracting(RecipeLine::percentage).containsExactly(95, 5);
    }

    @Test
    void format_allSharesBelowFivePercent_largestOnly() {
        RecipeResult result = format(List.of(WHITE, BLACK, RED), 0.03, 0.04, 0.02);

        assertThat(result.getLines()).singleElement().satisfies(line -> assertLine(line, BLACK, 100, 10.0));
        assertThat(result.getMixed()).isEqualTo(BLACK.getLab());
    }

    @Test
    void format_roundingRemainder_goesToLargestShare() {
        RecipeResult result = format(List.of(WHITE, BLACK, RED), 1.0 / 3, 1.0 / 3, 1.0 / 3);

        assertThat(result.getLines()).extracting(RecipeLine::percentage).containsExactly(34, 33, 33);
        assertThat(result.getLines().get(0).pigment()).isEqualTo(WHITE);
        assertThat(result.getPercentageSum()).isEqualTo(100);
    }

    @Test
    void format_batchMass_scalesGrams() {
        MixConstraints constraints = MixConstraints.builder().batchMassGrams(25.0).build();

        RecipeResult result = format(constraints, List.of(WHITE, BLACK), 0.6, 0.4);

        assertLine(result.getLines().get(0), WHITE, 60, 15.0);
        assertLine(result.getLines().get(1), BLACK, 40, 10.0);
        assertThat(result.getGramsSum()).isCloseTo(25.0, within(1e-9));
        assertThat(result.getBatchMassGrams()).isEqualTo(25.0);
    }

    @Test
    void format_mixedColor_predictedFromFinalPercentages() {
        RecipeResult result = format(List.of(WHITE, BLACK, RED), 0.6, 0.37, 0.03);

        ColorTriple expected = new PigmentMixer().mixKubelkaMunk(List.of(WHITE.getLab(), BLACK.getLab()),
                new double[]{0.62, 0.38});
        assertThat(result.getMixed().L()).isCloseTo(expected.L(), within(1e-9));
        assertThat(result.getMixed().a()).isCloseTo(expected.a(), within(1e-9));
        assertThat(result.getMixed().b()).isCloseTo(expected.b(), within(1e-9));
    }

    @Test
    void format_usesModelAndMetricOfConstraints() {
        MixConstraints constraints = MixConstraints.builder()
                                                   .mixingModel(MixingModel.HYBRID)
                                                   .reportMetric(DeltaEMethod.DE76)
                                                   .build();

        RecipeResult result = format(constraints, List.of(WHITE, BLACK), 0.5, 0.5);

        assertThat(result.getMixed().L()).isCloseTo(29.8576, within(0.001));
        assertThat(result.getMetric()).isEqualTo(DeltaEMethod.DE76);
        assertThat(result.getDeltaE()).isEqualTo(ColorDifference.deltaE76(MID_GRAY, result.getMixed()));
    }

    @Test
    void format_dilution_sameColorAndRecorded() {
        RecipeResult undiluted = format(List.of(WHITE, BLACK), 0.6, 0.4);
        RecipeResult diluted = format(MixConstraints.builder().dilutionFraction(0.2).build(), List.of(WHITE, BLACK), 0.6, 0.4);

        assertThat(diluted.getDilutionFraction()).isEqualTo(0.2);
        assertThat(diluted.getLines()).isEqualTo(undiluted.getLines());
        assertThat(diluted.getMixed().L()).isCloseTo(undiluted.getMixed().L(), within(1e-9));
    }
}
