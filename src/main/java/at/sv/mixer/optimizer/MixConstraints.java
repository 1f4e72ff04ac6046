package at.sv.mixer.optimizer;

import at.sv.mixer.catalog.PigmentEntry;
import at.sv.mixer.color.DeltaEMethod;
import at.sv.mixer.mixing.MixingModel;
import at.sv.mixer.mixing.PigmentMixer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Locale;
import java.util.Set;

/**
 * Everything that controls a recipe search. All values are passed explicitly, so that different searches with
 * different settings can run side by side.
 */
@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class MixConstraints {

    public static final int MAX_PIGMENTS_LIMIT = 5;

    /**
     * White, black and silver paints of the Mr.Color, Gaia Color and Tamiya ranges.
     */
    public static final Set<String> WHITE_BLACK_SILVER_CODES = Set.of(
            "C2", "C8", "C11", "C14", "C33", "C52", "C62", "EX-01", "EX-02", "LP-1", "LP-2", "LP-18");

    @Builder.Default
    private final int maxPigments = 3;
    @Builder.Default
    private final Set<String> excludedCategories = Set.of();
    @Builder.Default
    private final Set<String> excludedCodes = Set.of();
    /**
     * Manufacturers to mix from. Empty means all.
     */
    @Builder.Default
    private final Set<String> manufacturers = Set.of();
    /**
     * Share of thinner in the mix, in [0, 1]. Thinner carries no color.
     */
    @Builder.Default
    private final double dilutionFraction = 0.0;
    @Builder.Default
    private final double gamma = PigmentMixer.DEFAULT_GAMMA;
    @Builder.Default
    private final MixingModel mixingModel = MixingModel.KUBELKA_MUNK;
    @Builder.Default
    private final DeltaEMethod searchMetric = DeltaEMethod.DE76;
    @Builder.Default
    private final DeltaEMethod reportMetric = DeltaEMethod.DE00;
    @Builder.Default
    private final int candidatePoolSize = 15;
    @Builder.Default
    private final double batchMassGrams = 10.0;

    public static MixConstraints defaults() {
        return MixConstraints.builder().build();
    }

    /**
     * @throws InvalidConstraintsException if any value is out of range
     */
    public void validate() {
        if (maxPigments < 1 || maxPigments > MAX_PIGMENTS_LIMIT) {
            throw new InvalidConstraintsException("Invalid max pigments '" + maxPigments + "'. Allowed range: 1-" + MAX_PIGMENTS_LIMIT);
        }
        if (!(dilutionFraction >= 0 && dilutionFraction <= 1)) {
            throw new InvalidConstraintsException("Invalid dilution fraction '" + dilutionFraction + "'. Allowed range: 0-1");
        }
        if (!(gamma > 0) || Double.isInfinite(gamma)) {
            throw new InvalidConstraintsException("Invalid gamma '" + gamma + "'. Gamma has to be a positive number");
        }
        if (candidatePoolSize < 1) {
            throw new InvalidConstraintsException("Invalid candidate pool size '" + candidatePoolSize + "'. At least one candidate is needed");
        }
        if (!(batchMassGrams > 0) || Double.isInfinite(batchMassGrams)) {
            throw new InvalidConstraintsException("Invalid batch mass '" + batchMassGrams + "'. Batch mass has to be a positive number");
        }
        if (mixingModel == null || searchMetric == null || reportMetric == null) {
            throw new InvalidConstraintsException("Mixing model, search metric and report metric have to be set");
        }
    }

    public boolean isEligible(PigmentEntry pigment) {
        return !containsIgnoreCase(excludedCategories, pigment.getCategory())
               && !containsIgnoreCase(excludedCodes, pigment.getCode())
               && (manufacturers.isEmpty() || containsIgnoreCase(manufacturers, pigment.getManufacturer()));
    }

    /**
     * @return the factor applied to every mixing ratio to account for thinner
     */
    public double getColorShare() {
        return 1.0 - dilutionFraction;
    }

    private static boolean containsIgnoreCase(Set<String> values, String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return values.stream().anyMatch(v -> v.trim().toLowerCase(Locale.ROOT).equals(normalized));
    }
}
