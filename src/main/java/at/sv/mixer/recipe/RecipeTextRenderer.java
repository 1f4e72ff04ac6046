package at.sv.mixer.recipe;

import at.sv.mixer.FormatUtil;
import at.sv.mixer.catalog.PigmentEntry;

/**
 * Renders a recipe as plain text for the terminal or for copying into notes.
 */
public final class RecipeTextRenderer {

    private RecipeTextRenderer() {
    }

    public static String render(RecipeResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Mixing recipe for ").append(result.getTarget())
          .append(" (").append(result.getTargetPreview().toHex()).append(')').append(System.lineSeparator())
          .append(System.lineSeparator());
        for (RecipeLine line : result.getLines()) {
            PigmentEntry pigment = line.pigment();
            sb.append("  ").append(pigment.getCode()).append(' ').append(pigment.getName())
              .append(" (").append(pigment.getManufacturer()).append(')').append(System.lineSeparator());
            sb.append("    -> ").append(line.percentage()).append("% (")
              .append(FormatUtil.formatGrams(line.grams())).append(')').append(System.lineSeparator());
        }
        sb.append(System.lineSeparator());
        sb.append("Total: ").append(FormatUtil.formatGrams(result.getBatchMassGrams())).append(System.lineSeparator());
        if (result.getDilutionFraction() > 0) {
            sb.append("Thinner: ").append(FormatUtil.formatPercent(result.getDilutionFraction())).append('%')
              .append(System.lineSeparator());
        }
        sb.append("Mixed color: ").append(result.getMixed())
          .append(" (").append(result.getMixedPreview().toHex()).append(')').append(System.lineSeparator());
        sb.append(System.lineSeparator());
        sb.append("Color difference ").append(result.getMetric()).append(" = ")
          .append(FormatUtil.formatDeltaE(result.getDeltaE())).append(System.lineSeparator());
        sb.append("-> ").append(result.getMatchQuality().getDescription());
        return sb.toString();
    }
}
