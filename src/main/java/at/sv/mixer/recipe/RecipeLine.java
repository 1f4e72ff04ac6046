package at.sv.mixer.recipe;

import at.sv.mixer.catalog.PigmentEntry;

/**
 * @param pigment    the paint to use
 * @param percentage the share of the paint in the recipe, at least 5
 * @param grams      the mass of the paint in the batch
 */
public record RecipeLine(PigmentEntry pigment, int percentage, double grams) {
}
