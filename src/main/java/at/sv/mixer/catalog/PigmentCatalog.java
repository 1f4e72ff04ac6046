package at.sv.mixer.catalog;

import java.util.List;

/**
 * Source of the paints a recipe can be mixed from. The order of the returned entries is significant, as it decides
 * between equally good recipes.
 */
public interface PigmentCatalog {

    List<PigmentEntry> getPigments();
}
