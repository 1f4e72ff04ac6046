package at.sv.mixer.color;

public enum DeltaEMethod {
    /**
     * Euclidean distance in Lab. Cheap, used inside the recipe search.
     */
    DE76,
    /**
     * CIEDE2000. Used to report the quality of a finished recipe.
     */
    DE00
}
