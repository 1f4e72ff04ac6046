package at.sv.mixer.mixing;

public enum MixingModel {
    /**
     * Single-constant Kubelka-Munk on lightness, chroma decay on a and b.
     */
    KUBELKA_MUNK,
    /**
     * Blend of linear and Kubelka-Munk lightness, weighted by the darkest component.
     * Softens over-darkening of mixtures made only from light paints.
     */
    HYBRID
}
