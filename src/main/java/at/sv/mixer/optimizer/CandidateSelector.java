package at.sv.mixer.optimizer;

import at.sv.mixer.catalog.PigmentEntry;
import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.color.DeltaEMethod;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Narrows the catalog down to the pigments closest to the target, which bounds the cost of the combination search.
 * Pigments far from the target are assumed to rarely contribute much to the best mix.
 */
public final class CandidateSelector {

    public List<PigmentEntry> filter(List<PigmentEntry> catalog, MixConstraints constraints) {
        return catalog.stream()
                      .filter(constraints::isEligible)
                      .collect(Collectors.toList());
    }

    /**
     * @return at most {@link MixConstraints#getCandidatePoolSize()} eligible pigments, closest first.
     * Pigments with equal distance keep their catalog order.
     */
    public List<PigmentEntry> selectCandidates(ColorTriple target, List<PigmentEntry> catalog, MixConstraints constraints) {
        DeltaEMethod metric = constraints.getSearchMetric();
        List<ScoredPigment> scored = new ArrayList<>();
        for (PigmentEntry pigment : filter(catalog, constraints)) {
            scored.add(new ScoredPigment(pigment, ColorDifference.colorDifference(target, pigment.getLab(), metric)));
        }
        scored.sort(Comparator.comparingDouble(ScoredPigment::distance));
        return scored.stream()
                     .limit(constraints.getCandidatePoolSize())
                     .map(ScoredPigment::pigment)
                     .collect(Collectors.toList());
    }

    private record ScoredPigment(PigmentEntry pigment, double distance) {
    }
}
