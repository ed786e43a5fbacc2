package com.plotline.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Whole-manuscript structural assessment. All scores are within [0, 1].
 *
 * @param structuralIntegrity   overall three-act soundness
 * @param actBalance            share of the manuscript taken by each act, three entries
 * @param characterArcs         arc assessment per main character
 * @param plotHoles             unexplained gaps in the plot
 * @param unresolvedElements    threads opened and never closed
 * @param pacingCurve           slow and rushed stretches
 * @param thematicCoherence     how consistently themes are carried
 * @param openingEffectiveness  strength of the opening
 * @param endingSatisfaction    strength of the ending
 */
public record ManuscriptAnalysis(
    double structuralIntegrity,
    List<Double> actBalance,
    Map<String, CharacterArc> characterArcs,
    List<String> plotHoles,
    List<String> unresolvedElements,
    PacingCurve pacingCurve,
    double thematicCoherence,
    double openingEffectiveness,
    double endingSatisfaction
) implements Serializable {

    public ManuscriptAnalysis {
        actBalance = actBalance != null ? List.copyOf(actBalance) : List.of();
        characterArcs = characterArcs != null ? Map.copyOf(characterArcs) : Map.of();
        plotHoles = plotHoles != null ? List.copyOf(plotHoles) : List.of();
        unresolvedElements = unresolvedElements != null ? List.copyOf(unresolvedElements) : List.of();
        pacingCurve = pacingCurve != null ? pacingCurve : PacingCurve.empty();
    }
}
