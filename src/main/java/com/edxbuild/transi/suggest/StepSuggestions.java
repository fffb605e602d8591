package com.edxbuild.transi.suggest;

import java.util.List;
import java.util.Optional;

import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.model.Suggestion;

import lombok.Value;

/**
 * Ranked candidates for one raw step. {@code bestScore} is the top score seen even when it falls
 * below the threshold, so reviewers can see how close the nearest entry came.
 */
@Value
public class StepSuggestions {

    RawStep step;
    double bestScore;
    List<Suggestion> candidates;

    public Optional<Suggestion> top() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /**
     * Best score as a whole percentage, rounded up.
     */
    public int confidencePercent() {
        return (int) Math.ceil(bestScore * 100 - 1e-9);
    }
}
