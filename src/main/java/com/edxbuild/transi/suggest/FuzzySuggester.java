package com.edxbuild.transi.suggest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.catalog.NarrCatalog;
import com.edxbuild.transi.catalog.RawStepTable;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.RawStep;
import com.edxbuild.transi.model.Suggestion;

import lombok.Builder;

/**
 * Proposes narration entries for each raw step by title similarity. Advisory only: nothing
 * produced here is applied to PreMerge or final rows.
 *
 * Each RAW title is compared with every narration entry's {@code Source_Title} (its
 * {@code OPM_Step} when the source title is blank). Candidates scoring at or above the threshold
 * are kept, highest first; equal scores keep catalog order.
 */
public class FuzzySuggester {

    private static final Logger log = LoggerFactory.getLogger(FuzzySuggester.class);

    private final SimilarityStrategy similarity;
    private final TitleNormalizer normalizer;
    private final double threshold;
    private final int maxCandidates;
    private final List<String> ignoredPrefixes;

    @Builder
    public FuzzySuggester(SimilarityStrategy similarity, TitleNormalizer normalizer, double threshold,
                          int maxCandidates, List<String> ignoredPrefixes) {
        this.similarity = similarity != null ? similarity : new SequenceMatcherSimilarity();
        this.normalizer = normalizer != null ? normalizer : new TitleNormalizer();
        this.threshold = threshold;
        this.maxCandidates = maxCandidates > 0 ? maxCandidates : Integer.MAX_VALUE;
        this.ignoredPrefixes = ignoredPrefixes == null ? List.of() : ignoredPrefixes.stream()
                .map(p -> p.trim().toUpperCase(Locale.ROOT))
                .filter(p -> !p.isEmpty())
                .toList();
    }

    public List<StepSuggestions> suggest(RawStepTable steps, NarrCatalog catalog) {
        List<Candidate> candidates = new ArrayList<>();
        for (NarrEntry entry : catalog.getEntries()) {
            if (isIgnored(entry)) {
                continue;
            }
            String text = entry.getSourceTitle().isBlank() ? entry.getOpmStep() : entry.getSourceTitle();
            String normalized = normalizer.normalize(text);
            if (!normalized.isEmpty()) {
                candidates.add(new Candidate(entry, normalized));
            }
        }
        log.info("Scoring {} raw step(s) against {} narration candidate(s), threshold {}",
                steps.size(), candidates.size(), threshold);

        List<StepSuggestions> result = new ArrayList<>(steps.size());
        int suggested = 0;
        for (RawStep step : steps.getSteps()) {
            StepSuggestions forStep = suggestFor(step, candidates);
            if (!forStep.getCandidates().isEmpty()) {
                suggested++;
            }
            result.add(forStep);
        }
        log.info("{} of {} raw step(s) have a suggestion at or above {}", suggested, steps.size(), threshold);
        return result;
    }

    private StepSuggestions suggestFor(RawStep step, List<Candidate> candidates) {
        String title = normalizer.normalize(step.getTitle());
        if (title.isEmpty()) {
            return new StepSuggestions(step, 0.0, List.of());
        }
        double best = 0.0;
        List<Scored> kept = new ArrayList<>();
        for (Candidate candidate : candidates) {
            double score = similarity.score(title, candidate.normalized);
            best = Math.max(best, score);
            if (score >= threshold) {
                kept.add(new Scored(candidate.entry, score));
            }
        }
        // List.sort is stable, so equal scores stay in catalog order
        kept.sort(Comparator.comparingDouble((Scored s) -> s.score).reversed());

        List<Suggestion> ranked = new ArrayList<>();
        for (int i = 0; i < kept.size() && i < maxCandidates; i++) {
            ranked.add(new Suggestion(step.getCode(), i + 1, kept.get(i).entry, kept.get(i).score));
        }
        return new StepSuggestions(step, best, List.copyOf(ranked));
    }

    private boolean isIgnored(NarrEntry entry) {
        String code = entry.getCode().toUpperCase(Locale.ROOT);
        return ignoredPrefixes.stream().anyMatch(code::startsWith);
    }

    private static final class Candidate {
        final NarrEntry entry;
        final String normalized;

        Candidate(NarrEntry entry, String normalized) {
            this.entry = entry;
            this.normalized = normalized;
        }
    }

    private static final class Scored {
        final NarrEntry entry;
        final double score;

        Scored(NarrEntry entry, double score) {
            this.entry = entry;
            this.score = score;
        }
    }
}
