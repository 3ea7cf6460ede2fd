package com.labmuse.formula;

import com.labmuse.util.EngineConfig;
import com.labmuse.util.LoggingUtil;

import java.util.*;

/**
 * Resolves a variable reference written in a formula against the variable
 * names a table actually has. Each stage is more permissive than the last:
 * exact, case-insensitive, normalized, substring containment, token overlap.
 */
public class VariableMatcher {

    private final double tokenOverlapThreshold;
    private final int minTokenLength;

    public VariableMatcher() {
        this(0.6, 3);
    }

    public VariableMatcher(EngineConfig config) {
        this(config.getTokenOverlapThreshold(), config.getMinTokenLength());
    }

    public VariableMatcher(double tokenOverlapThreshold, int minTokenLength) {
        this.tokenOverlapThreshold = tokenOverlapThreshold;
        this.minTokenLength = minTokenLength;
    }

    public Optional<String> match(String reference, Collection<String> candidates) {
        if (reference == null || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        String ref = reference.trim();

        for (String candidate : candidates) {
            if (candidate.equals(ref)) return Optional.of(candidate);
        }
        for (String candidate : candidates) {
            if (candidate.trim().equalsIgnoreCase(ref)) return Optional.of(candidate);
        }

        String normalizedRef = IdentifierNormalizer.normalize(ref);
        if (normalizedRef.isEmpty()) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            if (IdentifierNormalizer.normalize(candidate).equals(normalizedRef)) return Optional.of(candidate);
        }

        for (String candidate : candidates) {
            if (contains(IdentifierNormalizer.normalize(candidate), normalizedRef)) {
                LoggingUtil.debug("Substring match: '" + reference + "' -> '" + candidate + "'");
                return Optional.of(candidate);
            }
        }

        String best = null;
        double bestScore = 0;
        for (String candidate : candidates) {
            double score = tokenOverlap(ref, candidate, minTokenLength);
            if (score >= tokenOverlapThreshold && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best != null) {
            LoggingUtil.debug("Token overlap match: '" + reference + "' -> '" + best + "' (" + bestScore + ")");
        }
        return Optional.ofNullable(best);
    }

    /**
     * Resolve every reference; unresolved ones are returned in {@code missing}.
     *
     * @return reference to table name, in reference order
     */
    public Map<String, String> matchAll(Collection<String> references, Collection<String> candidates,
                                        List<String> missing) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String reference : references) {
            Optional<String> match = match(reference, candidates);
            if (match.isPresent()) {
                resolved.put(reference, match.get());
            } else if (!missing.contains(reference)) {
                missing.add(reference);
            }
        }
        return resolved;
    }

    /**
     * Shared tokens divided by the larger token count, over normalized tokens
     * of at least {@code minTokenLength} characters.
     */
    public static double tokenOverlap(String a, String b, int minTokenLength) {
        Set<String> left = new LinkedHashSet<>(IdentifierNormalizer.tokens(a, minTokenLength));
        Set<String> right = new LinkedHashSet<>(IdentifierNormalizer.tokens(b, minTokenLength));
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String token : left) {
            if (right.contains(token)) common++;
        }
        return (double) common / Math.max(left.size(), right.size());
    }

    private static boolean contains(String normalizedCandidate, String normalizedRef) {
        if (normalizedCandidate.isEmpty()) {
            return false;
        }
        return normalizedCandidate.contains(normalizedRef) || normalizedRef.contains(normalizedCandidate);
    }
}
