package com.shopcrawl.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** 분류 결과(불변). confidence 는 [0,1] 로 고정된다. */
public final class ClassificationResult {
    private static final ClassificationResult NONE = new ClassificationResult(false, 0.0, Set.of());

    private final boolean product;
    private final double confidence;
    private final Set<String> matchedSignals;

    public ClassificationResult(boolean product, double confidence, Set<String> matchedSignals) {
        if (Double.isNaN(confidence)) throw new IllegalArgumentException("confidence is NaN");
        this.product = product;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.matchedSignals = Collections.unmodifiableSet(new LinkedHashSet<>(
                Objects.requireNonNull(matchedSignals, "matchedSignals")));
    }

    public static ClassificationResult none() { return NONE; }

    public boolean isProduct() { return product; }
    public double getConfidence() { return confidence; }
    public Set<String> getMatchedSignals() { return matchedSignals; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationResult r)) return false;
        return product == r.product
                && Double.compare(confidence, r.confidence) == 0
                && matchedSignals.equals(r.matchedSignals);
    }

    @Override public int hashCode() { return Objects.hash(product, confidence, matchedSignals); }

    @Override public String toString() {
        return String.format(java.util.Locale.ROOT, "ClassificationResult{product=%s, confidence=%.3f, signals=%s}",
                product, confidence, matchedSignals);
    }
}
