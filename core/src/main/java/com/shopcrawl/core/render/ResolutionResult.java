package com.shopcrawl.core.render;

import com.shopcrawl.core.model.ContentSignals;

import java.util.Objects;

/** 동적 해석 결과: 관측한 최선의 신호 + 반복 횟수 + 멈춘 이유. */
public final class ResolutionResult {

    public enum Outcome {
        /** 두 번 연속 새 링크도 크기 증가도 없음 */
        STABILIZED,
        MAX_ATTEMPTS,
        TIMED_OUT,
        /** 드라이버 오류로 중단. 그때까지 본 신호는 유효 */
        DRIVER_ERROR,
        INTERRUPTED;

        public boolean isPartial() { return this != STABILIZED; }
    }

    private final ContentSignals signals;
    private final int iterations;
    private final Outcome outcome;

    public ResolutionResult(ContentSignals signals, int iterations, Outcome outcome) {
        this.signals = Objects.requireNonNull(signals, "signals");
        this.iterations = iterations;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public ContentSignals getSignals() { return signals; }
    public int getIterations() { return iterations; }
    public Outcome getOutcome() { return outcome; }

    @Override public String toString() {
        return "ResolutionResult{outcome=" + outcome + ", iterations=" + iterations + ", " + signals + '}';
    }
}
