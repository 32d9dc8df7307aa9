package com.shopcrawl.core.classify;

import com.shopcrawl.core.model.ClassificationResult;
import com.shopcrawl.core.model.ContentSignals;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * URL 모양 + 본문 신호 + 구조화 데이터를 가중 합산해 상품 페이지 여부를 판정한다.
 * 순수 함수: 같은 (url, signals) 는 항상 같은 결과.
 */
public final class ProductClassifier {

    private final ClassifierWeights weights;

    public ProductClassifier() { this(ClassifierWeights.defaults()); }

    public ProductClassifier(ClassifierWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public ClassificationResult classify(URI url, ContentSignals signals) {
        ContentSignals s = (signals == null) ? ContentSignals.empty() : signals;
        Set<String> matched = new LinkedHashSet<>();

        double urlScore = urlScore(url, matched);
        double contentScore = contentScore(s, matched);
        boolean structured = s.hasSchemaType(ClassifierWeights.PRODUCT_TYPE);
        if (structured) matched.add("schema:" + ClassifierWeights.PRODUCT_TYPE);

        double confidence = Math.min(1.0, urlScore + contentScore
                + (structured ? ClassifierWeights.STRUCTURED_DATA_WEIGHT : 0.0));
        // 부동소수 누적 오차로 0.49999.. 가 되는 걸 막기 위해 소수 6자리에서 반올림
        confidence = Math.round(confidence * 1_000_000d) / 1_000_000d;

        boolean product = structured || confidence >= weights.getThreshold();
        return new ClassificationResult(product, confidence, matched);
    }

    private double urlScore(URI url, Set<String> matched) {
        if (url == null) return 0.0;
        String path = (url.getRawPath() == null) ? "" : url.getRawPath();
        ClassifierWeights.UrlRule best = null;
        for (ClassifierWeights.UrlRule r : weights.getUrlRules()) {
            if (r.pattern.matcher(path).find() && (best == null || r.confidence > best.confidence)) {
                best = r;
            }
        }
        if (best == null) return 0.0;
        matched.add("url:" + best.name);
        return best.confidence * weights.getUrlWeight();
    }

    private double contentScore(ContentSignals s, Set<String> matched) {
        String text = s.getText();
        double sum = 0.0;
        for (ClassifierWeights.ContentRule r : weights.getContentRules()) {
            boolean hit = (r.domHint != null && s.getDomHints().contains(r.domHint))
                    || (r.text != null && !text.isEmpty() && r.text.matcher(text).find());
            if (hit) {
                matched.add("content:" + r.name);
                sum += r.weight;
            }
        }
        return Math.min(sum, weights.getContentCap());
    }

    public ClassifierWeights getWeights() { return weights; }
}
