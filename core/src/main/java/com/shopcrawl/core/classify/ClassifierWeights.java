package com.shopcrawl.core.classify;

import com.shopcrawl.core.crawler.ContentSignalExtractor;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 분류 휴리스틱 상수 묶음(불변). 테스트에서 경계값을 직접 찌를 수 있게 이름을 붙여 둔다.
 * <ul>
 *   <li>URL 군: 가장 높은 패턴 신뢰도 × {@link #getUrlWeight()}</li>
 *   <li>내용 군: 매칭된 조각 가중치 합, {@link #getContentCap()} 으로 상한</li>
 *   <li>구조화 데이터 Product: 임계값과 무관하게 상품으로 확정</li>
 * </ul>
 */
public final class ClassifierWeights {

    public static final double DEFAULT_THRESHOLD = 0.5;
    public static final double DEFAULT_URL_WEIGHT = 0.5;
    public static final double DEFAULT_CONTENT_CAP = 0.45;
    public static final double STRUCTURED_DATA_WEIGHT = 1.0;
    public static final String PRODUCT_TYPE = "Product";

    /** 경로 패턴 + 신뢰도 */
    public static final class UrlRule {
        final String name;
        final Pattern pattern;
        final double confidence;

        public UrlRule(String name, String regex, double confidence) {
            this.name = Objects.requireNonNull(name, "name");
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            this.confidence = confidence;
        }

        public String getName() { return name; }
        public double getConfidence() { return confidence; }
    }

    /** 본문 텍스트 정규식 또는 DOM 힌트 중 하나라도 맞으면 가중치 1회 가산 */
    public static final class ContentRule {
        final String name;
        final Pattern text;      // null 이면 힌트만 본다
        final String domHint;    // null 이면 텍스트만 본다
        final double weight;

        public ContentRule(String name, String textRegex, String domHint, double weight) {
            this.name = Objects.requireNonNull(name, "name");
            this.text = (textRegex == null) ? null : Pattern.compile(textRegex, Pattern.CASE_INSENSITIVE);
            this.domHint = domHint;
            this.weight = weight;
        }

        public String getName() { return name; }
        public double getWeight() { return weight; }
    }

    static final List<UrlRule> DEFAULT_URL_RULES = List.of(
            new UrlRule("product-path", "/products?/[\\w-]+", 0.95),
            new UrlRule("p-path", "/p/[\\w-]+", 0.95),
            new UrlRule("dp-path", "/dp/[\\w-]+", 0.95),
            new UrlRule("item-path", "/item/[\\w-]+", 0.95),
            new UrlRule("i-token", "-i-[\\w-]+", 0.95),
            new UrlRule("pd-path", "/pd/[\\w-]+", 0.8),
            new UrlRule("p-digits", "/[\\w-]+-p-\\d+", 0.8),
            new UrlRule("shop-path", "/shop/[\\w-]+", 0.6),
            new UrlRule("slug-html", "/[\\w-]+-\\d+\\.html", 0.6));

    static final List<ContentRule> DEFAULT_CONTENT_RULES = List.of(
            new ContentRule("add-to-cart", "add\\s+to\\s+(cart|basket|bag)",
                    ContentSignalExtractor.HINT_ADD_TO_CART, 0.2),
            new ContentRule("buy-now", "buy\\s+now", null, 0.15),
            new ContentRule("price", "(?:[$€£¥₹]|\\brs\\.?|\\binr|\\busd|\\beur)\\s?\\d[\\d,]*(?:\\.\\d{1,2})?",
                    ContentSignalExtractor.HINT_ITEMPROP_PRICE, 0.15),
            new ContentRule("quantity", null, ContentSignalExtractor.HINT_QUANTITY, 0.1),
            new ContentRule("wishlist", "add\\s+to\\s+wish\\s?list", null, 0.1),
            new ContentRule("description", "product\\s+description|specifications|technical\\s+details", null, 0.1),
            new ContentRule("sku", "\\bsku\\b|item\\s+code", null, 0.1));

    private final double threshold;
    private final double urlWeight;
    private final double contentCap;
    private final List<UrlRule> urlRules;
    private final List<ContentRule> contentRules;

    public ClassifierWeights(double threshold, double urlWeight, double contentCap,
                             List<UrlRule> urlRules, List<ContentRule> contentRules) {
        if (threshold <= 0 || threshold > 1) throw new IllegalArgumentException("threshold must be in (0, 1]");
        if (urlWeight < 0 || contentCap < 0) throw new IllegalArgumentException("weights must be >= 0");
        this.threshold = threshold;
        this.urlWeight = urlWeight;
        this.contentCap = contentCap;
        this.urlRules = List.copyOf(urlRules);
        this.contentRules = List.copyOf(contentRules);
    }

    public static ClassifierWeights defaults() {
        return new ClassifierWeights(DEFAULT_THRESHOLD, DEFAULT_URL_WEIGHT, DEFAULT_CONTENT_CAP,
                DEFAULT_URL_RULES, DEFAULT_CONTENT_RULES);
    }

    public ClassifierWeights withThreshold(double t) {
        return new ClassifierWeights(t, urlWeight, contentCap, urlRules, contentRules);
    }

    public double getThreshold() { return threshold; }
    public double getUrlWeight() { return urlWeight; }
    public double getContentCap() { return contentCap; }
    public List<UrlRule> getUrlRules() { return urlRules; }
    public List<ContentRule> getContentRules() { return contentRules; }
}
