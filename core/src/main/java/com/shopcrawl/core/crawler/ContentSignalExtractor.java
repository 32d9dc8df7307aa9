package com.shopcrawl.core.crawler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcrawl.core.model.ContentSignals;
import com.shopcrawl.core.model.PageContent;
import com.shopcrawl.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * jsoup 기반 신호 추출기: 링크(a[href] → abs:href, 정규화), 본문 텍스트,
 * 구조화 데이터 타입(JSON-LD @type / @graph, microdata itemtype), 구매 UI 힌트.
 * 상태 없음 → 스레드 세이프.
 */
public final class ContentSignalExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ContentSignalExtractor.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String HINT_QUANTITY = "quantity-selector";
    public static final String HINT_ADD_TO_CART = "add-to-cart-button";
    public static final String HINT_ITEMPROP_PRICE = "itemprop-price";

    private static final Pattern SCHEMA_PREFIX = Pattern.compile("^https?://(www\\.)?schema\\.org/", Pattern.CASE_INSENSITIVE);
    private static final Pattern CART_TEXT = Pattern.compile("add\\s+to\\s+(cart|bag|basket)|buy\\s+now", Pattern.CASE_INSENSITIVE);

    public ContentSignals extract(PageContent page) {
        Objects.requireNonNull(page, "page");
        return extract(page.getUrl(), page.getBody());
    }

    public ContentSignals extract(URI base, String html) {
        String src = (html == null) ? "" : html;
        Document doc = Jsoup.parse(src, base == null ? "" : base.toString());

        String text = (doc.body() != null) ? doc.body().text() : doc.text();
        ContentSignals.Builder b = ContentSignals.builder()
                .text(text)
                .contentSize(text.length())
                .pageWeight(src.length());

        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            URI u = UrlUtils.normalize(abs);   // http(s) 외, 파싱 불가는 null
            if (u != null) b.link(u);
        }

        for (Element s : doc.select("script[type=application/ld+json]")) {
            collectJsonLdTypes(s.data(), b);
        }
        for (Element e : doc.select("[itemtype]")) {
            for (String t : e.attr("itemtype").trim().split("\\s+")) b.schemaType(schemaName(t));
        }

        if (!doc.select("select[name~=(?i)qty|quantity], input[name~=(?i)qty|quantity]").isEmpty()) {
            b.domHint(HINT_QUANTITY);
        }
        if (hasCartButton(doc)) b.domHint(HINT_ADD_TO_CART);
        if (!doc.select("[itemprop=price]").isEmpty()) b.domHint(HINT_ITEMPROP_PRICE);

        return b.build();
    }

    private static boolean hasCartButton(Document doc) {
        if (!doc.select("[id*=add-to-cart], [class*=add-to-cart], [name=add-to-cart]").isEmpty()) return true;
        for (Element btn : doc.select("button, input[type=submit]")) {
            String label = btn.tagName().equals("input") ? btn.attr("value") : btn.text();
            if (CART_TEXT.matcher(label).find()) return true;
        }
        return false;
    }

    private static void collectJsonLdTypes(String raw, ContentSignals.Builder b) {
        if (raw == null || raw.isBlank()) return;
        try {
            collectTypes(JSON.readTree(raw), b);
        } catch (JsonProcessingException e) {
            LOG.debug("Malformed JSON-LD block skipped: {}", e.getOriginalMessage());
        }
    }

    private static void collectTypes(JsonNode node, ContentSignals.Builder b) {
        if (node == null) return;
        if (node.isArray()) {
            for (JsonNode n : node) collectTypes(n, b);
            return;
        }
        if (!node.isObject()) return;

        JsonNode type = node.get("@type");
        if (type != null) {
            if (type.isTextual()) b.schemaType(schemaName(type.asText()));
            else if (type.isArray()) for (JsonNode t : type) if (t.isTextual()) b.schemaType(schemaName(t.asText()));
        }
        collectTypes(node.get("@graph"), b);
        // WebPage/ItemPage 안에 상품이 들어 있는 형태
        collectTypes(node.get("mainEntity"), b);
        collectTypes(node.get("mainEntityOfPage"), b);
    }

    /** "https://schema.org/Product" → "Product" */
    static String schemaName(String t) {
        if (t == null) return null;
        String s = SCHEMA_PREFIX.matcher(t.trim()).replaceFirst("");
        if (s.toLowerCase(Locale.ROOT).startsWith("schema:")) s = s.substring("schema:".length());
        return s;
    }
}
