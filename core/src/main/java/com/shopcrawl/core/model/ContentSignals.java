package com.shopcrawl.core.model;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 페이지에서 뽑은 정규화 신호.
 * - text: 화면 텍스트(공백 정규화)
 * - schemaTypes: 구조화 데이터(JSON-LD/microdata)의 타입 태그
 * - domHints: 구매 UI 흔적(수량 선택기, 장바구니 버튼 등)
 * - links: 절대 http(s) 링크, 문서 순서 유지 + 중복 제거
 * 불변 객체.
 */
public final class ContentSignals {
    private static final ContentSignals EMPTY = builder().build();

    private final String text;
    private final Set<String> schemaTypes;
    private final Set<String> domHints;
    private final List<URI> links;
    private final int contentSize;
    private final int pageWeight;

    private ContentSignals(Builder b) {
        this.text = (b.text == null) ? "" : b.text;
        this.schemaTypes = Collections.unmodifiableSet(new LinkedHashSet<>(b.schemaTypes));
        this.domHints = Collections.unmodifiableSet(new LinkedHashSet<>(b.domHints));
        this.links = List.copyOf(b.links);
        this.contentSize = (b.contentSize >= 0) ? b.contentSize : this.text.length();
        this.pageWeight = Math.max(0, b.pageWeight);
    }

    public static ContentSignals empty() { return EMPTY; }

    public String getText() { return text; }
    public Set<String> getSchemaTypes() { return schemaTypes; }
    public Set<String> getDomHints() { return domHints; }
    public List<URI> getLinks() { return links; }
    /** 보이는 텍스트 길이. 스크롤 안정화 판정에 사용 */
    public int getContentSize() { return contentSize; }
    /** 원문 HTML 크기 */
    public int getPageWeight() { return pageWeight; }

    public boolean hasSchemaType(String type) {
        for (String t : schemaTypes) if (t.equalsIgnoreCase(type)) return true;
        return false;
    }

    /**
     * 두 관측의 합집합. 링크/타입/힌트는 합치고 텍스트는 더 긴 쪽,
     * 크기는 큰 쪽을 취한다(무한 스크롤에서 DOM 이 교체되는 경우 대비).
     */
    public ContentSignals merge(ContentSignals other) {
        if (other == null || other == this) return this;
        Builder b = builder()
                .text(other.text.length() > text.length() ? other.text : text)
                .contentSize(Math.max(contentSize, other.contentSize))
                .pageWeight(Math.max(pageWeight, other.pageWeight));
        b.schemaTypes(schemaTypes).schemaTypes(other.schemaTypes);
        b.domHints(domHints).domHints(other.domHints);
        b.links(links).links(other.links);
        return b.build();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentSignals s)) return false;
        return contentSize == s.contentSize && pageWeight == s.pageWeight
                && text.equals(s.text) && schemaTypes.equals(s.schemaTypes)
                && domHints.equals(s.domHints) && links.equals(s.links);
    }

    @Override public int hashCode() {
        return Objects.hash(text, schemaTypes, domHints, links, contentSize, pageWeight);
    }

    @Override public String toString() {
        return "ContentSignals{links=" + links.size() + ", schemaTypes=" + schemaTypes
                + ", domHints=" + domHints + ", contentSize=" + contentSize + ", pageWeight=" + pageWeight + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String text;
        private final Set<String> schemaTypes = new LinkedHashSet<>();
        private final Set<String> domHints = new LinkedHashSet<>();
        private final LinkedHashSet<URI> links = new LinkedHashSet<>();
        private int contentSize = -1;
        private int pageWeight;

        public Builder text(String text) { this.text = text; return this; }
        public Builder schemaType(String type) { if (type != null && !type.isBlank()) schemaTypes.add(type.trim()); return this; }
        public Builder schemaTypes(Collection<String> types) { if (types != null) types.forEach(this::schemaType); return this; }
        public Builder domHint(String hint) { if (hint != null && !hint.isBlank()) domHints.add(hint); return this; }
        public Builder domHints(Collection<String> hints) { if (hints != null) hints.forEach(this::domHint); return this; }
        public Builder link(URI link) { if (link != null) links.add(link); return this; }
        public Builder links(Collection<URI> ls) { if (ls != null) ls.forEach(this::link); return this; }
        public Builder contentSize(int size) { this.contentSize = size; return this; }
        public Builder pageWeight(int weight) { this.pageWeight = weight; return this; }

        /** 현재까지 모은 링크(순서 유지) 사본 */
        public List<URI> linksSoFar() { return new ArrayList<>(links); }

        public ContentSignals build() { return new ContentSignals(this); }
    }
}
