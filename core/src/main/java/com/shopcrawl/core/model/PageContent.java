package com.shopcrawl.core.model;

import java.net.URI;
import java.util.Objects;

/** 취득한 페이지 원문(본문은 텍스트 기준). 정적/렌더링 모두 같은 모양. */
public final class PageContent {
    private final URI url;
    private final int statusCode;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;

    private PageContent(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    /** 본문 크기(바이트 근사: 문자 수) */
    public int getPageWeight() { return body.length(); }

    public static PageContent of(URI url, String html) {
        return builder().url(url).statusCode(200).body(html).contentType("text/html").build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private String body;
        private String contentType;
        private long responseTimeMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public PageContent build() {
            Objects.requireNonNull(url, "url");
            return new PageContent(this);
        }
    }
}
