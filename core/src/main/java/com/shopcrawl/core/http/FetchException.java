package com.shopcrawl.core.http;

import java.net.URI;

/** 페이지 취득 실패의 공통 상위 타입. statusCode 는 HTTP 응답이 없으면 -1. */
public abstract class FetchException extends Exception {

    public enum Kind { TRANSIENT, PERMANENT, EXHAUSTED }

    private final URI url;
    private final int statusCode;

    protected FetchException(URI url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }

    public abstract Kind kind();
}
