package com.shopcrawl.core.model;

/** 페이지 취득 방식: 정적 HTTP 또는 브라우저 렌더링 */
public enum FetchMode {
    STATIC,
    DYNAMIC
}
