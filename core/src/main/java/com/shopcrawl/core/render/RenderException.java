package com.shopcrawl.core.render;

/** 렌더 드라이버 조작 실패(비검사). DynamicContentResolver 가 부분 결과로 흡수한다. */
public class RenderException extends RuntimeException {
    public RenderException(String message) { super(message); }
    public RenderException(String message, Throwable cause) { super(message, cause); }
}
