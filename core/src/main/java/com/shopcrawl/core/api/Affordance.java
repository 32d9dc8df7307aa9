package com.shopcrawl.core.api;

/** 클릭 가능한 "더 보기" 요소. 구현은 렌더 드라이버가 제공한다. */
public interface Affordance {
    String label();
}
