package com.shopcrawl.core.model;

/**
 * 도메인 크롤 종료 상태. COMPLETED/TIMED_OUT/LIMIT_REACHED 는 모두 정상 종료이며
 * 부분 결과를 그대로 돌려준다. FAILED 는 예상 못 한 런타임 오류로 끝난 경우.
 */
public enum TerminalState {
    COMPLETED,
    TIMED_OUT,
    LIMIT_REACHED,
    FAILED;

    public boolean isSuccessful() { return this != FAILED; }
}
