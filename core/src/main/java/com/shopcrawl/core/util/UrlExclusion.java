package com.shopcrawl.core.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

public final class UrlExclusion {
    private UrlExclusion(){}

    /** 상품 페이지가 나올 일 없는 구역(계정/장바구니/고객센터/회사소개 등) */
    public static final List<String> DEFAULT_EXCLUDES = List.of(
            "/login", "/signin", "/signup", "/signout", "/register",
            "/cart", "/viewcart", "/checkout", "/account", "/wishlist",
            "/help", "/helpcentre", "/support", "/faq",
            "/contact", "/contact-us", "/about", "/about-us",
            "/privacy", "/terms", "/policy", "/careers", "/career",
            "/blog", "/stories", "/press", "/news",
            "/payments", "/orders", "/track", "/unsubscribe");

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    /**
     * patterns 지원:
     * <ul>
     *   <li>경로 세그먼트: {@code "/cart"} → /cart, /cart/x, /en/cart 제외 ; /cartoon 통과</li>
     *   <li>절대 URL 접두: {@code "https://host/path"}</li>
     *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/gp/*"})</li>
     *   <li>정규식: {@code "re:"} 접두 (예: {@code re:/s\?k=})</li>
     * </ul>
     * 비교는 대소문자 무시.
     */
    public static boolean isExcluded(URI url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        final String s = url.toString();
        final String lower = s.toLowerCase(Locale.ROOT);
        final String path = (url.getPath() == null ? "" : url.getPath().toLowerCase(Locale.ROOT));

        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;

            if (p.startsWith("re:")) {
                if (compiled(p, p.substring(3)).matcher(s).find()) return true;

            } else if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
                if (compiled(p, globToRegex(p)).matcher(s).find()) return true;

            } else if (p.contains("://")) {
                if (lower.startsWith(p.toLowerCase(Locale.ROOT))) return true;

            } else if (segmentMatch(path, p.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /** 전역 목록 + 도메인 전용 목록을 함께 검사 */
    public static boolean isExcluded(URI url, List<String> global, Map<String, List<String>> perDomain){
        if (isExcluded(url, global)) return true;
        if (url == null || perDomain == null || perDomain.isEmpty()) return false;
        List<String> extra = perDomain.get(UrlUtils.registrableDomain(url.getHost()));
        return extra != null && isExcluded(url, extra);
    }

    private static boolean segmentMatch(String path, String rule){
        String r = rule.startsWith("/") ? rule : "/" + rule;
        while (r.length() > 1 && r.endsWith("/")) r = r.substring(0, r.length() - 1);
        int from = 0;
        while (true) {
            int i = path.indexOf(r, from);
            if (i < 0) return false;
            int end = i + r.length();
            if (end == path.length() || path.charAt(end) == '/') return true;
            from = i + 1;
        }
    }

    private static Pattern compiled(String key, String regex){
        return COMPILED.computeIfAbsent(key, k -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
