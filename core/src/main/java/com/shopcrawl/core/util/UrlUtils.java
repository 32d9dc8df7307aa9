package com.shopcrawl.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** URL 정규화 + 등록 도메인(registrable domain) 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 추적용 쿼리 파라미터(정확히 일치). utm_* 는 접두로 따로 처리 */
    private static final Set<String> TRACKING_PARAMS = Set.of(
            "gclid", "fbclid", "msclkid", "yclid", "mc_cid", "mc_eid",
            "igshid", "_ga", "ref", "ref_");

    /** 2단계 공개 접미사(간이 목록). 예: shop.co.uk → 등록 도메인은 3 라벨 */
    private static final Set<String> MULTI_PART_SUFFIXES = Set.of(
            "co.uk", "org.uk", "ac.uk", "gov.uk",
            "co.in", "net.in", "org.in",
            "com.au", "net.au", "org.au",
            "co.jp", "ne.jp", "or.jp",
            "com.br", "com.mx", "com.ar", "com.tr", "com.cn", "com.sg", "com.my",
            "co.nz", "co.za", "co.kr", "or.kr");

    /**
     * 정규화 규칙:
     * - scheme/host 소문자, http/https 외에는 null
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거
     * - 중복 슬래시 축소, 끝 슬래시 제거(루트는 origin만 남김)
     * - 추적 파라미터(utm_*, gclid, fbclid ...) 제거
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        String host = u.getHost();
        if (host == null || host.isBlank()) return null;
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getPath() == null) ? "" : u.getPath();
        path = path.replaceAll("/{2,}", "/");
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);

        String query = stripTracking(u.getRawQuery());

        try {
            // raw query는 이미 인코딩되어 있으므로 문자열로 조립 후 파싱
            URI base = new URI(scheme, null, host, port, path.isEmpty() ? null : path, null, null);
            return (query == null) ? base : URI.create(base + "?" + query);
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /** 문자열 버전. 파싱 실패 시 null */
    public static URI normalize(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return normalize(new URI(s.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** 스킴 없는 도메인("shop.example")은 https로 보완해 시드 URL을 만든다. */
    public static URI seedOf(String domain) {
        if (domain == null || domain.isBlank()) return null;
        String d = domain.trim();
        if (!d.contains("://")) d = "https://" + d;
        return normalize(d);
    }

    /** 선행 www. 제거 후 마지막 2 라벨(다중 접미사면 3 라벨) */
    public static String registrableDomain(String host) {
        if (host == null || host.isBlank()) return "";
        String h = host.toLowerCase(Locale.ROOT);
        if (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        if (h.startsWith("www.")) h = h.substring(4);

        String[] labels = h.split("\\.");
        if (labels.length <= 2) return h;

        String lastTwo = labels[labels.length - 2] + "." + labels[labels.length - 1];
        int keep = MULTI_PART_SUFFIXES.contains(lastTwo) ? 3 : 2;
        if (labels.length <= keep) return h;

        StringBuilder sb = new StringBuilder();
        for (int i = labels.length - keep; i < labels.length; i++) {
            if (sb.length() > 0) sb.append('.');
            sb.append(labels[i]);
        }
        return sb.toString();
    }

    /** 등록 도메인 기준 동일 사이트 판정 (www/서브도메인 허용) */
    public static boolean sameRegistrableDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        String ra = registrableDomain(a.getHost());
        return !ra.isEmpty() && ra.equals(registrableDomain(b.getHost()));
    }

    private static String stripTracking(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return null;
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            String key = pair.split("=", 2)[0].toLowerCase(Locale.ROOT);
            if (key.startsWith("utm_") || TRACKING_PARAMS.contains(key)) continue;
            kept.add(pair);
        }
        return kept.isEmpty() ? null : String.join("&", kept);
    }
}
