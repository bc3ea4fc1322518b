package com.apistack.service.cache;

import com.apistack.common.security.Principal;
import jakarta.servlet.http.HttpServletRequest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 fingerprint over method, normalized path, sorted query parameters and, for
 * principal-scoped routes, the caller's subject. Parameter order never changes the result.
 */
public final class RequestFingerprinter {

    private RequestFingerprinter() {
    }

    public static FingerprintFunction standard(boolean principalScoped) {
        return (request, principal) -> forRequest(request, principalScoped ? principal : null);
    }

    public static String forRequest(HttpServletRequest request, Principal principal) {
        return fingerprint(request.getMethod(), request.getRequestURI(), request.getParameterMap(),
                principal != null ? principal.getSubject() : null);
    }

    public static String fingerprint(String method, String path, Map<String, String[]> params, String subject) {
        StringBuilder canonical = new StringBuilder();
        canonical.append(method.toUpperCase(Locale.ROOT)).append('\n');
        canonical.append(normalizePath(path)).append('\n');
        canonical.append(canonicalQuery(params)).append('\n');
        if (subject != null) {
            canonical.append("sub=").append(encode(subject));
        }
        return sha256(canonical.toString());
    }

    static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String normalized = path.replaceAll("/{2,}", "/");
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.startsWith("/") ? normalized : "/" + normalized;
    }

    static String canonicalQuery(Map<String, String[]> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        List<String> pairs = new ArrayList<>();
        new TreeMap<>(params).forEach((name, values) -> {
            String[] sorted = values == null ? new String[]{""} : values.clone();
            Arrays.sort(sorted, Comparator.nullsFirst(Comparator.naturalOrder()));
            for (String value : sorted) {
                pairs.add(encode(name) + "=" + encode(value == null ? "" : value));
            }
        });
        return String.join("&", pairs);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
