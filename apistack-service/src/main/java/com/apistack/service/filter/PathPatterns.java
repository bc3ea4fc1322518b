package com.apistack.service.filter;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Wildcard path matching for route and public-path configuration.
 * {@code /a/**} matches everything below {@code /a}, {@code /a/*} one segment below it.
 */
final class PathPatterns {

    private PathPatterns() {
    }

    static boolean matches(String path, String pattern) {
        pattern = pattern.trim();

        if (pattern.endsWith("/**")) {
            String prefix = pattern.substring(0, pattern.length() - 3);
            return path.equals(prefix) || path.startsWith(prefix + "/");
        } else if (pattern.endsWith("/*")) {
            String prefix = pattern.substring(0, pattern.length() - 2);
            return path.startsWith(prefix + "/") && !path.substring(prefix.length() + 1).contains("/");
        } else {
            return path.equals(pattern);
        }
    }

    static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
