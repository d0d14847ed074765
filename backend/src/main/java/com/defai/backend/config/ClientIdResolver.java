package com.defai.backend.config;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Identifies the caller for rate limiting: the first {@code X-Forwarded-For} hop, else the socket address.
 */
public final class ClientIdResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private ClientIdResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? "unknown" : remote;
    }
}
