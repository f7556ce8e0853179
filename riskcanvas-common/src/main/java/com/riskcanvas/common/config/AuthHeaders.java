/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the request headers that identify the caller to the RiskCanvas API.
 *
 * <p>Recognized keys:</p>
 * <ul>
 *   <li>{@code riskcanvas.demo-mode}: when true, demo mode wins over every other setting</li>
 *   <li>{@code riskcanvas.auth.mode}: {@code none} (default), {@code demo} or {@code entra}</li>
 *   <li>{@code riskcanvas.auth.token}: bearer token used in {@code entra} mode</li>
 * </ul>
 */
public final class AuthHeaders {

    private static final Logger log = LoggerFactory.getLogger(AuthHeaders.class);

    public static final String DEMO_MODE_KEY = "riskcanvas.demo-mode";
    public static final String AUTH_MODE_KEY = "riskcanvas.auth.mode";
    public static final String AUTH_TOKEN_KEY = "riskcanvas.auth.token";

    public static final String DEMO_USER_HEADER = "x-demo-user";
    public static final String DEMO_ROLE_HEADER = "x-demo-role";
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private AuthHeaders() {}

    public static AuthMode resolveMode(RCProperties props) {
        if (props.getBoolean(DEMO_MODE_KEY, false)) {
            return AuthMode.DEMO;
        }
        return AuthMode.fromString(props.getString(AUTH_MODE_KEY));
    }

    /**
     * Headers for the resolved mode. Entra mode without a token yields no headers.
     */
    public static Map<String, String> resolve(RCProperties props) {
        AuthMode mode = resolveMode(props);
        Map<String, String> headers = new LinkedHashMap<>();
        switch (mode) {
            case DEMO -> {
                headers.put(DEMO_USER_HEADER, "demo-user");
                headers.put(DEMO_ROLE_HEADER, "admin");
            }
            case ENTRA -> {
                String token = props.getString(AUTH_TOKEN_KEY);
                if (token != null && !token.isBlank()) {
                    headers.put(AUTHORIZATION_HEADER, "Bearer " + token.trim());
                } else {
                    log.warn("Auth mode is ENTRA but {} is not set; sending no credentials", AUTH_TOKEN_KEY);
                }
            }
            case NONE -> { }
        }
        return Collections.unmodifiableMap(headers);
    }
}
