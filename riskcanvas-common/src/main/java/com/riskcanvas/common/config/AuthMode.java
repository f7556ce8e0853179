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

import java.util.Locale;

/**
 * How outbound requests authenticate against the RiskCanvas API.
 */
public enum AuthMode {
    /** Fixed demo identity headers. */
    DEMO,
    /** No authentication headers. */
    NONE,
    /** Bearer token issued by Entra ID. */
    ENTRA;

    /** Lenient parse: unknown or blank values map to {@link #NONE}. */
    public static AuthMode fromString(String value) {
        if (value == null || value.isBlank()) return NONE;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "demo" -> DEMO;
            case "entra" -> ENTRA;
            default -> NONE;
        };
    }
}
