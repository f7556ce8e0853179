/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.common.exception;

/**
 * Base exception for all RiskCanvas errors.
 */
public class RiskCanvasException extends RuntimeException {
    private final String errorCode;

    public RiskCanvasException(String message) {
        super(message);
        this.errorCode = "RC_GENERIC";
    }

    public RiskCanvasException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RiskCanvasException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
