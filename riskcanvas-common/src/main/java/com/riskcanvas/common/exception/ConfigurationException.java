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

public class ConfigurationException extends RiskCanvasException {
    public ConfigurationException(String message) {
        super("RC_CONFIG_INVALID", message);
    }
}
