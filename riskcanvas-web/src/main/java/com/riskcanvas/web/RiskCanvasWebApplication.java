/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.riskcanvas.web")
public class RiskCanvasWebApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(RiskCanvasWebApplication.class);
        app.setRegisterShutdownHook(true); // completes open event streams on JVM shutdown
        app.run(args);
    }
}
