/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.messaging.core;

/**
 * Observer of supervisor state transitions. Invoked on the supervisor's event loop thread,
 * so implementations should return quickly.
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * @param previous the state being left
     * @param current  the state just entered, never equal to {@code previous}
     */
    void onStateChanged(ConnectionState previous, ConnectionState current);
}
