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
 * Handle of one live transport connection. {@link #close()} is idempotent and must not
 * report a failure to the listener.
 */
public interface TransportConnection extends AutoCloseable {

    @Override
    void close();

    boolean isOpen();
}
