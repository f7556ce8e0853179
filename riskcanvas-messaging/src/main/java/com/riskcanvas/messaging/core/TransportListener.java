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
 * Lifecycle callbacks from a transport connection. May be called from any thread.
 */
public interface TransportListener {

    /** The connection is established and frames may follow. */
    void onOpen();

    /** A complete frame arrived. Frames are reported in arrival order. */
    void onFrame(StreamFrame frame);

    /** The open attempt failed, or an open connection was lost or closed by the server. */
    void onFailure(Throwable cause);
}
