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
 * Connection lifecycle states of a {@link ConnectionSupervisor}.
 *
 * <pre>
 *   DISCONNECTED ──connect()──► CONNECTING ──open──► CONNECTED
 *        ▲                        │   ▲                  │
 *        │ disconnect()    failure│   │timer       error/close
 *        │                        ▼   │                  │
 *        └──────────────────── RECONNECTING ◄────────────┘
 *                                 │ retries exhausted
 *                                 ▼
 *                               FAILED ──connect()──► CONNECTING
 * </pre>
 */
public enum ConnectionState {
    /** Initial state, and the state after {@code disconnect()}. */
    DISCONNECTED,
    /** Transport open in progress. */
    CONNECTING,
    /** Transport open; frames are being dispatched. */
    CONNECTED,
    /** Transport lost; a reconnect timer is pending. */
    RECONNECTING,
    /** Retries exhausted. Terminal until an explicit {@code connect()}. */
    FAILED;

    /** True while the supervisor owns, or is about to own, a transport. */
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED || this == RECONNECTING;
    }
}
