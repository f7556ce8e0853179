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

import java.net.URI;

/**
 * Opens server-push connections for a {@link ConnectionSupervisor}.
 *
 * <p>{@link #open} must not block waiting for the connection: it starts the attempt and
 * reports the outcome through the listener. A failed open is reported with
 * {@link TransportListener#onFailure}, either from {@code open} itself (by throwing) or later.
 * Each opened connection reports at most one failure; after it the connection is dead.
 */
public interface Transport {

    TransportConnection open(URI endpoint, TransportListener listener);
}
