/**
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.eclipse.acker.config;

import org.eclipse.acker.delivery.Outcome;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the settlement of received deliveries.
 *
 */
@ConfigMapping(prefix = "acker", namingStrategy = ConfigMapping.NamingStrategy.VERBATIM)
public interface AckerOptions {

    /**
     * Checks whether deliveries that have been left unsettled by the application's
     * delivery handler get accepted automatically.
     *
     * @return {@code true} if deliveries get accepted automatically.
     */
    @WithDefault("true")
    boolean autoAccept();

    /**
     * Gets the outcome to apply when settling a delivery without an explicit outcome.
     *
     * @return The outcome.
     */
    @WithDefault("REJECTED")
    Outcome defaultSettleOutcome();

    /**
     * Checks whether released deliveries are reported as having been delivered to the
     * application unless specified otherwise.
     *
     * @return {@code true} if released deliveries are reported as delivered.
     */
    @WithDefault("true")
    boolean releaseDelivered();
}
