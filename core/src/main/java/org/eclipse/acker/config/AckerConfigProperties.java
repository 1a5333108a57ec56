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

import java.util.Objects;

import org.eclipse.acker.delivery.Outcome;

/**
 * A POJO for configuring the settlement of received deliveries.
 *
 */
public class AckerConfigProperties {

    /**
     * The default outcome applied when settling a delivery without an explicit outcome.
     */
    public static final Outcome DEFAULT_SETTLE_OUTCOME = Outcome.REJECTED;

    private boolean autoAccept = true;
    private Outcome defaultSettleOutcome = DEFAULT_SETTLE_OUTCOME;
    private boolean releaseDelivered = true;

    /**
     * Creates new properties using default values.
     */
    public AckerConfigProperties() {
        super();
    }

    /**
     * Creates a new instance from existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options are {@code null}.
     */
    public AckerConfigProperties(final AckerOptions options) {
        Objects.requireNonNull(options);
        setAutoAccept(options.autoAccept());
        setDefaultSettleOutcome(options.defaultSettleOutcome());
        setReleaseDelivered(options.releaseDelivered());
    }

    /**
     * Checks whether deliveries that have been left unsettled by the application's
     * delivery handler get accepted automatically.
     * <p>
     * The default value of this property is {@code true}.
     *
     * @return {@code true} if deliveries get accepted automatically.
     */
    public final boolean isAutoAccept() {
        return autoAccept;
    }

    /**
     * Sets whether deliveries that have been left unsettled by the application's
     * delivery handler get accepted automatically.
     *
     * @param autoAccept {@code true} if deliveries should get accepted automatically.
     * @return This instance for setter chaining.
     */
    public final AckerConfigProperties setAutoAccept(final boolean autoAccept) {
        this.autoAccept = autoAccept;
        return this;
    }

    /**
     * Gets the outcome to apply when settling a delivery without an explicit outcome.
     * <p>
     * The default value of this property is {@link Outcome#REJECTED}.
     *
     * @return The outcome.
     */
    public final Outcome getDefaultSettleOutcome() {
        return defaultSettleOutcome;
    }

    /**
     * Sets the outcome to apply when settling a delivery without an explicit outcome.
     *
     * @param outcome The outcome.
     * @return This instance for setter chaining.
     * @throws NullPointerException if outcome is {@code null}.
     */
    public final AckerConfigProperties setDefaultSettleOutcome(final Outcome outcome) {
        this.defaultSettleOutcome = Objects.requireNonNull(outcome);
        return this;
    }

    /**
     * Checks whether released deliveries are reported as having been delivered to the
     * application unless specified otherwise.
     * <p>
     * The default value of this property is {@code true}.
     *
     * @return {@code true} if released deliveries are reported as delivered.
     */
    public final boolean isReleaseDelivered() {
        return releaseDelivered;
    }

    /**
     * Sets whether released deliveries are reported as having been delivered to the
     * application unless specified otherwise.
     *
     * @param releaseDelivered {@code true} if released deliveries should be reported as delivered.
     * @return This instance for setter chaining.
     */
    public final AckerConfigProperties setReleaseDelivered(final boolean releaseDelivered) {
        this.releaseDelivered = releaseDelivered;
        return this;
    }
}
