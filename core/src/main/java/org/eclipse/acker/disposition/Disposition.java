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

package org.eclipse.acker.disposition;

import java.util.Objects;

import org.apache.qpid.proton.amqp.transport.ErrorCondition;

/**
 * An immutable disposition of a delivery that is to be sent to the peer.
 * <p>
 * All dispositions created by this class settle the delivery they refer to.
 */
public final class Disposition {

    private final long deliveryId;
    private final DispositionType type;
    private final boolean delivered;
    private final ErrorCondition error;

    private Disposition(
            final long deliveryId,
            final DispositionType type,
            final boolean delivered,
            final ErrorCondition error) {
        this.deliveryId = deliveryId;
        this.type = type;
        this.delivered = delivered;
        this.error = error;
    }

    /**
     * Creates an <em>accepted</em> disposition.
     *
     * @param deliveryId The identifier of the delivery.
     * @return The disposition.
     */
    public static Disposition accepted(final long deliveryId) {
        return new Disposition(deliveryId, DispositionType.ACCEPTED, true, null);
    }

    /**
     * Creates a <em>rejected</em> disposition.
     *
     * @param deliveryId The identifier of the delivery.
     * @param error The error condition to convey to the peer or {@code null} if the cause is unknown.
     * @return The disposition.
     */
    public static Disposition rejected(final long deliveryId, final ErrorCondition error) {
        return new Disposition(deliveryId, DispositionType.REJECTED, true, error);
    }

    /**
     * Creates a <em>released</em> disposition.
     *
     * @param deliveryId The identifier of the delivery.
     * @param delivered {@code true} if the message has been handed to the application before
     *                  it got released. The sender uses this flag for its redelivery bookkeeping.
     * @return The disposition.
     */
    public static Disposition released(final long deliveryId, final boolean delivered) {
        return new Disposition(deliveryId, DispositionType.RELEASED, delivered, null);
    }

    /**
     * Creates a bare settlement which does not carry an outcome.
     *
     * @param deliveryId The identifier of the delivery.
     * @return The disposition.
     */
    public static Disposition settlement(final long deliveryId) {
        return new Disposition(deliveryId, DispositionType.SETTLED, false, null);
    }

    /**
     * Gets the identifier of the delivery that this disposition refers to.
     *
     * @return The identifier.
     */
    public long getDeliveryId() {
        return deliveryId;
    }

    /**
     * Gets the type of this disposition.
     *
     * @return The type.
     */
    public DispositionType getType() {
        return type;
    }

    /**
     * Checks if the message had been delivered to the application.
     * <p>
     * The value is only meaningful for {@link DispositionType#RELEASED} dispositions.
     *
     * @return {@code true} if the message reached the application.
     */
    public boolean isDelivered() {
        return delivered;
    }

    /**
     * Gets the error condition conveyed in a <em>rejected</em> disposition.
     *
     * @return The condition or {@code null} if not set.
     */
    public ErrorCondition getError() {
        return error;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Disposition other = (Disposition) obj;
        return deliveryId == other.deliveryId
                && type == other.type
                && delivered == other.delivered
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deliveryId, type, delivered, error);
    }

    @Override
    public String toString() {
        final StringBuilder b = new StringBuilder("Disposition [deliveryId: ")
                .append(deliveryId)
                .append(", type: ")
                .append(type);
        if (type == DispositionType.RELEASED) {
            b.append(", delivered: ").append(delivered);
        }
        if (error != null) {
            b.append(", error: ").append(error.getCondition());
        }
        return b.append("]").toString();
    }
}
