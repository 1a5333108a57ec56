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

package org.eclipse.acker.amqp;

import java.util.Objects;

import org.apache.qpid.proton.amqp.messaging.Accepted;
import org.apache.qpid.proton.amqp.messaging.Modified;
import org.apache.qpid.proton.amqp.messaging.Rejected;
import org.apache.qpid.proton.amqp.messaging.Released;
import org.apache.qpid.proton.amqp.transport.DeliveryState;
import org.eclipse.acker.disposition.Disposition;

/**
 * Utility methods for mapping dispositions to AMQP 1.0 delivery states.
 */
public final class ProtonDispositions {

    private ProtonDispositions() {
        // prevent instantiation
    }

    /**
     * Gets the AMQP delivery state corresponding to a disposition.
     * <p>
     * A released disposition maps to the <em>modified</em> outcome with its <em>delivery-failed</em>
     * flag set if the message had been delivered to the application, so that the sender increments
     * the message's delivery count. Otherwise it maps to the <em>released</em> outcome.
     *
     * @param disposition The disposition.
     * @return The delivery state or {@code null} if the disposition is a bare settlement.
     * @throws NullPointerException if disposition is {@code null}.
     */
    public static DeliveryState toDeliveryState(final Disposition disposition) {

        Objects.requireNonNull(disposition);

        switch (disposition.getType()) {
        case ACCEPTED:
            return Accepted.getInstance();
        case REJECTED:
            final Rejected rejected = new Rejected();
            if (disposition.getError() != null) {
                rejected.setError(disposition.getError());
            }
            return rejected;
        case RELEASED:
            if (disposition.isDelivered()) {
                final Modified modified = new Modified();
                modified.setDeliveryFailed(true);
                return modified;
            }
            return Released.getInstance();
        default:
            return null;
        }
    }
}
