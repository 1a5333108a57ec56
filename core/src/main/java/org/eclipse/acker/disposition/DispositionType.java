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

/**
 * The kinds of disposition that are sent to the peer about a delivery.
 */
public enum DispositionType {

    /**
     * The receiver has successfully processed the message. The sender may discard it.
     */
    ACCEPTED,
    /**
     * The message is invalid and cannot be processed by the receiver. The sender should not
     * redeliver it to this receiver and may move it to a dead letter queue.
     */
    REJECTED,
    /**
     * The message has not been processed by the receiver and may be redelivered.
     */
    RELEASED,
    /**
     * A bare settlement that does not convey any (new) outcome.
     */
    SETTLED;

    /**
     * Checks if this type conveys an outcome to the peer.
     *
     * @return {@code true} unless this is {@link #SETTLED}.
     */
    public boolean hasOutcome() {
        return this != SETTLED;
    }
}
