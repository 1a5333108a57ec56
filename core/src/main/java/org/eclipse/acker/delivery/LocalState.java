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

package org.eclipse.acker.delivery;

/**
 * The local state of a delivery.
 * <p>
 * A delivery starts out in {@link #RECEIVED} and moves to exactly one of the other states.
 * None of the other states can be left again.
 */
public enum LocalState {

    /**
     * The message has been received but no outcome has been decided yet.
     */
    RECEIVED,
    /**
     * The message has been accepted.
     */
    ACCEPTED,
    /**
     * The message has been rejected.
     */
    REJECTED,
    /**
     * The message has been released.
     */
    RELEASED,
    /**
     * The delivery has been settled without sending any outcome to the peer.
     */
    SETTLED_WITHOUT_DISPOSITION;

    /**
     * Checks if a disposition conveying an outcome has been sent for a delivery in this state.
     *
     * @return {@code true} for accepted, rejected and released deliveries.
     */
    public boolean hasDisposition() {
        switch (this) {
        case ACCEPTED:
        case REJECTED:
        case RELEASED:
            return true;
        default:
            return false;
        }
    }
}
