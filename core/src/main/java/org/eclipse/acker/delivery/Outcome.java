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
 * The outcomes that can be applied to a delivery when settling it.
 */
public enum Outcome {

    ACCEPTED(LocalState.ACCEPTED),
    REJECTED(LocalState.REJECTED),
    RELEASED(LocalState.RELEASED);

    private final LocalState localState;

    Outcome(final LocalState localState) {
        this.localState = localState;
    }

    /**
     * Gets the local state that a delivery ends up in when this outcome is applied.
     *
     * @return The state.
     */
    public LocalState getLocalState() {
        return localState;
    }
}
