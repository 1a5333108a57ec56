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
 * Indicates that a delivery or link handle has been used after its owning link or connection
 * has been torn down.
 * <p>
 * This condition points to a lifecycle bug in the calling code and is therefore never
 * absorbed by the {@link Acker}.
 */
public final class InvalidHandleException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final transient LinkHandle handle;

    /**
     * Creates a new exception for a handle.
     *
     * @param handle The stale handle.
     */
    public InvalidHandleException(final LinkHandle handle) {
        super(String.format("link [%s] has been closed", handle == null ? null : handle.getName()));
        this.handle = handle;
    }

    /**
     * Gets the stale handle.
     *
     * @return The handle.
     */
    public LinkHandle getHandle() {
        return handle;
    }
}
