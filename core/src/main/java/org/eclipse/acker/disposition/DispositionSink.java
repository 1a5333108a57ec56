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
 * The transport layer's capability for sending dispositions to the peer of a link.
 * <p>
 * The sink is responsible for encoding and flushing the corresponding frames. Implementations
 * must not block the calling thread.
 */
@FunctionalInterface
public interface DispositionSink {

    /**
     * Sends a disposition to the peer.
     *
     * @param disposition The disposition to send.
     * @throws NullPointerException if disposition is {@code null}.
     */
    void emit(Disposition disposition);
}
