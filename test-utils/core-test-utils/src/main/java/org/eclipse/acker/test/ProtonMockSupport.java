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

package org.eclipse.acker.test;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.qpid.proton.amqp.transport.DeliveryState;

import io.vertx.proton.ProtonConnection;
import io.vertx.proton.ProtonDelivery;
import io.vertx.proton.ProtonLink;
import io.vertx.proton.ProtonReceiver;
import io.vertx.proton.ProtonSession;

/**
 * Mocks for vertx-proton objects.
 */
public final class ProtonMockSupport {

    private ProtonMockSupport() {
    }

    /**
     * Creates a mocked Proton receiver which always returns {@code true} when its isOpen method is called
     * and whose connection is not disconnected.
     *
     * @param name The name of the link.
     * @return The mocked receiver.
     */
    public static ProtonReceiver mockProtonReceiver(final String name) {

        final ProtonReceiver receiver = mock(ProtonReceiver.class);
        when(receiver.isOpen()).thenReturn(Boolean.TRUE);
        when(receiver.getName()).thenReturn(name);
        mockLinkConnection(receiver);

        return receiver;
    }

    private static void mockLinkConnection(final ProtonLink<?> link) {
        final ProtonConnection connection = mock(ProtonConnection.class);
        when(connection.isDisconnected()).thenReturn(false);
        final ProtonSession session = mock(ProtonSession.class);
        when(session.getConnection()).thenReturn(connection);
        when(link.getSession()).thenReturn(session);
    }

    /**
     * Creates a mocked Proton delivery which keeps track of its local state and settlement
     * like a real delivery does.
     *
     * @return The mocked delivery.
     */
    public static ProtonDelivery mockProtonDelivery() {

        final ProtonDelivery delivery = mock(ProtonDelivery.class);
        final AtomicReference<DeliveryState> localState = new AtomicReference<>();
        final AtomicBoolean settled = new AtomicBoolean(false);

        when(delivery.getLocalState()).thenAnswer(invocation -> localState.get());
        when(delivery.isSettled()).thenAnswer(invocation -> settled.get());
        doAnswer(invocation -> {
            localState.set(invocation.getArgument(0));
            final Boolean settle = invocation.getArgument(1);
            if (settle) {
                settled.set(true);
            }
            return delivery;
        }).when(delivery).disposition(any(DeliveryState.class), anyBoolean());
        doAnswer(invocation -> {
            settled.set(true);
            return delivery;
        }).when(delivery).settle();
        return delivery;
    }
}
