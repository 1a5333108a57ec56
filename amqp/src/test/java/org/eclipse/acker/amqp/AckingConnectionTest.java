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

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.acker.config.AckerConfigProperties;
import org.eclipse.acker.delivery.Delivery;
import org.eclipse.acker.delivery.InvalidHandleException;
import org.eclipse.acker.test.ProtonMockSupport;
import org.eclipse.acker.test.VertxMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonConnection;
import io.vertx.proton.ProtonHelper;

/**
 * Tests verifying behavior of {@link AckingConnection}.
 *
 */
public class AckingConnectionTest {

    private ProtonConnection connection;
    private AckingConnection ackingConnection;
    private List<Delivery> received;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        connection = mock(ProtonConnection.class);
        when(connection.getRemoteContainer()).thenReturn("client");
        ackingConnection = AckingConnection.attach(
                VertxMockSupport.mockContext(mock(Vertx.class)),
                connection,
                new AckerConfigProperties().setAutoAccept(false));
        received = new ArrayList<>();
    }

    private void receiveMessages() {
        final AckingReceiver telemetry = ackingConnection.receiver(
                ProtonMockSupport.mockProtonReceiver("telemetry"),
                (delivery, msg) -> received.add(delivery));
        final AckingReceiver event = ackingConnection.receiver(
                ProtonMockSupport.mockProtonReceiver("event"),
                (delivery, msg) -> received.add(delivery));
        telemetry.handleMessage(ProtonMockSupport.mockProtonDelivery(), ProtonHelper.message("1"));
        event.handleMessage(ProtonMockSupport.mockProtonDelivery(), ProtonHelper.message("2"));
        assertThat(ackingConnection.getLinkTable().size()).isEqualTo(2);
    }

    /**
     * Verifies that all deliveries become invalid once the connection is lost.
     */
    @Test
    public void testDisconnectInvalidatesDeliveries() {

        // GIVEN a connection with unsettled deliveries on two links
        receiveMessages();
        final ArgumentCaptor<Handler<ProtonConnection>> disconnectHandler = VertxMockSupport.argumentCaptorHandler();
        verify(connection).disconnectHandler(disconnectHandler.capture());

        // WHEN the connection is lost
        disconnectHandler.getValue().handle(connection);

        // THEN all links are closed
        assertThat(ackingConnection.getLinkTable().size()).isEqualTo(0);
        // AND the deliveries can no longer be settled
        for (final Delivery delivery : received) {
            assertThrows(InvalidHandleException.class, () -> ackingConnection.getAcker().accept(delivery));
        }
    }

    /**
     * Verifies that the connection is closed and all links are torn down when the peer closes the connection.
     */
    @Test
    public void testRemoteCloseTearsDownConnection() {

        receiveMessages();
        final ArgumentCaptor<Handler<AsyncResult<ProtonConnection>>> closeHandler =
                VertxMockSupport.argumentCaptorHandler();
        verify(connection).closeHandler(closeHandler.capture());

        closeHandler.getValue().handle(Future.succeededFuture(connection));

        assertThat(ackingConnection.getLinkTable().size()).isEqualTo(0);
        verify(connection).close();
        verify(connection).disconnect();
        assertThrows(InvalidHandleException.class, () -> ackingConnection.getAcker().settle(received.get(0)));
    }
}
