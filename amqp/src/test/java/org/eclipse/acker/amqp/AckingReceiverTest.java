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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import static com.google.common.truth.Truth.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.apache.qpid.proton.amqp.messaging.Accepted;
import org.apache.qpid.proton.amqp.messaging.Modified;
import org.apache.qpid.proton.amqp.messaging.Rejected;
import org.apache.qpid.proton.amqp.messaging.Released;
import org.apache.qpid.proton.amqp.transport.DeliveryState;
import org.apache.qpid.proton.message.Message;
import org.eclipse.acker.config.AckerConfigProperties;
import org.eclipse.acker.delivery.Acker;
import org.eclipse.acker.delivery.Delivery;
import org.eclipse.acker.delivery.LinkTable;
import org.eclipse.acker.delivery.LocalState;
import org.eclipse.acker.test.ProtonMockSupport;
import org.eclipse.acker.test.VertxMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonDelivery;
import io.vertx.proton.ProtonHelper;
import io.vertx.proton.ProtonReceiver;

/**
 * Tests verifying behavior of {@link AckingReceiver}.
 *
 */
public class AckingReceiverTest {

    private Context context;
    private ProtonReceiver receiver;
    private LinkTable linkTable;
    private Acker acker;
    private AckerConfigProperties config;
    private Message message;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        context = VertxMockSupport.mockContext(mock(Vertx.class));
        receiver = ProtonMockSupport.mockProtonReceiver("telemetry/DEFAULT_TENANT");
        linkTable = new LinkTable();
        config = new AckerConfigProperties();
        acker = new Acker(config);
        message = ProtonHelper.message("hello");
    }

    private AckingReceiver bind(final DeliveryHandler handler) {
        return AckingReceiver.bind(context, receiver, linkTable, acker, config, handler);
    }

    /**
     * Verifies that binding a receiver disables vertx-proton's own automatic acceptance
     * and registers the link with the link table.
     */
    @Test
    public void testBindRegistersLink() {

        final AckingReceiver ackingReceiver = bind((delivery, msg) -> { });

        verify(receiver).setAutoAccept(false);
        verify(receiver).handler(any());
        assertThat(linkTable.isOpen(ackingReceiver.getLink())).isTrue();
        assertThat(ackingReceiver.getLink().getName()).isEqualTo("telemetry/DEFAULT_TENANT");
    }

    /**
     * Verifies that a message which has been left unsettled by the handler gets accepted.
     */
    @Test
    public void testUnsettledDeliveryIsAutoAccepted() {

        final AtomicReference<Delivery> received = new AtomicReference<>();
        final AckingReceiver ackingReceiver = bind((delivery, msg) -> received.set(delivery));
        final ProtonDelivery protonDelivery = ProtonMockSupport.mockProtonDelivery();

        ackingReceiver.handleMessage(protonDelivery, message);

        assertThat(received.get().getLocalState()).isEqualTo(LocalState.ACCEPTED);
        verify(protonDelivery).disposition(any(Accepted.class), eq(true));
        assertThat(ackingReceiver.getUnsettledCount()).isEqualTo(0);
    }

    /**
     * Verifies that a message which has been rejected by the handler is not accepted afterwards.
     */
    @Test
    public void testHandlerOutcomeIsKept() {

        final AckingReceiver ackingReceiver = bind((delivery, msg) -> acker.reject(delivery));
        final ProtonDelivery protonDelivery = ProtonMockSupport.mockProtonDelivery();

        ackingReceiver.handleMessage(protonDelivery, message);

        verify(protonDelivery, times(1)).disposition(any(DeliveryState.class), anyBoolean());
        verify(protonDelivery).disposition(any(Rejected.class), eq(true));
    }

    /**
     * Verifies that a message is left unsettled by the handler if automatic acceptance is disabled.
     */
    @Test
    public void testDeliveryIsNotAcceptedIfAutoAcceptIsDisabled() {

        config.setAutoAccept(false);
        final AtomicReference<Delivery> received = new AtomicReference<>();
        final AckingReceiver ackingReceiver = bind((delivery, msg) -> received.set(delivery));
        final ProtonDelivery protonDelivery = ProtonMockSupport.mockProtonDelivery();

        ackingReceiver.handleMessage(protonDelivery, message);

        verify(protonDelivery, never()).disposition(any(DeliveryState.class), anyBoolean());
        assertThat(ackingReceiver.getUnsettledCount()).isEqualTo(1);

        // the application settles the delivery later on
        acker.release(received.get(), false);
        verify(protonDelivery).disposition(any(Released.class), eq(true));
        assertThat(ackingReceiver.getUnsettledCount()).isEqualTo(0);
    }

    /**
     * Verifies that a message whose handler fails is released as having been delivered.
     */
    @Test
    public void testFailingHandlerReleasesDelivery() {

        final AckingReceiver ackingReceiver = bind((delivery, msg) -> {
            throw new IllegalStateException("cannot process message");
        });
        final ProtonDelivery protonDelivery = ProtonMockSupport.mockProtonDelivery();

        ackingReceiver.handleMessage(protonDelivery, message);

        verify(protonDelivery).disposition(
                argThat(state -> state instanceof Modified && ((Modified) state).getDeliveryFailed()),
                eq(true));
    }

    /**
     * Verifies that the link gets closed when the peer detaches it and that deliveries received
     * before can no longer be settled.
     */
    @Test
    public void testRemoteDetachClosesLink() {

        // GIVEN a receiver with an unsettled delivery
        config.setAutoAccept(false);
        final AtomicReference<Delivery> received = new AtomicReference<>();
        final AckingReceiver ackingReceiver = bind((delivery, msg) -> received.set(delivery));
        final ProtonDelivery protonDelivery = ProtonMockSupport.mockProtonDelivery();
        ackingReceiver.handleMessage(protonDelivery, message);
        final ArgumentCaptor<Handler<AsyncResult<ProtonReceiver>>> detachHandler =
                VertxMockSupport.argumentCaptorHandler();
        verify(receiver).detachHandler(detachHandler.capture());

        // WHEN the peer detaches the link
        detachHandler.getValue().handle(Future.succeededFuture(receiver));

        // THEN the link is closed
        verify(receiver).close();
        verify(receiver).free();
        assertThat(linkTable.isOpen(ackingReceiver.getLink())).isFalse();
        assertThat(ackingReceiver.getUnsettledCount()).isEqualTo(0);
        // AND the delivery can no longer be settled
        assertThat(received.get().isLinkOpen()).isFalse();
        verify(protonDelivery, never()).disposition(any(DeliveryState.class), anyBoolean());
    }

    /**
     * Verifies that a message received on a link that has already been closed is released
     * without invoking the handler.
     */
    @Test
    public void testMessageOnClosedLinkIsReleased() {

        final DeliveryHandler handler = mock(DeliveryHandler.class);
        final AckingReceiver ackingReceiver = bind(handler);
        ackingReceiver.close();
        final ProtonDelivery protonDelivery = ProtonMockSupport.mockProtonDelivery();

        ackingReceiver.handleMessage(protonDelivery, message);

        verify(handler, never()).handle(any(Delivery.class), any(Message.class));
        verify(protonDelivery).disposition(any(Released.class), eq(true));
        verify(receiver).close();
    }
}
