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
import java.util.concurrent.atomic.AtomicLong;

import org.apache.qpid.proton.message.Message;
import org.eclipse.acker.config.AckerConfigProperties;
import org.eclipse.acker.delivery.Acker;
import org.eclipse.acker.delivery.Delivery;
import org.eclipse.acker.delivery.InvalidHandleException;
import org.eclipse.acker.delivery.LinkHandle;
import org.eclipse.acker.delivery.LinkTable;
import org.eclipse.acker.delivery.LocalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Context;
import io.vertx.proton.ProtonDelivery;
import io.vertx.proton.ProtonHelper;
import io.vertx.proton.ProtonReceiver;

/**
 * A vertx-proton receiver link whose deliveries are settled by means of an {@link Acker}.
 * <p>
 * Each message received on the link is passed to a {@link DeliveryHandler} together with a
 * {@link Delivery} that has been registered with the connection's {@link LinkTable}. The link's
 * entry in the table is closed when the peer detaches or closes the link.
 */
public final class AckingReceiver {

    private static final Logger LOG = LoggerFactory.getLogger(AckingReceiver.class);

    private final ProtonReceiver receiver;
    private final LinkTable linkTable;
    private final LinkHandle link;
    private final ProtonDispositionSink sink;
    private final Acker acker;
    private final DeliveryHandler deliveryHandler;
    private final boolean autoAccept;
    private final AtomicLong nextDeliveryId = new AtomicLong();

    private AckingReceiver(
            final ProtonReceiver receiver,
            final LinkTable linkTable,
            final ProtonDispositionSink sink,
            final Acker acker,
            final AckerConfigProperties config,
            final DeliveryHandler deliveryHandler) {

        this.receiver = receiver;
        this.linkTable = linkTable;
        this.sink = sink;
        this.acker = acker;
        this.deliveryHandler = deliveryHandler;
        this.autoAccept = config.isAutoAccept();
        this.link = linkTable.open(receiver.getName(), sink);
    }

    /**
     * Binds a receiver link to a link table.
     * <p>
     * The receiver's own automatic acceptance of messages is disabled. Its message, detach
     * and close handlers are replaced.
     *
     * @param context The vert.x context that the receiver's connection runs on.
     * @param receiver The receiver link.
     * @param linkTable The link table of the receiver's connection.
     * @param acker The acker to settle deliveries with.
     * @param config The configuration properties.
     * @param deliveryHandler The handler to invoke for each message received on the link.
     * @return The bound receiver.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static AckingReceiver bind(
            final Context context,
            final ProtonReceiver receiver,
            final LinkTable linkTable,
            final Acker acker,
            final AckerConfigProperties config,
            final DeliveryHandler deliveryHandler) {

        Objects.requireNonNull(context);
        Objects.requireNonNull(receiver);
        Objects.requireNonNull(linkTable);
        Objects.requireNonNull(acker);
        Objects.requireNonNull(config);
        Objects.requireNonNull(deliveryHandler);

        final AckingReceiver result = new AckingReceiver(
                receiver,
                linkTable,
                new ProtonDispositionSink(context, receiver.getName()),
                acker,
                config,
                deliveryHandler);

        receiver.setAutoAccept(false);
        receiver.handler(result::handleMessage);
        receiver.detachHandler(remoteDetach -> result.onRemoteClose());
        receiver.closeHandler(remoteClose -> result.onRemoteClose());
        LOG.debug("bound receiver link [{}]", receiver.getName());
        return result;
    }

    /**
     * Gets the handle of the link in the connection's link table.
     *
     * @return The handle.
     */
    public LinkHandle getLink() {
        return link;
    }

    /**
     * Gets the number of deliveries received on the link that have not been settled yet.
     *
     * @return The number of deliveries or 0 if the link has been closed.
     */
    public int getUnsettledCount() {
        return linkTable.isOpen(link) ? sink.getTrackedCount() : 0;
    }

    /**
     * Closes the link.
     * <p>
     * All deliveries received on the link become invalid.
     */
    public void close() {
        if (release()) {
            receiver.close();
        }
    }

    private void onRemoteClose() {
        LOG.debug("peer closed receiver link [{}]", link.getName());
        release();
        if (receiver.isOpen()) {
            receiver.close();
        }
        receiver.free();
    }

    private boolean release() {
        sink.clear();
        return linkTable.close(link);
    }

    void handleMessage(final ProtonDelivery protonDelivery, final Message message) {

        final long deliveryId = nextDeliveryId.getAndIncrement();
        final Delivery delivery;
        try {
            delivery = linkTable.newDelivery(link, deliveryId);
        } catch (final InvalidHandleException e) {
            LOG.debug("received message on closed link [{}], releasing delivery", link.getName());
            ProtonHelper.released(protonDelivery, true);
            return;
        }
        sink.track(deliveryId, protonDelivery);

        try {
            deliveryHandler.handle(delivery, message);
        } catch (final RuntimeException e) {
            LOG.debug("failed to process message [id: {}] received on link [{}]", deliveryId, link.getName(), e);
            if (delivery.isLinkOpen()) {
                acker.release(delivery, true);
            }
            return;
        }

        if (autoAccept && delivery.getLocalState() == LocalState.RECEIVED && delivery.isLinkOpen()) {
            LOG.trace("auto-accepting delivery [id: {}] on link [{}]", deliveryId, link.getName());
            acker.accept(delivery);
        }
    }
}
