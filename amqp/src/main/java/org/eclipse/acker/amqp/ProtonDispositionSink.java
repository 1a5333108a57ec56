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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.qpid.proton.amqp.transport.DeliveryState;
import org.eclipse.acker.disposition.Disposition;
import org.eclipse.acker.disposition.DispositionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Context;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonDelivery;

/**
 * A sink that applies dispositions to the vertx-proton deliveries of a receiver link.
 * <p>
 * vertx-proton objects must only be used on the context that the connection has been established on.
 * Dispositions emitted from any other thread are therefore run on that context. Dispositions are
 * applied in the order in which they have been emitted.
 */
public final class ProtonDispositionSink implements DispositionSink {

    private static final Logger LOG = LoggerFactory.getLogger(ProtonDispositionSink.class);

    private final Context context;
    private final String linkName;
    private final Map<Long, ProtonDelivery> deliveries = new ConcurrentHashMap<>();
    private final AtomicInteger pendingOnContext = new AtomicInteger();

    /**
     * Creates a new sink.
     *
     * @param context The vert.x context that the connection of the link runs on.
     * @param linkName The name of the link.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ProtonDispositionSink(final Context context, final String linkName) {
        this.context = Objects.requireNonNull(context);
        this.linkName = Objects.requireNonNull(linkName);
    }

    /**
     * Registers a vertx-proton delivery under the identifier assigned to it.
     *
     * @param deliveryId The identifier.
     * @param delivery The delivery.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws IllegalArgumentException if another delivery is already registered under the identifier.
     */
    public void track(final long deliveryId, final ProtonDelivery delivery) {
        Objects.requireNonNull(delivery);
        if (deliveries.putIfAbsent(deliveryId, delivery) != null) {
            throw new IllegalArgumentException(String.format(
                    "link [%s] already tracks a delivery with id %d", linkName, deliveryId));
        }
    }

    /**
     * Gets the number of deliveries that have not been settled yet.
     *
     * @return The number of deliveries.
     */
    public int getTrackedCount() {
        return deliveries.size();
    }

    /**
     * Stops tracking all deliveries.
     * <p>
     * This method is to be invoked once the link has been closed.
     */
    public void clear() {
        deliveries.clear();
    }

    @Override
    public void emit(final Disposition disposition) {

        Objects.requireNonNull(disposition);

        if (Vertx.currentContext() == context && pendingOnContext.get() == 0) {
            apply(disposition);
        } else {
            // preserve order with respect to dispositions that are already waiting to be run on the context
            pendingOnContext.incrementAndGet();
            context.runOnContext(go -> {
                pendingOnContext.decrementAndGet();
                apply(disposition);
            });
        }
    }

    private void apply(final Disposition disposition) {

        final ProtonDelivery delivery = deliveries.remove(disposition.getDeliveryId());

        if (disposition.getType().hasOutcome()) {
            if (delivery == null) {
                LOG.debug("link [{}] has no unsettled delivery [id: {}], discarding {}",
                        linkName, disposition.getDeliveryId(), disposition);
                return;
            }
            final DeliveryState state = ProtonDispositions.toDeliveryState(disposition);
            LOG.trace("updating delivery [id: {}] on link [{}] with outcome [{}]",
                    disposition.getDeliveryId(), linkName, state);
            delivery.disposition(state, true);
        } else if (delivery != null && !delivery.isSettled()) {
            LOG.trace("settling delivery [id: {}] on link [{}] without outcome", disposition.getDeliveryId(), linkName);
            delivery.settle();
        } else {
            LOG.trace("delivery [id: {}] on link [{}] has already been settled", disposition.getDeliveryId(), linkName);
        }
    }
}
