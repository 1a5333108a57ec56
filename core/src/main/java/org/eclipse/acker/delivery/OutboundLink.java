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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import org.eclipse.acker.disposition.Disposition;
import org.eclipse.acker.disposition.DispositionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state kept by a {@link LinkTable} for an open link.
 * <p>
 * Dispositions are handed to the link's sink in the order in which they have been enqueued.
 * A sink that enqueues further dispositions while being invoked does not break that order,
 * the nested dispositions are emitted after the current one has been completed.
 */
final class OutboundLink {

    private static final Logger LOG = LoggerFactory.getLogger(OutboundLink.class);

    private final LinkHandle handle;
    private final DispositionSink sink;
    private final Deque<Disposition> queue = new ArrayDeque<>();
    private final Map<Long, Delivery> unsettled = new HashMap<>();

    private boolean draining;
    private boolean closed;

    OutboundLink(final LinkHandle handle, final DispositionSink sink) {
        this.handle = handle;
        this.sink = sink;
    }

    LinkHandle getHandle() {
        return handle;
    }

    synchronized Delivery register(final long deliveryId, final LinkTable table) {
        if (closed) {
            throw new InvalidHandleException(handle);
        }
        if (unsettled.containsKey(deliveryId)) {
            throw new IllegalArgumentException(String.format(
                    "link [%s] already has an unsettled delivery with id %d", handle.getName(), deliveryId));
        }
        final Delivery delivery = new Delivery(deliveryId, handle, table);
        unsettled.put(deliveryId, delivery);
        LOG.trace("registered delivery [id: {}] on link [{}]", deliveryId, handle.getName());
        return delivery;
    }

    synchronized void settled(final Delivery delivery) {
        unsettled.remove(delivery.getId(), delivery);
    }

    synchronized int getUnsettledCount() {
        return unsettled.size();
    }

    synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Adds a disposition to the outbound queue and drains the queue into the sink
     * unless another invocation is already doing so.
     * <p>
     * A failure of the sink does not stop the queue from being drained. All dispositions
     * enqueued in the meantime are still handed to the sink before the first failure is thrown.
     *
     * @param disposition The disposition to send.
     * @throws RuntimeException if the sink fails to emit a disposition.
     */
    void enqueue(final Disposition disposition) {
        synchronized (this) {
            if (closed) {
                LOG.debug("link [{}] has been closed, discarding {}", handle.getName(), disposition);
                return;
            }
            queue.add(disposition);
            if (draining) {
                return;
            }
            draining = true;
        }
        drain();
    }

    private void drain() {
        RuntimeException failure = null;
        while (true) {
            final Disposition next;
            synchronized (this) {
                next = queue.poll();
                if (next == null) {
                    draining = false;
                    break;
                }
            }
            LOG.trace("emitting {} on link [{}]", next, handle.getName());
            try {
                sink.emit(next);
            } catch (final RuntimeException e) {
                LOG.debug("failed to emit {} on link [{}]", next, handle.getName(), e);
                if (failure == null) {
                    failure = e;
                } else if (failure != e) {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    void close() {
        final int pendingDispositions;
        final int unsettledDeliveries;
        synchronized (this) {
            closed = true;
            pendingDispositions = queue.size();
            unsettledDeliveries = unsettled.size();
            queue.clear();
            unsettled.clear();
        }
        if (unsettledDeliveries > 0 || pendingDispositions > 0) {
            LOG.warn("closed link [{}] with {} unsettled deliveries and {} pending dispositions",
                    handle.getName(), unsettledDeliveries, pendingDispositions);
        } else {
            LOG.debug("closed link [{}]", handle.getName());
        }
    }
}
