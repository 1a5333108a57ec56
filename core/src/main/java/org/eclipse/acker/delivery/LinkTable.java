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
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.eclipse.acker.disposition.DispositionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The table of open links of a connection.
 * <p>
 * The table is owned by the transport layer. Deliveries only hold a {@link LinkHandle} to the
 * link they have been received on, so closing a link (or tearing down the whole connection by
 * means of {@link #closeAll()}) turns all handles of the affected deliveries stale.
 * Any attempt to settle such a delivery then fails with an {@link InvalidHandleException}.
 */
public final class LinkTable {

    private static final Logger LOG = LoggerFactory.getLogger(LinkTable.class);

    private final List<Slot> slots = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();
    private int openLinks;

    /**
     * Adds a link to the table.
     *
     * @param name The name of the link.
     * @param sink The sink to emit the dispositions of the link's deliveries to.
     * @return The handle referring to the link.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public synchronized LinkHandle open(final String name, final DispositionSink sink) {

        Objects.requireNonNull(name);
        Objects.requireNonNull(sink);

        final Integer freeIndex = freeSlots.poll();
        final Slot slot;
        if (freeIndex == null) {
            slot = new Slot(slots.size());
            slots.add(slot);
        } else {
            slot = slots.get(freeIndex);
        }
        final LinkHandle handle = slot.occupy(name, sink);
        openLinks++;
        LOG.debug("opened {}", handle);
        return handle;
    }

    /**
     * Removes a link from the table.
     * <p>
     * Dispositions that have not been emitted yet are discarded.
     *
     * @param handle The handle of the link to close.
     * @return {@code true} if the link has been closed, {@code false} if it had already been closed before.
     * @throws NullPointerException if handle is {@code null}.
     */
    public boolean close(final LinkHandle handle) {

        Objects.requireNonNull(handle);

        final OutboundLink link;
        synchronized (this) {
            final Slot slot = find(handle);
            if (slot == null) {
                return false;
            }
            link = slot.vacate();
            freeSlots.add(slot.index);
            openLinks--;
        }
        link.close();
        return true;
    }

    /**
     * Closes all links of the table.
     * <p>
     * This method is to be invoked when the connection owning the table is torn down.
     *
     * @return The number of links that have been closed.
     */
    public int closeAll() {
        final List<LinkHandle> handles = new ArrayList<>();
        synchronized (this) {
            for (final Slot slot : slots) {
                if (slot.link != null) {
                    handles.add(slot.link.getHandle());
                }
            }
        }
        int closed = 0;
        for (final LinkHandle handle : handles) {
            if (close(handle)) {
                closed++;
            }
        }
        if (closed > 0) {
            LOG.info("closed {} link(s)", closed);
        }
        return closed;
    }

    /**
     * Checks if a handle refers to a link that is still open.
     *
     * @param handle The handle to check.
     * @return {@code true} if the link is open.
     * @throws NullPointerException if handle is {@code null}.
     */
    public synchronized boolean isOpen(final LinkHandle handle) {
        Objects.requireNonNull(handle);
        return find(handle) != null;
    }

    /**
     * Gets the number of open links.
     *
     * @return The number of links.
     */
    public synchronized int size() {
        return openLinks;
    }

    /**
     * Gets the number of deliveries on a link that have not been settled yet.
     *
     * @param handle The handle of the link.
     * @return The number of deliveries.
     * @throws NullPointerException if handle is {@code null}.
     * @throws InvalidHandleException if the link has been closed.
     */
    public int getUnsettledCount(final LinkHandle handle) {
        return resolve(handle).getUnsettledCount();
    }

    /**
     * Creates a delivery for a transfer that has been completely received on a link.
     *
     * @param handle The handle of the link that the transfer has been received on.
     * @param deliveryId The identifier of the delivery.
     * @return The delivery in state {@link LocalState#RECEIVED}.
     * @throws NullPointerException if handle is {@code null}.
     * @throws InvalidHandleException if the link has been closed.
     * @throws IllegalArgumentException if the link already has an unsettled delivery with the given identifier.
     */
    public Delivery newDelivery(final LinkHandle handle, final long deliveryId) {
        return resolve(handle).register(deliveryId, this);
    }

    /**
     * Gets the state kept for a link.
     *
     * @param handle The handle of the link.
     * @return The link.
     * @throws InvalidHandleException if the link has been closed.
     */
    synchronized OutboundLink resolve(final LinkHandle handle) {
        Objects.requireNonNull(handle);
        final Slot slot = find(handle);
        if (slot == null) {
            throw new InvalidHandleException(handle);
        }
        return slot.link;
    }

    private Slot find(final LinkHandle handle) {
        if (handle.getIndex() < 0 || handle.getIndex() >= slots.size()) {
            return null;
        }
        final Slot slot = slots.get(handle.getIndex());
        if (slot.link == null || slot.generation != handle.getGeneration()) {
            return null;
        }
        return slot;
    }

    private static final class Slot {

        private final int index;
        private int generation;
        private OutboundLink link;

        Slot(final int index) {
            this.index = index;
        }

        LinkHandle occupy(final String name, final DispositionSink sink) {
            final LinkHandle handle = new LinkHandle(index, generation, name);
            link = new OutboundLink(handle, sink);
            return handle;
        }

        OutboundLink vacate() {
            final OutboundLink vacated = link;
            link = null;
            generation++;
            return vacated;
        }
    }
}
