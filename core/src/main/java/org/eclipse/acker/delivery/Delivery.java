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

import org.apache.qpid.proton.amqp.transport.ErrorCondition;

/**
 * A message transfer that has been received on a link and that needs to be settled.
 * <p>
 * Instances are created by the transport layer by means of {@link LinkTable#newDelivery(LinkHandle, long)}.
 * The state of a delivery can only be changed by the {@link Acker}. All state changes are
 * guarded by the delivery's monitor.
 */
public final class Delivery {

    private final long id;
    private final LinkHandle link;
    private final LinkTable table;

    private LocalState localState = LocalState.RECEIVED;
    private boolean settled;
    private boolean settlementNotified;
    private boolean delivered;
    private ErrorCondition error;

    Delivery(final long id, final LinkHandle link, final LinkTable table) {
        this.id = id;
        this.link = link;
        this.table = table;
    }

    /**
     * Gets the identifier of this delivery.
     *
     * @return The identifier which is unique among the unsettled deliveries of the link.
     */
    public long getId() {
        return id;
    }

    /**
     * Gets the handle of the link that this delivery has been received on.
     *
     * @return The handle.
     */
    public LinkHandle getLink() {
        return link;
    }

    /**
     * Checks if the link that this delivery has been received on is still open.
     *
     * @return {@code true} if the link is open.
     */
    public boolean isLinkOpen() {
        return table.isOpen(link);
    }

    /**
     * Gets the local state of this delivery.
     *
     * @return The state.
     */
    public synchronized LocalState getLocalState() {
        return localState;
    }

    /**
     * Checks if this delivery has been settled locally.
     *
     * @return {@code true} if settled. Once settled, a delivery stays settled.
     */
    public synchronized boolean isSettled() {
        return settled;
    }

    /**
     * Checks if the message had been handed to the application before it has been released.
     *
     * @return {@code true} if the delivery has been released after delivery to the application.
     */
    public synchronized boolean isDelivered() {
        return delivered;
    }

    /**
     * Gets the error condition that the delivery has been rejected with.
     *
     * @return The condition or {@code null} if the delivery has not been rejected
     *         or has been rejected without a condition.
     */
    public synchronized ErrorCondition getError() {
        return error;
    }

    LinkTable getTable() {
        return table;
    }

    synchronized boolean isSettlementNotified() {
        return settlementNotified;
    }

    /**
     * Moves this delivery from {@link LocalState#RECEIVED} to a terminal state and settles it.
     * Must be invoked while holding this delivery's monitor.
     */
    void settle(final LocalState newState, final boolean deliveredFlag, final ErrorCondition errorCondition) {
        if (localState != LocalState.RECEIVED || settled) {
            throw new IllegalStateException("delivery has already been settled");
        }
        this.localState = newState;
        this.delivered = deliveredFlag;
        this.error = errorCondition;
        this.settled = true;
        // a silent settlement is announced to the peer right away
        this.settlementNotified = newState == LocalState.SETTLED_WITHOUT_DISPOSITION;
    }

    void markSettlementNotified() {
        this.settlementNotified = true;
    }

    @Override
    public String toString() {
        return String.format("Delivery [id: %d, link: %s, state: %s, settled: %b]",
                id, link.getName(), getLocalState(), isSettled());
    }
}
