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

import java.util.Objects;

import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.eclipse.acker.config.AckerConfigProperties;
import org.eclipse.acker.disposition.Disposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settles deliveries and sends the corresponding dispositions to the peer.
 * <p>
 * An acker does not keep any state of its own. Each operation validates the requested
 * transition against the delivery's current state and, if valid, updates the delivery and
 * enqueues the disposition on the outbound queue of the delivery's link. None of the
 * operations waits for the peer.
 * <p>
 * Operations on a delivery that has already been settled are absorbed as no-ops, so duplicate
 * or late acknowledgments by the application never result in duplicate frames. The only
 * exception to this rule is {@link #settle(Delivery, Outcome)} which sends a single bare
 * settlement for a delivery that already carries an outcome.
 * <p>
 * All operations fail with an {@link InvalidHandleException} if the delivery's link has
 * already been closed.
 */
public final class Acker {

    private static final Logger LOG = LoggerFactory.getLogger(Acker.class);

    private final Outcome defaultSettleOutcome;
    private final boolean releaseDelivered;

    /**
     * Creates an acker using default configuration properties.
     */
    public Acker() {
        this(new AckerConfigProperties());
    }

    /**
     * Creates an acker for configuration properties.
     *
     * @param config The configuration properties.
     * @throws NullPointerException if config is {@code null}.
     */
    public Acker(final AckerConfigProperties config) {
        Objects.requireNonNull(config);
        this.defaultSettleOutcome = config.getDefaultSettleOutcome();
        this.releaseDelivered = config.isReleaseDelivered();
    }

    /**
     * Performs an operation on a delivery using the operation's default arguments.
     *
     * @param operation The operation to perform.
     * @param delivery The delivery.
     * @return {@code true} if the delivery has been updated, {@code false} if the operation has been ignored.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     */
    public boolean apply(final AckOperation operation, final Delivery delivery) {
        Objects.requireNonNull(operation);
        switch (operation) {
        case ACCEPT:
            return accept(delivery);
        case REJECT:
            return reject(delivery);
        case RELEASE:
            return release(delivery);
        case SETTLE:
            return settle(delivery);
        default:
            throw new IllegalArgumentException("unsupported operation: " + operation);
        }
    }

    /**
     * Accepts and settles a delivery.
     *
     * @param delivery The delivery.
     * @return {@code true} if the delivery has been accepted, {@code false} if it had already been settled.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     */
    public boolean accept(final Delivery delivery) {
        return apply(delivery, AckOperation.ACCEPT, Outcome.ACCEPTED, false, null);
    }

    /**
     * Rejects and settles a delivery.
     *
     * @param delivery The delivery.
     * @return {@code true} if the delivery has been rejected, {@code false} if it had already been settled.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     */
    public boolean reject(final Delivery delivery) {
        return reject(delivery, null);
    }

    /**
     * Rejects and settles a delivery.
     *
     * @param delivery The delivery.
     * @param error The error condition to include in the <em>rejected</em> outcome (may be {@code null}).
     * @return {@code true} if the delivery has been rejected, {@code false} if it had already been settled.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     */
    public boolean reject(final Delivery delivery, final ErrorCondition error) {
        return apply(delivery, AckOperation.REJECT, Outcome.REJECTED, false, error);
    }

    /**
     * Releases and settles a delivery.
     * <p>
     * The <em>delivered</em> flag is taken from the configuration.
     *
     * @param delivery The delivery.
     * @return {@code true} if the delivery has been released, {@code false} if it had already been settled.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     * @see AckerConfigProperties#isReleaseDelivered()
     */
    public boolean release(final Delivery delivery) {
        return release(delivery, releaseDelivered);
    }

    /**
     * Releases and settles a delivery.
     *
     * @param delivery The delivery.
     * @param delivered {@code true} if the message has been handed to the application. The sender
     *                  may then redeliver the message with caution only. {@code false} indicates that
     *                  the message never reached the application and can be redelivered freely.
     * @return {@code true} if the delivery has been released, {@code false} if it had already been settled.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     */
    public boolean release(final Delivery delivery, final boolean delivered) {
        return apply(delivery, AckOperation.RELEASE, Outcome.RELEASED, delivered, null);
    }

    /**
     * Settles a delivery using the configured default outcome.
     *
     * @param delivery The delivery.
     * @return {@code true} if the delivery has been updated or a bare settlement has been sent.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     * @see #settle(Delivery, Outcome)
     * @see AckerConfigProperties#getDefaultSettleOutcome()
     */
    public boolean settle(final Delivery delivery) {
        return settle(delivery, defaultSettleOutcome);
    }

    /**
     * Settles a delivery.
     * <p>
     * If the delivery has not been settled yet, the given outcome is applied in the same way as if
     * the corresponding operation ({@link #accept(Delivery)}, {@link #reject(Delivery)} or
     * {@link #release(Delivery)}) had been invoked.
     * <p>
     * Otherwise the peer already knows the delivery's outcome. In this case a bare settlement
     * without any outcome is sent the first time this method is invoked for the delivery, allowing
     * the application to free up the delivery's bookkeeping without notifying the peer of the
     * outcome again. Any further invocations are ignored.
     *
     * @param delivery The delivery.
     * @param outcome The outcome to apply if the delivery has not been settled yet.
     * @return {@code true} if the delivery has been updated or a bare settlement has been sent.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     */
    public boolean settle(final Delivery delivery, final Outcome outcome) {
        Objects.requireNonNull(outcome);
        return apply(delivery, AckOperation.SETTLE, outcome, releaseDelivered, null);
    }

    /**
     * Settles a delivery without sending an outcome to the peer.
     * <p>
     * The delivery ends up in state {@link LocalState#SETTLED_WITHOUT_DISPOSITION}.
     *
     * @param delivery The delivery.
     * @return {@code true} if the delivery has been settled, {@code false} if it had already been settled.
     * @throws NullPointerException if delivery is {@code null}.
     * @throws InvalidHandleException if the delivery's link has been closed.
     */
    public boolean settleSilently(final Delivery delivery) {
        return apply(delivery, AckOperation.SETTLE, null, false, null);
    }

    private boolean apply(
            final Delivery delivery,
            final AckOperation operation,
            final Outcome outcome,
            final boolean delivered,
            final ErrorCondition error) {

        Objects.requireNonNull(delivery);

        synchronized (delivery) {
            final OutboundLink link = delivery.getTable().resolve(delivery.getLink());
            final Disposition disposition = transition(delivery, operation, outcome, delivered, error);
            if (disposition == null) {
                LOG.debug("ignoring {} of already settled {}", operation, delivery);
                return false;
            }
            link.settled(delivery);
            LOG.trace("{} of delivery [id: {}] on link [{}] results in {}",
                    operation, delivery.getId(), delivery.getLink().getName(), disposition);
            link.enqueue(disposition);
            return true;
        }
    }

    private static Disposition transition(
            final Delivery delivery,
            final AckOperation operation,
            final Outcome outcome,
            final boolean delivered,
            final ErrorCondition error) {

        final long id = delivery.getId();

        final LocalState state = delivery.getLocalState();
        if (state != LocalState.RECEIVED) {
            if (operation == AckOperation.SETTLE && outcome != null
                    && state.hasDisposition() && !delivery.isSettlementNotified()) {
                delivery.markSettlementNotified();
                return Disposition.settlement(id);
            }
            return null;
        }

        if (outcome == null) {
            delivery.settle(LocalState.SETTLED_WITHOUT_DISPOSITION, false, null);
            return Disposition.settlement(id);
        }

        delivery.settle(outcome.getLocalState(), outcome == Outcome.RELEASED && delivered, error);
        switch (outcome) {
        case ACCEPTED:
            return Disposition.accepted(id);
        case REJECTED:
            return Disposition.rejected(id, error);
        case RELEASED:
            return Disposition.released(id, delivered);
        default:
            throw new IllegalArgumentException("unsupported outcome: " + outcome);
        }
    }
}
