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

import org.apache.qpid.proton.message.Message;
import org.eclipse.acker.delivery.Delivery;

/**
 * A handler for messages received on a link.
 */
@FunctionalInterface
public interface DeliveryHandler {

    /**
     * Processes a message.
     * <p>
     * The handler settles the delivery by means of the connection's {@link org.eclipse.acker.delivery.Acker}.
     * Deliveries that are still unsettled when this method returns get accepted automatically,
     * unless automatic acceptance has been disabled in the configuration.
     *
     * @param delivery The delivery of the message.
     * @param message The message.
     */
    void handle(Delivery delivery, Message message);
}
