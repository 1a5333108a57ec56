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

import org.eclipse.acker.config.AckerConfigProperties;
import org.eclipse.acker.delivery.Acker;
import org.eclipse.acker.delivery.LinkTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Context;
import io.vertx.proton.ProtonConnection;
import io.vertx.proton.ProtonReceiver;

/**
 * The settlement related state of an AMQP connection.
 * <p>
 * Keeps the {@link LinkTable} of the connection's receiver links. All links are closed when the
 * connection is closed by the peer or gets disconnected, which invalidates all deliveries that
 * have not been settled yet.
 */
public final class AckingConnection {

    private static final Logger LOG = LoggerFactory.getLogger(AckingConnection.class);

    private final Context context;
    private final ProtonConnection connection;
    private final AckerConfigProperties config;
    private final Acker acker;
    private final LinkTable linkTable = new LinkTable();

    private AckingConnection(
            final Context context,
            final ProtonConnection connection,
            final AckerConfigProperties config) {
        this.context = context;
        this.connection = connection;
        this.config = config;
        this.acker = new Acker(config);
    }

    /**
     * Attaches settlement support to a connection.
     * <p>
     * The connection's close and disconnect handlers are replaced.
     *
     * @param context The vert.x context that the connection has been established on.
     * @param connection The connection.
     * @param config The configuration properties.
     * @return The settlement support for the connection.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static AckingConnection attach(
            final Context context,
            final ProtonConnection connection,
            final AckerConfigProperties config) {

        Objects.requireNonNull(context);
        Objects.requireNonNull(connection);
        Objects.requireNonNull(config);

        final AckingConnection result = new AckingConnection(context, connection, config);
        connection.closeHandler(remoteClose -> {
            LOG.debug("peer closed connection [container: {}]", connection.getRemoteContainer());
            result.teardown();
            connection.close();
            connection.disconnect();
        });
        connection.disconnectHandler(con -> {
            LOG.debug("connection [container: {}] has been disconnected", con.getRemoteContainer());
            result.teardown();
        });
        return result;
    }

    /**
     * Gets the acker to settle the deliveries received on this connection with.
     *
     * @return The acker.
     */
    public Acker getAcker() {
        return acker;
    }

    /**
     * Gets the table of the connection's receiver links.
     *
     * @return The table.
     */
    public LinkTable getLinkTable() {
        return linkTable;
    }

    /**
     * Binds a receiver link of this connection.
     *
     * @param receiver The receiver link.
     * @param deliveryHandler The handler to invoke for each message received on the link.
     * @return The bound receiver.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public AckingReceiver receiver(final ProtonReceiver receiver, final DeliveryHandler deliveryHandler) {
        return AckingReceiver.bind(context, receiver, linkTable, acker, config, deliveryHandler);
    }

    /**
     * Closes all links of this connection.
     * <p>
     * Any further attempt to settle a delivery received on this connection fails with an
     * {@link org.eclipse.acker.delivery.InvalidHandleException}.
     */
    public void teardown() {
        final int closedLinks = linkTable.closeAll();
        if (closedLinks > 0) {
            LOG.info("tore down {} receiver link(s) of connection [container: {}]",
                    closedLinks, connection.getRemoteContainer());
        }
    }
}
