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

/**
 * A non-owning reference to a link managed by a {@link LinkTable}.
 * <p>
 * A handle consists of the index of the table slot that the link occupies and the generation
 * of that slot at the time the link was opened. Slots are reused for new links once a link
 * has been closed, so a handle of a closed link never resolves to its successor.
 */
public final class LinkHandle {

    private final int index;
    private final int generation;
    private final String name;

    LinkHandle(final int index, final int generation, final String name) {
        this.index = index;
        this.generation = generation;
        this.name = name;
    }

    int getIndex() {
        return index;
    }

    int getGeneration() {
        return generation;
    }

    /**
     * Gets the name of the link.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LinkHandle)) {
            return false;
        }
        final LinkHandle other = (LinkHandle) obj;
        return index == other.index && generation == other.generation;
    }

    @Override
    public int hashCode() {
        return 31 * index + generation;
    }

    @Override
    public String toString() {
        return String.format("LinkHandle [name: %s, slot: %d, generation: %d]", name, index, generation);
    }
}
