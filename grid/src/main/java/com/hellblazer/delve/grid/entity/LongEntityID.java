/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Delve.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.delve.grid.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Entity identifier backed by a long, handed out sequentially per floor.
 *
 * @author hal.hildebrand
 */
public final class LongEntityID implements EntityID {
    private final long id;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public LongEntityID(long id) {
        this.id = id;
    }

    @JsonValue
    public long getValue() {
        return id;
    }

    @Override
    public String toDebugString() {
        return "Entity[" + id + "]";
    }

    @Override
    public int compareTo(EntityID other) {
        if (other instanceof LongEntityID longOther) {
            return Long.compare(this.id, longOther.id);
        }
        return this.getClass().getName().compareTo(other.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LongEntityID that)) {
            return false;
        }
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return String.valueOf(id);
    }
}
