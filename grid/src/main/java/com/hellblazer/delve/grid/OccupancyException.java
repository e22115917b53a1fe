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
package com.hellblazer.delve.grid;

/**
 * Base class for grid occupancy contract violations.
 * <p>
 * Both subclasses indicate that a caller asked for a placement the {@link MovementValidator} would have refused. They
 * are unchecked: spawn resolution treats them as a rejected attempt and carries on, while live callers let them
 * surface.
 *
 * @author hal.hildebrand
 */
public sealed class OccupancyException extends RuntimeException
    permits OccupancyConflictException, InvalidFootprintException {

    public OccupancyException(String message) {
        super(message);
    }

    public OccupancyException(String message, Throwable cause) {
        super(message, cause);
    }
}
