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
package com.hellblazer.delve.combat.loot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.common.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Independent-trial drop resolver.
 * <p>
 * Each entry rolls on its own: draw uniformly from {@code [1, denominator]} and drop if the draw is at most
 * {@code numerator}. Magic find buys extra trials for every entry of one roll: {@code magicFind / 100} guaranteed
 * extra trials plus one more with probability {@code (magicFind % 100)%}. An entry that succeeds on several trials
 * yields a single drop carrying the largest rolled quantity. Magic find therefore raises the drop chance of entries
 * that can fail and never changes entries that always or never drop.
 *
 * @author hal.hildebrand
 */
public final class LootTable {
    private static final Logger    log   = LoggerFactory.getLogger(LootTable.class);
    private static final LootTable EMPTY = new LootTable(List.of());

    private final List<LootEntry> entries;

    private LootTable(List<LootEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LootTable empty() {
        return EMPTY;
    }

    /**
     * Table from a list of entries, as stored in content JSON.
     *
     * @throws IllegalArgumentException if an item appears twice
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LootTable of(List<LootEntry> entries) {
        var builder = builder();
        for (var entry : entries) {
            builder.with(entry);
        }
        return builder.build();
    }

    /**
     * Number of trials every entry gets for one roll.
     */
    static int trials(int magicFind, RandomSource rng) {
        if (magicFind <= 0) {
            return 1;
        }
        int bonus = magicFind / 100;
        int chanceForExtra = magicFind % 100;
        if (chanceForExtra > 0 && rng.nextInt(1, 100) <= chanceForExtra) {
            bonus++;
        }
        return 1 + bonus;
    }

    /**
     * Roll every entry.
     *
     * @param magicFind magic find percentage; zero or negative means a single trial
     * @return drops in entry order, at most one per entry
     */
    public List<LootDrop> roll(int magicFind, RandomSource rng) {
        if (entries.isEmpty()) {
            return List.of();
        }
        int trials = trials(magicFind, rng);
        var drops = new ArrayList<LootDrop>();
        for (var entry : entries) {
            LootDrop best = null;
            for (int i = 0; i < trials; i++) {
                if (rng.nextInt(1, entry.denominator()) <= entry.numerator()) {
                    int quantity = rng.nextInt(entry.quantity());
                    if (best == null || quantity > best.quantity()) {
                        best = new LootDrop(entry.item(), quantity);
                    }
                }
            }
            if (best != null) {
                drops.add(best);
            }
        }
        log.debug("Rolled {} drops from {} entries with {} trials", drops.size(), entries.size(), trials);
        return drops;
    }

    @JsonValue
    public List<LootEntry> entries() {
        return entries;
    }

    public Optional<LootEntry> entryFor(ItemId item) {
        return entries.stream().filter(e -> e.item().equals(item)).findFirst();
    }

    public boolean contains(ItemId item) {
        return entryFor(item).isPresent();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LootTable other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "LootTable" + entries;
    }

    public static final class Builder {
        private final List<LootEntry> entries = new ArrayList<>();
        private final HashSet<ItemId> items   = new HashSet<>();

        private Builder() {
        }

        public Builder with(String item, int numerator, int denominator, IntRange quantity) {
            return with(new LootEntry(ItemId.of(item), numerator, denominator, quantity));
        }

        public Builder with(ItemId item, int numerator, int denominator, IntRange quantity) {
            return with(new LootEntry(item, numerator, denominator, quantity));
        }

        public Builder with(LootEntry entry) {
            if (!items.add(entry.item())) {
                throw new IllegalArgumentException("Item already in loot table: " + entry.item());
            }
            entries.add(entry);
            return this;
        }

        public LootTable build() {
            return entries.isEmpty() ? EMPTY : new LootTable(entries);
        }
    }
}
