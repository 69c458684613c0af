/*
 *  This file is part of hakemisto.
 *
 *  Hakemisto is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Hakemisto is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Hakemisto. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.hakemisto.service;

import com.dedicatedcode.hakemisto.model.FeatureId;

import java.util.Map;
import java.util.Set;

/**
 * Deletions and ranking boosts maintained next to the indices. Loaded once, never changed.
 * Applying it is up to whoever ranks results.
 */
public record HotfixOverlay(Set<FeatureId> deletes, Map<FeatureId, Integer> boosts) {

    public static final HotfixOverlay EMPTY = new HotfixOverlay(Set.of(), Map.of());

    public HotfixOverlay {
        deletes = Set.copyOf(deletes);
        boosts = Map.copyOf(boosts);
    }

    public boolean isDeleted(FeatureId id) {
        return deletes.contains(id);
    }

    public int boostFor(FeatureId id) {
        return boosts.getOrDefault(id, 0);
    }

    public boolean isEmpty() {
        return deletes.isEmpty() && boosts.isEmpty();
    }
}
