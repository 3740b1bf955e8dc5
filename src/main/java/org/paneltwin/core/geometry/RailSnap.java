package org.paneltwin.core.geometry;

/**
 * Result of quantizing a free position onto a mounting rail.
 *
 * @param railId rail the position was snapped to.
 * @param position snapped world position.
 * @param slot zero-based module slot along the rail.
 */
public record RailSnap(String railId, Vec3 position, int slot) {
}
