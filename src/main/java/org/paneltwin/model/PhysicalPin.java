package org.paneltwin.model;

import org.paneltwin.core.geometry.Vec3;

/**
 * World-space realization of a logical pin on one instance.
 *
 * @param ref store-wide pin address.
 * @param type electrical role copied from the logical pin.
 * @param offset position relative to the owning instance's physical position.
 * @param world absolute position; always {@code instance.physicalPosition + offset}.
 */
public record PhysicalPin(PinRef ref, PinType type, Vec3 offset, Vec3 world) {

    /**
     * Returns this pin re-anchored at a new instance position.
     */
    PhysicalPin anchoredAt(Vec3 instancePosition) {
        return new PhysicalPin(ref, type, offset, instancePosition.plus(offset));
    }
}
