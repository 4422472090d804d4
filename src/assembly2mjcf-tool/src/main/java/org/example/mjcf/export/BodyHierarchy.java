package org.example.mjcf.export;

import java.util.List;

/**
 * Output of the hierarchy walk: the root body with all descendants nested in
 * it, and the actuators and sensors that mirror its joints, in walk order.
 */
public record BodyHierarchy(MjcfElement rootBody, List<MjcfElement> actuators, List<MjcfElement> sensors) {

    public BodyHierarchy {
        actuators = List.copyOf(actuators);
        sensors = List.copyOf(sensors);
    }
}
