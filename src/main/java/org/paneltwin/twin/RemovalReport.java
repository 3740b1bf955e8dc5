package org.paneltwin.twin;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything a single component removal took with it.
 */
@Value
@Builder
public class RemovalReport {
    String instanceId;
    @Singular
    List<String> removedConnectionIds;
    @Singular
    List<String> removedWireIds;
}
