package com.airmonitor.common.dto.live;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Frame pushed to a live feed observer.
 * Jackson writes the {@code type} field to tell snapshots from updates.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SnapshotMessage.class, name = "snapshot"),
    @JsonSubTypes.Type(value = UpdateMessage.class, name = "update")
})
public sealed interface LiveMessage permits SnapshotMessage, UpdateMessage {

    /**
     * Device the observer subscribed to.
     */
    String deviceId();
}
