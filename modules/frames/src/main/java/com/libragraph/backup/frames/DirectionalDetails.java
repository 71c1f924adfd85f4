package com.libragraph.backup.frames;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.libragraph.backup.types.DeliveryStatus;

import java.util.List;

/**
 * Who a chat item travelled from or to. Selects the restoring variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "direction")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DirectionalDetails.Incoming.class, name = "incoming"),
        @JsonSubTypes.Type(value = DirectionalDetails.Outgoing.class, name = "outgoing"),
        @JsonSubTypes.Type(value = DirectionalDetails.Directionless.class, name = "directionless")
})
public sealed interface DirectionalDetails {

    record Incoming(long dateReceived, boolean read) implements DirectionalDetails {}

    record Outgoing(List<SendStatus> sendStatuses) implements DirectionalDetails {
        public Outgoing {
            sendStatuses = sendStatuses == null ? List.of() : List.copyOf(sendStatuses);
        }
    }

    record Directionless() implements DirectionalDetails {}

    record SendStatus(long recipientId, DeliveryStatus status) {}

    static DirectionalDetails incoming(long dateReceived, boolean read) {
        return new Incoming(dateReceived, read);
    }

    static DirectionalDetails outgoing(List<SendStatus> sendStatuses) {
        return new Outgoing(sendStatuses);
    }

    static DirectionalDetails directionless() {
        return new Directionless();
    }
}
