// file: server/src/main/java/io/hslite/server/dto/EventIdResponse.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class EventIdResponse {
    @JsonProperty("event_id")
    public String eventId;
}
