// file: server/src/main/java/io/hslite/server/dto/CreateRoomResponse.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CreateRoomResponse {
    @JsonProperty("room_id")
    public String roomId;
}
