// file: server/src/main/java/io/hslite/server/dto/CreateRoomRequest.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateRoomRequest {
    @JsonProperty("room_version")
    public String roomVersion;
    public String preset;
    public String name;
    public String topic;
    public List<String> invite;
}
