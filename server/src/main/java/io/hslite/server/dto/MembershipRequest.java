// file: server/src/main/java/io/hslite/server/dto/MembershipRequest.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of invite, kick, ban and unban; join and leave may send an empty object. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MembershipRequest {
    @JsonProperty("user_id")
    public String userId;
    public String reason;
}
