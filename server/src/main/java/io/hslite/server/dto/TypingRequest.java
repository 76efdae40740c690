// file: server/src/main/java/io/hslite/server/dto/TypingRequest.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TypingRequest {
    public boolean typing;
    public Long timeout;
}
