// file: server/src/main/java/io/hslite/server/dto/RedactRequest.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RedactRequest {
    public String reason;
}
