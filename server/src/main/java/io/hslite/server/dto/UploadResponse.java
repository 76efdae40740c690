// file: server/src/main/java/io/hslite/server/dto/UploadResponse.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class UploadResponse {
    @JsonProperty("content_uri")
    public String contentUri;
}
