// file: server/src/main/java/io/hslite/server/dto/MessagesResponse.java
package io.hslite.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessagesResponse {
    public List<ObjectNode> chunk;
    public String start;
    public String end;
    /** Events known to be missing from this room's history. */
    public List<String> gaps;
}
