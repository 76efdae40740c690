// file: server/src/main/java/io/hslite/server/timeline/TimelineEntry.java
package io.hslite.server.timeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hslite.core.RoomEvent;

/**
 * One event in timeline order.
 *
 * @param clientJson event as clients see it, with redactions applied
 */
public record TimelineEntry(long streamPos, RoomEvent event, ObjectNode clientJson) {}
