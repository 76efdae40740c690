// file: server/src/main/java/io/hslite/server/timeline/TimelinePage.java
package io.hslite.server.timeline;

import java.util.List;
import java.util.Set;

/**
 * @param end   token to continue paginating in the same direction; null when exhausted
 * @param gaps  ids of missing events that backfill could not fetch
 */
public record TimelinePage(List<TimelineEntry> events, PaginationToken start, PaginationToken end, Set<String> gaps) {

    public TimelinePage {
        events = List.copyOf(events);
        gaps = Set.copyOf(gaps);
    }
}
