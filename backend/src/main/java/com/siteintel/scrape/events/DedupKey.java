package com.siteintel.scrape.events;

public record DedupKey(
    String type,
    String source,
    long coarseTimestamp
) {
    public static DedupKey forEvent(ProgressEvent event) {
        long millis = event.timestamp() == null ? 0L : event.timestamp().toEpochMilli();
        return new DedupKey(event.type().wireName(), event.sourceId(), millis);
    }

    /**
     * Notifications are matched on text and level alone; their cache window does the time bucketing.
     */
    public static DedupKey forNotification(String message, String notificationType) {
        return new DedupKey(notificationType, message, 0L);
    }
}
