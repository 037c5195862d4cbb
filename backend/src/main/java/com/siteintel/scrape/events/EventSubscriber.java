package com.siteintel.scrape.events;

@FunctionalInterface
public interface EventSubscriber {

    void onEvent(ProgressEvent event);
}
