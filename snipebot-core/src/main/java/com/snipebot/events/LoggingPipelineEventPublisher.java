package com.snipebot.events;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Logs every event and fans it out to registered listeners. A failing listener never affects the pipeline.
 */
@Slf4j
public class LoggingPipelineEventPublisher implements PipelineEventPublisher {

  private final List<Consumer<PipelineEvent>> listeners = new CopyOnWriteArrayList<>();

  @Override
  public void publish(PipelineEvent event) {
    if (event instanceof PipelineEvent.FeedPublished feed) {
      // item payloads are large; keep them out of the log
      log.debug("event {} cycle={} endpoints={} items={} new={}",
          event.type(), feed.cycle(), feed.endpointCount(), feed.items().size(), feed.newItemCount());
    } else {
      log.info("event {} {}", event.type(), event);
    }

    for (Consumer<PipelineEvent> listener : listeners) {
      try {
        listener.accept(event);
      } catch (Exception e) {
        log.warn("event listener failed for {}: {}", event.type(), e.toString());
      }
    }
  }

  @Override
  public void addListener(Consumer<PipelineEvent> listener) {
    listeners.add(listener);
  }
}
