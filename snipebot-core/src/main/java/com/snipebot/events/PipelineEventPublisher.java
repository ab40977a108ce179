package com.snipebot.events;

import java.util.function.Consumer;

public interface PipelineEventPublisher {

  void publish(PipelineEvent event);

  void addListener(Consumer<PipelineEvent> listener);

  static PipelineEventPublisher noop() {
    return new PipelineEventPublisher() {
      @Override
      public void publish(PipelineEvent event) {
      }

      @Override
      public void addListener(Consumer<PipelineEvent> listener) {
      }
    };
  }
}
