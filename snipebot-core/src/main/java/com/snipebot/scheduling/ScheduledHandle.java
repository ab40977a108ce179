package com.snipebot.scheduling;

public interface ScheduledHandle {

  /**
   * Prevent the task from running.
   *
   * @return true when the task was still pending and will now never run
   */
  boolean cancel();

  boolean isPending();
}
