package com.snipebot.listing;

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Insertion-ordered id set that forgets its oldest entries: once it grows past {@code maxSize} it is trimmed
 * back to the {@code retain} most recently added ids. Not thread-safe.
 */
public final class RecentlySeenIds {

  private final int maxSize;
  private final int retain;
  private final LinkedHashSet<Long> ids = new LinkedHashSet<>();

  public RecentlySeenIds(int maxSize, int retain) {
    if (maxSize < 1 || retain < 1 || retain > maxSize) {
      throw new IllegalArgumentException("require 1 <= retain <= maxSize, got retain=%d maxSize=%d"
          .formatted(retain, maxSize));
    }
    this.maxSize = maxSize;
    this.retain = retain;
  }

  /**
   * @return true when the id had not been seen (or had been forgotten)
   */
  public boolean add(long id) {
    boolean added = ids.add(id);
    if (ids.size() > maxSize) {
      trim();
    }
    return added;
  }

  public boolean contains(long id) {
    return ids.contains(id);
  }

  public int size() {
    return ids.size();
  }

  private void trim() {
    int drop = ids.size() - retain;
    Iterator<Long> it = ids.iterator();
    while (drop-- > 0 && it.hasNext()) {
      it.next();
      it.remove();
    }
  }
}
