package org.waabox.mailrelay;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a changed item qualifies for forwarding, based on the
 * tags it currently carries.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TagPredicate {

  /**
   * Tests the item's current tags.
   *
   * @param tags the tags the item carries, never null
   * @return true if the item should be forwarded
   */
  boolean qualifies(Set<String> tags);

  /**
   * Returns a predicate that accepts every item.
   *
   * @return the predicate, never null
   */
  static TagPredicate acceptAll() {
    return tags -> true;
  }

  /**
   * Returns a predicate that accepts items carrying every one of the given
   * tags. An empty collection accepts every item.
   *
   * @param required the tags that must all be present, never null
   * @return the predicate, never null
   */
  static TagPredicate requireAll(final Collection<String> required) {
    Objects.requireNonNull(required, "required must not be null");
    final Set<String> copy = Set.copyOf(required);
    return tags -> tags.containsAll(copy);
  }
}
