/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.scoreboard.app.ranking;

import static java.util.Comparator.comparingDouble;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsLast;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders ranked entries into a leaderboard. Ordering, from the first criterion to the last:
 * <ol>
 *   <li>higher total marks</li>
 *   <li>higher recent performance, where a missing value counts as zero</li>
 *   <li>shorter completion duration, entries without one after all entries with one</li>
 *   <li>ascending tie-break key by plain string comparison, entries without one last</li>
 * </ol>
 * Entries equal on every criterion keep their input order.
 */
public final class RankingEngine {

  public static final Comparator<RankedEntry> STANDING_ORDER =
      comparingDouble(RankedEntry::getTotalMarks).reversed()
          .thenComparing(comparingDouble(RankingEngine::recentOrZero).reversed())
          .thenComparing(RankedEntry::getCompletionDurationMs, nullsLast(naturalOrder()))
          .thenComparing(RankedEntry::getTiebreakKey, nullsLast(naturalOrder()));

  private RankingEngine() {
  }

  /**
   * Returns a new list with the entries in standing order. The input is not modified.
   */
  public static List<RankedEntry> rank(List<RankedEntry> entries) {
    final List<RankedEntry> ordered = new ArrayList<>(entries);
    // List.sort is stable
    ordered.sort(STANDING_ORDER);
    return ordered;
  }

  /**
   * Ranks the entries and numbers them from 1. Ranks are sequential, so entries tied on
   * every criterion still receive distinct ranks.
   */
  public static List<Standing> leaderboard(List<RankedEntry> entries) {
    final List<RankedEntry> ordered = rank(entries);
    final List<Standing> standings = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      standings.add(new Standing(i + 1, ordered.get(i)));
    }
    return standings;
  }

  private static double recentOrZero(RankedEntry entry) {
    return entry.getRecentPerformance() != null ? entry.getRecentPerformance() : 0;
  }
}
