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

package com.rackspace.scoreboard.app.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.scoreboard.app.precalc.AggregateCategory;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PrecalcPropertiesTest {

  @Test
  void defaultTtlIsTwiceTheInterval() {
    final PrecalcProperties properties = new PrecalcProperties();

    assertThat(properties.settingsFor(AggregateCategory.EXAM_STATS).effectiveTtl())
        .isEqualTo(Duration.ofMinutes(60));
    assertThat(properties.settingsFor(AggregateCategory.CLASS_RANKINGS).effectiveTtl())
        .isEqualTo(Duration.ofMinutes(30));

    properties.getClassRankings().setTtl(Duration.ofMinutes(5));
    assertThat(properties.settingsFor(AggregateCategory.CLASS_RANKINGS).effectiveTtl())
        .isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void freshnessWindowAddsCycleSlack() {
    final PrecalcProperties properties = new PrecalcProperties();

    assertThat(properties.freshnessWindow(AggregateCategory.SUBJECT_ANALYTICS))
        .isEqualTo(Duration.ofMinutes(50));
    assertThat(properties.freshnessWindow(AggregateCategory.STUDENT_SUMMARIES))
        .isEqualTo(Duration.ofMinutes(65));
  }
}
