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

package com.rackspace.scoreboard.app.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GradesTest {

  @ParameterizedTest
  @CsvSource({
      "100, A+",
      "90, A+",
      "89.99, A",
      "80, A",
      "75, B+",
      "74.9, B",
      "70, B",
      "60, C",
      "50, D",
      "49.99, F",
      "0, F"
  })
  void forResult(double percentage, String expected) {
    assertThat(Grades.forResult(percentage)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({
      "95, A+",
      "83.33, A",
      "77, B",
      "65, C",
      "55, D",
      "10, F"
  })
  void forAverage(double average, String expected) {
    assertThat(Grades.forAverage(average)).isEqualTo(expected);
  }
}
