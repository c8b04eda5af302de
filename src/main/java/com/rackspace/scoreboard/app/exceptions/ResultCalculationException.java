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

package com.rackspace.scoreboard.app.exceptions;

/**
 * Thrown when a result cannot be calculated because its exam or attempt is missing.
 */
public class ResultCalculationException extends RuntimeException {
  public ResultCalculationException(String message) {
    super(message);
  }

  public ResultCalculationException(String message, Throwable cause) {
    super(message, cause);
  }
}
