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

package com.rackspace.promread.app.exceptions;

/**
 * Thrown when the querier cannot execute a statement or answers with a failure status.
 */
public class QuerierException extends RuntimeException {

  public QuerierException(String message) {
    super(message);
  }

  public QuerierException(String message, Throwable cause) {
    super(message, cause);
  }
}
