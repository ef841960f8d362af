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

package com.rackspace.promread.app.services;

import com.rackspace.promread.app.model.TimeSeries;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Value;

/**
 * Groups decoded rows into series by fingerprint. The first {@code seriesLimit} distinct
 * fingerprints are admitted, later fingerprints are rejected while already admitted ones keep
 * accepting samples.
 */
public class SeriesAccumulator {

  private final int seriesLimit;
  private final Map<String, TimeSeries> series = new LinkedHashMap<>();
  @Getter
  private long rejectedRows;

  public SeriesAccumulator(int seriesLimit) {
    this.seriesLimit = seriesLimit;
  }

  public Admission admit(String key) {
    final TimeSeries existing = series.get(key);
    if (existing != null) {
      return new Admission(existing, true, false);
    }
    if (series.size() >= seriesLimit) {
      rejectedRows++;
      return new Admission(null, false, false);
    }
    final TimeSeries created = new TimeSeries();
    series.put(key, created);
    return new Admission(created, true, true);
  }

  public int size() {
    return series.size();
  }

  public List<TimeSeries> getSeries() {
    return new ArrayList<>(series.values());
  }

  @Value
  public static class Admission {
    /**
     * The series to append to, <code>null</code> when rejected.
     */
    TimeSeries series;
    boolean admitted;
    /**
     * Set on the first admission of a key, when the series still needs its labels.
     */
    boolean created;
  }
}
