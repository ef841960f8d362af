package com.rackspace.promread.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class TimeSeries {
  List<Label> labels = new ArrayList<>();
  // kept in row order, not sorted by timestamp
  List<Sample> samples = new ArrayList<>();
}
