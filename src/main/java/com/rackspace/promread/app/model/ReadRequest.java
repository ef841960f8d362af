package com.rackspace.promread.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ReadRequest {
  List<ReadQuery> queries = new ArrayList<>();
}
