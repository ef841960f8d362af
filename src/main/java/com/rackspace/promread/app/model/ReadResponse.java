package com.rackspace.promread.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ReadResponse {
  List<QueryResult> results = new ArrayList<>();

  /**
   * @return a response holding a single result group without any series
   */
  public static ReadResponse empty() {
    final ReadResponse response = new ReadResponse();
    response.getResults().add(new QueryResult());
    return response;
  }
}
