package com.rackspace.promread.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ResultSet {
  List<String> columns = new ArrayList<>();
  List<ValueType> schemas = new ArrayList<>();
  List<List<Cell>> values = new ArrayList<>();
}
