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

package com.rackspace.promread.app.web;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import com.rackspace.promread.app.model.Label;
import com.rackspace.promread.app.model.LabelMatcher;
import com.rackspace.promread.app.model.MatchType;
import com.rackspace.promread.app.model.QueryResult;
import com.rackspace.promread.app.model.ReadQuery;
import com.rackspace.promread.app.model.ReadRequest;
import com.rackspace.promread.app.model.ReadResponse;
import com.rackspace.promread.app.model.Sample;
import com.rackspace.promread.app.model.TimeSeries;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.xerial.snappy.Snappy;

/**
 * Reads and writes the snappy compressed protobuf bodies of the Prometheus remote read
 * protocol. Fields that are not needed to answer a read, such as query hints and accepted
 * response types, are skipped.
 */
public class RemoteReadCodec {

  // ReadRequest
  private static final int TAG_QUERIES = tag(1, WireFormat.WIRETYPE_LENGTH_DELIMITED);
  // Query
  private static final int TAG_START_MS = tag(1, WireFormat.WIRETYPE_VARINT);
  private static final int TAG_END_MS = tag(2, WireFormat.WIRETYPE_VARINT);
  private static final int TAG_MATCHERS = tag(3, WireFormat.WIRETYPE_LENGTH_DELIMITED);
  // LabelMatcher
  private static final int TAG_MATCHER_TYPE = tag(1, WireFormat.WIRETYPE_VARINT);
  private static final int TAG_MATCHER_NAME = tag(2, WireFormat.WIRETYPE_LENGTH_DELIMITED);
  private static final int TAG_MATCHER_VALUE = tag(3, WireFormat.WIRETYPE_LENGTH_DELIMITED);

  /**
   * @throws IllegalArgumentException when the body is not a snappy compressed read request
   */
  public static ReadRequest decodeRequest(byte[] compressed) {
    if (compressed == null || compressed.length == 0) {
      throw new IllegalArgumentException("Remote read request body is empty");
    }
    try {
      return readRequest(CodedInputStream.newInstance(Snappy.uncompress(compressed)));
    } catch (IOException e) {
      throw new IllegalArgumentException("Remote read request body is malformed", e);
    }
  }

  public static byte[] encodeResponse(ReadResponse response) {
    try {
      return Snappy.compress(toBytes(out -> {
        for (QueryResult result : response.getResults()) {
          out.writeByteArray(1, toBytes(resultOut -> writeQueryResult(resultOut, result)));
        }
      }));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to encode remote read response", e);
    }
  }

  private static ReadRequest readRequest(CodedInputStream input) throws IOException {
    final ReadRequest request = new ReadRequest();
    while (!input.isAtEnd()) {
      final int tag = input.readTag();
      if (tag == TAG_QUERIES) {
        final int limit = input.pushLimit(input.readRawVarint32());
        request.getQueries().add(readQuery(input));
        input.popLimit(limit);
      } else {
        input.skipField(tag);
      }
    }
    return request;
  }

  private static ReadQuery readQuery(CodedInputStream input) throws IOException {
    final ReadQuery query = new ReadQuery();
    while (!input.isAtEnd()) {
      final int tag = input.readTag();
      if (tag == TAG_START_MS) {
        query.setStartTimestampMs(input.readInt64());
      } else if (tag == TAG_END_MS) {
        query.setEndTimestampMs(input.readInt64());
      } else if (tag == TAG_MATCHERS) {
        final int limit = input.pushLimit(input.readRawVarint32());
        query.getMatchers().add(readMatcher(input));
        input.popLimit(limit);
      } else {
        input.skipField(tag);
      }
    }
    return query;
  }

  private static LabelMatcher readMatcher(CodedInputStream input) throws IOException {
    // proto3 omits the default EQ type
    final LabelMatcher matcher = new LabelMatcher(MatchType.EQ, "", "");
    while (!input.isAtEnd()) {
      final int tag = input.readTag();
      if (tag == TAG_MATCHER_TYPE) {
        // unknown operators stay null and are rejected when the matcher is compiled
        matcher.setType(MatchType.forNumber(input.readEnum()));
      } else if (tag == TAG_MATCHER_NAME) {
        matcher.setName(input.readStringRequireUtf8());
      } else if (tag == TAG_MATCHER_VALUE) {
        matcher.setValue(input.readStringRequireUtf8());
      } else {
        input.skipField(tag);
      }
    }
    return matcher;
  }

  private static void writeQueryResult(CodedOutputStream out, QueryResult result)
      throws IOException {
    for (TimeSeries series : result.getTimeseries()) {
      out.writeByteArray(1, toBytes(seriesOut -> writeTimeSeries(seriesOut, series)));
    }
  }

  private static void writeTimeSeries(CodedOutputStream out, TimeSeries series)
      throws IOException {
    for (Label label : series.getLabels()) {
      out.writeByteArray(1, toBytes(labelOut -> {
        labelOut.writeString(1, label.getName());
        labelOut.writeString(2, label.getValue());
      }));
    }
    for (Sample sample : series.getSamples()) {
      out.writeByteArray(2, toBytes(sampleOut -> {
        sampleOut.writeDouble(1, sample.getValue());
        sampleOut.writeInt64(2, sample.getTimestamp());
      }));
    }
  }

  private static byte[] toBytes(MessageWriter writer) throws IOException {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final CodedOutputStream out = CodedOutputStream.newInstance(bytes);
    writer.write(out);
    out.flush();
    return bytes.toByteArray();
  }

  private static int tag(int fieldNumber, int wireType) {
    return (fieldNumber << 3) | wireType;
  }

  @FunctionalInterface
  private interface MessageWriter {
    void write(CodedOutputStream out) throws IOException;
  }
}
