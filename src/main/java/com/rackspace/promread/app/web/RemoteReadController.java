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

import com.rackspace.promread.app.services.RemoteReadService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Prometheus remote read endpoint, configured in Prometheus as
 * <code>remote_read: [{url: http://host:port/prom/api/v1/read}]</code>.
 */
@RestController
@RequestMapping("/prom/api/v1")
public class RemoteReadController {

  static final MediaType PROTOBUF = MediaType.parseMediaType("application/x-protobuf");
  static final String SNAPPY = "snappy";

  private final RemoteReadService remoteReadService;
  private final Counter remoteReadCounter;

  @Autowired
  public RemoteReadController(RemoteReadService remoteReadService, MeterRegistry meterRegistry) {
    this.remoteReadService = remoteReadService;
    this.remoteReadCounter = meterRegistry.counter("promread.requests", "type", "read");
  }

  @PostMapping("/read")
  public Mono<ResponseEntity<byte[]>> read(@RequestBody byte[] body) {
    remoteReadCounter.increment();
    return Mono.fromCallable(() -> RemoteReadCodec.decodeRequest(body))
        .flatMap(remoteReadService::read)
        .map(response -> ResponseEntity.ok()
            .contentType(PROTOBUF)
            .header(HttpHeaders.CONTENT_ENCODING, SNAPPY)
            .body(RemoteReadCodec.encodeResponse(response)));
  }
}
