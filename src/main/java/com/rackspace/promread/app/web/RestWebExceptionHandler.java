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

import com.rackspace.promread.app.exceptions.NoMetricSelectedException;
import com.rackspace.promread.app.exceptions.UnknownMetricException;
import com.rackspace.promread.app.exceptions.UnsupportedMatcherTypeException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.error.ErrorAttributeOptions.Include;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@Order(-2)//So that our exception handler gets picked before DefaultErrorWebExceptionHandler
public class RestWebExceptionHandler extends
    AbstractErrorWebExceptionHandler {

  /**
   * Failures caused by what the client asked for. Everything else is reported as a server error.
   */
  private static final List<Class<? extends Throwable>> BAD_REQUEST_ERRORS = List.of(
      IllegalArgumentException.class,
      ServerWebInputException.class,
      TypeMismatchException.class,
      UnknownMetricException.class,
      UnsupportedMatcherTypeException.class,
      NoMetricSelectedException.class
  );

  public RestWebExceptionHandler(
      ErrorAttributes errorAttributes,
      WebProperties webProperties,
      ApplicationContext applicationContext,
      ServerCodecConfigurer serverCodecConfigurer) {
    super(errorAttributes, webProperties.getResources(), applicationContext);
    this.setMessageWriters(serverCodecConfigurer.getWriters());
  }

  @Override
  protected RouterFunction<ServerResponse> getRoutingFunction(
      ErrorAttributes errorAttributes) {
    return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
  }

  /**
   * Renders the error response.
   */
  private Mono<ServerResponse> renderErrorResponse(ServerRequest serverRequest) {
    Map<String, Object> body = getErrorAttributes(serverRequest, ErrorAttributeOptions.of(
        Include.EXCEPTION, Include.MESSAGE, Include.STACK_TRACE));
    final Throwable error = getError(serverRequest);
    final boolean badRequest = isBadRequest(error);
    logErrorMessage(serverRequest, (String) body.get("trace"), badRequest);
    body.remove("trace");
    return badRequest ? respondWithBadRequest(body) : respondWithServerError(body);
  }

  static boolean isBadRequest(Throwable error) {
    return BAD_REQUEST_ERRORS.stream().anyMatch(type -> type.isInstance(error));
  }

  private Mono<ServerResponse> respondWithServerError(Map<String, Object> body) {
    body.put("message", "Service encountered an unexpected "
        + "condition which prevented it from fulfilling the request.");
    return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(body));
  }

  private Mono<ServerResponse> respondWithBadRequest(Map<String, Object> body) {
    body.remove("error");
    body.put("status", HttpStatus.BAD_REQUEST.value());
    return ServerResponse.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(body));
  }

  private void logErrorMessage(ServerRequest serverRequest, String stackTrace,
                               boolean badRequest) {
    if (badRequest) {
      // avoid logs cluttering for bad requests
      log.debug("Web request for uri {} failed with exception {}", serverRequest.uri(),
          stackTrace);
      return;
    }
    log.warn("Web request for uri {} failed with exception {}", serverRequest.uri(), stackTrace);
  }
}
