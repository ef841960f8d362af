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

package com.rackspace.promread.app.config.configValidator;

import com.rackspace.promread.app.config.AppProperties;
import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

public class ConcreteRegistryValidator implements
    ConstraintValidator<RegistryValidator, AppProperties> {

  @Override
  public boolean isValid(AppProperties properties, ConstraintValidatorContext context) {
    if (properties == null || properties.getDatabases() == null
        || properties.getSystemDatabase() == null) {
      // @NotNull on the fields reports these
      return true;
    }
    return properties.getDatabases().contains(properties.getSystemDatabase());
  }
}
