package com.rackspace.promread.app.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.promread.app.config.configValidator.ConcreteRegistryValidator;
import java.util.List;
import org.junit.jupiter.api.Test;

public class RegistryValidatorTest {

  @Test
  public void defaultsAreValid() {
    ConcreteRegistryValidator validator = new ConcreteRegistryValidator();
    assertThat(validator.isValid(new AppProperties(), null)).isTrue();
  }

  @Test
  public void systemDatabaseNotRegistered() {
    AppProperties properties = new AppProperties()
        .setDatabases(List.of("flow_log"))
        .setSystemDatabase("deepflow_system");

    ConcreteRegistryValidator validator = new ConcreteRegistryValidator();
    assertThat(validator.isValid(properties, null)).isFalse();
  }

  @Test
  public void nullDatabases() {
    ConcreteRegistryValidator validator = new ConcreteRegistryValidator();
    assertThat(validator.isValid(new AppProperties().setDatabases(null), null)).isTrue();
  }

  @Test
  public void translationSettingsCarryCaps() {
    AppProperties properties = new AppProperties().setRowLimit(20).setSeriesLimit(3);

    assertThat(properties.toTranslationSettings().getRowLimit()).isEqualTo(20);
    assertThat(properties.toTranslationSettings().getSeriesLimit()).isEqualTo(3);
    assertThat(properties.toTranslationSettings().getDatabases())
        .containsExactlyInAnyOrder("flow_log", "flow_metrics", "ext_metrics", "deepflow_system");
  }
}
