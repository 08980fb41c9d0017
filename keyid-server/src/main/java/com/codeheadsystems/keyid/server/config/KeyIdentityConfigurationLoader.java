package com.codeheadsystems.keyid.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link KeyIdentityConfiguration} from YAML and validates its constraints.
 * <p>
 * Unknown keys are rejected so that a misspelled setting fails at startup instead of silently
 * falling back to its default.
 */
public class KeyIdentityConfigurationLoader {

  private static final Logger log = LoggerFactory.getLogger(KeyIdentityConfigurationLoader.class);

  private final ObjectMapper mapper;
  private final Validator validator;

  public KeyIdentityConfigurationLoader() {
    this.mapper = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
    try (ValidatorFactory factory = Validation.byDefaultProvider()
        .configure()
        .messageInterpolator(new ParameterMessageInterpolator())
        .buildValidatorFactory()) {
      this.validator = factory.getValidator();
    }
  }

  /**
   * Loads and validates configuration from a YAML stream. An empty document yields the defaults.
   *
   * @throws IllegalArgumentException if the YAML is malformed or a constraint is violated
   */
  public KeyIdentityConfiguration load(InputStream in) {
    KeyIdentityConfiguration configuration;
    try {
      JsonNode tree = mapper.readTree(in);
      if (tree == null || tree.isMissingNode() || tree.isNull()) {
        configuration = new KeyIdentityConfiguration();
      } else {
        configuration = mapper.treeToValue(tree, KeyIdentityConfiguration.class);
      }
    } catch (IOException e) {
      throw new IllegalArgumentException("Unreadable key identity configuration: " + e.getMessage(), e);
    }
    return validate(configuration);
  }

  public KeyIdentityConfiguration load(Path path) {
    log.debug("Loading key identity configuration from {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + path, e);
    }
  }

  /**
   * Loads configuration from a classpath resource.
   *
   * @param resource resource name, resolved against the class loader root
   */
  public KeyIdentityConfiguration loadResource(String resource) {
    InputStream in = KeyIdentityConfigurationLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new IllegalArgumentException("Configuration resource not found: " + resource);
    }
    try (in) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + resource, e);
    }
  }

  /**
   * Checks the bean constraints of an already built configuration.
   *
   * @return the same configuration
   * @throws IllegalArgumentException listing every violation
   */
  public KeyIdentityConfiguration validate(KeyIdentityConfiguration configuration) {
    Set<ConstraintViolation<KeyIdentityConfiguration>> violations = validator.validate(configuration);
    if (!violations.isEmpty()) {
      String details = violations.stream()
          .map(v -> v.getPropertyPath() + " " + v.getMessage())
          .sorted(Comparator.naturalOrder())
          .collect(Collectors.joining(", "));
      throw new IllegalArgumentException("Invalid key identity configuration: " + details);
    }
    return configuration;
  }
}
