//
// Copyright 2026 The Parley Authors
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.grcorsair.parley.config;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Engine settings. Values come from {@code parley.properties} on the classpath, then an optional
 * override file, then {@code parley.*} system properties; later sources win.
 */
public final class ParleyConfig {
  public static final String RESOURCE_NAME = "parley.properties";

  public static final String KEY_DIRECTORY = "parley.keyDirectory";
  public static final String LOG_ID = "parley.logId";
  public static final String CANONICAL_ISSUERS = "parley.canonicalIssuers";
  public static final String RESOLVER_TIMEOUT_MILLIS = "parley.resolver.timeoutMillis";
  public static final String RESOLVER_ALLOW_PRIVATE_HOSTS = "parley.resolver.allowPrivateHosts";
  public static final String CREDENTIAL_VALIDITY_DAYS = "parley.credential.validityDays";
  public static final String LOG_MAX_WRITE_ATTEMPTS = "parley.log.maxWriteAttempts";

  private static final Logger logger = Logger.getLogger(ParleyConfig.class.getName());

  private final Properties properties;

  private ParleyConfig(Properties properties) {
    this.properties = properties;
  }

  /** Defaults only, ignoring the classpath and system properties. */
  public static ParleyConfig defaults() {
    return new ParleyConfig(new Properties());
  }

  public static ParleyConfig fromProperties(Properties properties) {
    Properties copy = new Properties();
    copy.putAll(properties);
    return new ParleyConfig(copy);
  }

  /** Classpath resource overridden by system properties. */
  public static ParleyConfig load() throws IOException {
    return load(Optional.empty());
  }

  /**
   * Classpath resource, overridden by {@code overrideFile} when present, overridden by system
   * properties.
   *
   * @throws IOException if a source exists but cannot be read
   */
  public static ParleyConfig load(Optional<Path> overrideFile) throws IOException {
    Properties properties = new Properties();
    try (InputStream in = ParleyConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
      if (in != null) {
        properties.load(in);
      }
    }
    if (overrideFile.isPresent()) {
      try (Reader reader = Files.newBufferedReader(overrideFile.get(), StandardCharsets.UTF_8)) {
        properties.load(reader);
      }
      logger.fine("Loaded configuration overrides from " + overrideFile.get());
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith("parley.")) {
        properties.setProperty(name, System.getProperty(name));
      }
    }
    return new ParleyConfig(properties);
  }

  /** Directory holding the signing keypair, if configured. */
  public Optional<Path> getKeyDirectory() {
    return Optional.ofNullable(value(KEY_DIRECTORY)).map(Path::of);
  }

  public String getLogId() {
    return Optional.ofNullable(value(LOG_ID)).orElse("corsair-scitt-log");
  }

  /** Issuer DIDs whose verified credentials rank as primary-issuer-verified. */
  public Set<String> getCanonicalIssuers() {
    String issuers = Optional.ofNullable(value(CANONICAL_ISSUERS)).orElse("did:web:grcorsair.com");
    return ImmutableSet.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(issuers));
  }

  public Duration getResolverTimeout() {
    return Duration.ofMillis(positiveLong(RESOLVER_TIMEOUT_MILLIS, 5000));
  }

  public boolean allowPrivateHosts() {
    return Boolean.parseBoolean(Optional.ofNullable(value(RESOLVER_ALLOW_PRIVATE_HOSTS))
        .orElse("false"));
  }

  public Duration getCredentialValidity() {
    return Duration.ofDays(positiveLong(CREDENTIAL_VALIDITY_DAYS, 90));
  }

  public int getMaxWriteAttempts() {
    return (int) positiveLong(LOG_MAX_WRITE_ATTEMPTS, 3);
  }

  private String value(String name) {
    String value = properties.getProperty(name);
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  /** @throws IllegalArgumentException if the value is set but not a positive integer */
  private long positiveLong(String name, long defaultValue) {
    String value = value(name);
    if (value == null) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not a number: " + value, e);
    }
    if (parsed <= 0) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
    return parsed;
  }
}
