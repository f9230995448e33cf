/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cspheader.util;

import com.cspheader.ContentSecurityPolicy;
import com.cspheader.Directive;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Reads a {@link ContentSecurityPolicy} from a properties file.
 * <p>
 * Each key is a directive name and each value is its whitespace-separated source list, for example:
 * <pre>
 * default-src='self'
 * img-src='self' https://*.gravatar.com
 * object-src=
 * </pre>
 * An empty value is an empty source list, so {@code object-src} above becomes {@code object-src 'none';}.
 * Because properties files are unordered, directives are applied in {@link Directive} declaration order.
 *
 * @author <a href="http://revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class PolicyPropertiesReader {
  private static final Logger logger = Logger.getLogger(PolicyPropertiesReader.class.getName());
  private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

  private final Map<String, String> properties;

  public PolicyPropertiesReader(@NonNull Path propertiesFile) {
    requireNonNull(propertiesFile);
    this.properties = unmodifiableMap(new HashMap<>(loadPropertiesForPath(propertiesFile)));
  }

  public PolicyPropertiesReader(@NonNull Properties properties) {
    requireNonNull(properties);
    this.properties = unmodifiableMap(new HashMap<>(propertiesAsMap(properties)));
  }

  /**
   * Builds a new policy from the loaded properties.
   *
   * @return the policy
   * @throws IllegalArgumentException if any key is not a permitted directive name or any value contains CR/LF
   */
  @NonNull
  public ContentSecurityPolicy contentSecurityPolicy() {
    for (String key : properties().keySet())
      if (!Directive.fromName(key).isPresent())
        throw new IllegalArgumentException(format("Properties key '%s' is not a valid %s directive name",
          key, ContentSecurityPolicy.FIELD_NAME));

    ContentSecurityPolicy contentSecurityPolicy = new ContentSecurityPolicy();

    for (Directive directive : Directive.values()) {
      String value = properties().get(directive.getName());

      if (value == null)
        continue;

      value = value.trim();

      List<String> sources = value.isEmpty() ? List.of() : Arrays.asList(WHITESPACE_PATTERN.split(value));
      contentSecurityPolicy.setDirective(directive.getName(), sources);
    }

    if (logger.isLoggable(Level.FINE))
      logger.fine(format("Loaded %s", contentSecurityPolicy));

    return contentSecurityPolicy;
  }

  @NonNull
  protected Map<String, String> loadPropertiesForPath(@NonNull Path propertiesFile) {
    requireNonNull(propertiesFile);

    if (!Files.exists(propertiesFile))
      throw new IllegalArgumentException(
        format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

    if (!Files.isRegularFile(propertiesFile))
      throw new IllegalArgumentException(format("Properties file at %s is not a regular file",
        propertiesFile.toAbsolutePath()));

    Properties properties = new Properties();

    try (InputStream inputStream = Files.newInputStream(propertiesFile);
         Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException | IllegalArgumentException e) {
      throw new IllegalArgumentException(format("Invalid format for properties file at %s",
        propertiesFile.toAbsolutePath()), e);
    }

    return propertiesAsMap(properties);
  }

  @NonNull
  protected Map<String, String> propertiesAsMap(@NonNull Properties properties) {
    requireNonNull(properties);

    Map<String, String> propertiesMap = new HashMap<>();

    for (String key : properties.stringPropertyNames())
      propertiesMap.put(key.trim(), properties.getProperty(key));

    return propertiesMap;
  }

  @NonNull
  public Map<String, String> properties() {
    return this.properties;
  }
}
