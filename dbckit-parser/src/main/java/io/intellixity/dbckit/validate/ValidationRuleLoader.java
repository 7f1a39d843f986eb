package io.intellixity.dbckit.validate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Finds extra {@link ValidationRule}s on the classpath.\n
 *
 * Every {@code META-INF/dbckit.factories} resource is read as a properties file; the value of
 * {@code io.intellixity.dbckit.validate.ValidationRule} lists rule classes separated by commas.\n
 *
 * <pre>\n
 * io.intellixity.dbckit.validate.ValidationRule=com.acme.dbc.J1939NamingRule,com.acme.dbc.CycleTimeRule\n
 * </pre>\n
 *
 * A rule listed by several resources runs once, in the position of its first listing. A listed class that
 * is missing, is not a rule or has no public no-arg constructor fails with the resource that named it.\n
 */
final class ValidationRuleLoader {
  static final String RESOURCE = "META-INF/dbckit.factories";
  static final String KEY = ValidationRule.class.getName();

  private static final Logger log = LoggerFactory.getLogger(ValidationRuleLoader.class);

  private ValidationRuleLoader() {}

  static List<ValidationRule> load(ClassLoader cl) {
    if (cl == null) cl = ValidationRuleLoader.class.getClassLoader();

    Map<String, URL> listedBy = new LinkedHashMap<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      for (String name : ruleNames(read(url))) listedBy.putIfAbsent(name, url);
    }

    List<ValidationRule> rules = new ArrayList<>(listedBy.size());
    for (Map.Entry<String, URL> e : listedBy.entrySet()) {
      rules.add(instantiate(e.getKey(), e.getValue(), cl));
      if (log.isDebugEnabled()) log.debug("dbckit.rule_discovered rule={} source={}", e.getKey(), e.getValue());
    }
    return rules;
  }

  /** Rule class names listed under {@link #KEY}, blanks dropped. */
  static List<String> ruleNames(Properties p) {
    String value = p.getProperty(KEY);
    if (value == null || value.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : value.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) out.add(name);
    }
    return out;
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + url, e);
    }
    return p;
  }

  private static ValidationRule instantiate(String name, URL source, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Validation rule " + name + " listed in " + source + " is not on the classpath", e);
    }
    if (!ValidationRule.class.isAssignableFrom(type)) {
      throw new IllegalStateException(name + " listed in " + source + " does not implement " + KEY);
    }
    try {
      return (ValidationRule) type.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate validation rule " + name + " listed in " + source, e);
    }
  }
}
