package org.hypertrace.core.report.query.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Holds the named params that need to be bound on the statement before the compiled report query
 * is executed
 */
public class Params {

  // Map of param name to the corresponding param value
  private final Map<String, Long> longParams;
  private final Map<String, Double> doubleParams;
  private final Map<String, String> stringParams;
  private final Map<String, Boolean> booleanParams;
  private final Set<String> names;

  private Params(
      Map<String, Long> longParams,
      Map<String, Double> doubleParams,
      Map<String, String> stringParams,
      Map<String, Boolean> booleanParams,
      Set<String> names) {
    this.longParams = longParams;
    this.doubleParams = doubleParams;
    this.stringParams = stringParams;
    this.booleanParams = booleanParams;
    this.names = names;
  }

  public Map<String, Long> getLongParams() {
    return longParams;
  }

  public Map<String, Double> getDoubleParams() {
    return doubleParams;
  }

  public Map<String, String> getStringParams() {
    return stringParams;
  }

  public Map<String, Boolean> getBooleanParams() {
    return booleanParams;
  }

  /** Param names in the order they were bound. */
  public Set<String> getNames() {
    return names;
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  public Object getValue(String name) {
    if (longParams.containsKey(name)) {
      return longParams.get(name);
    }
    if (doubleParams.containsKey(name)) {
      return doubleParams.get(name);
    }
    if (booleanParams.containsKey(name)) {
      return booleanParams.get(name);
    }
    return stringParams.get(name);
  }

  public int size() {
    return names.size();
  }

  @Override
  public String toString() {
    return "Params{" +
        "longParams=" + longParams +
        ", doubleParams=" + doubleParams +
        ", stringParams=" + stringParams +
        ", booleanParams=" + booleanParams +
        '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    Params params = (Params) o;

    if (!longParams.equals(params.longParams)) {
      return false;
    }
    if (!doubleParams.equals(params.doubleParams)) {
      return false;
    }
    if (!stringParams.equals(params.stringParams)) {
      return false;
    }
    return booleanParams.equals(params.booleanParams);
  }

  @Override
  public int hashCode() {
    int result = longParams.hashCode();
    result = 31 * result + doubleParams.hashCode();
    result = 31 * result + stringParams.hashCode();
    result = 31 * result + booleanParams.hashCode();
    return result;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Binding a name a second time replaces its earlier value, whatever its type was. */
  public static class Builder {

    private final Map<String, Long> longParams;
    private final Map<String, Double> doubleParams;
    private final Map<String, String> stringParams;
    private final Map<String, Boolean> booleanParams;
    private final Set<String> names;

    private Builder() {
      longParams = new LinkedHashMap<>();
      doubleParams = new LinkedHashMap<>();
      stringParams = new LinkedHashMap<>();
      booleanParams = new LinkedHashMap<>();
      names = new LinkedHashSet<>();
    }

    public Builder addLongParam(String name, long paramValue) {
      remove(name);
      longParams.put(name, paramValue);
      return this;
    }

    public Builder addDoubleParam(String name, double paramValue) {
      remove(name);
      doubleParams.put(name, paramValue);
      return this;
    }

    public Builder addStringParam(String name, String paramValue) {
      remove(name);
      stringParams.put(name, paramValue);
      return this;
    }

    public Builder addBooleanParam(String name, boolean paramValue) {
      remove(name);
      booleanParams.put(name, paramValue);
      return this;
    }

    private void remove(String name) {
      longParams.remove(name);
      doubleParams.remove(name);
      stringParams.remove(name);
      booleanParams.remove(name);
      names.remove(name);
      names.add(name);
    }

    Builder copy() {
      Builder copy = new Builder();
      copy.longParams.putAll(longParams);
      copy.doubleParams.putAll(doubleParams);
      copy.stringParams.putAll(stringParams);
      copy.booleanParams.putAll(booleanParams);
      copy.names.addAll(names);
      return copy;
    }

    public Params build() {
      return new Params(
          Collections.unmodifiableMap(new LinkedHashMap<>(longParams)),
          Collections.unmodifiableMap(new LinkedHashMap<>(doubleParams)),
          Collections.unmodifiableMap(new LinkedHashMap<>(stringParams)),
          Collections.unmodifiableMap(new LinkedHashMap<>(booleanParams)),
          Collections.unmodifiableSet(new LinkedHashSet<>(names)));
    }
  }
}
