/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.hdl.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls lowering.
 *
 * @see Lowering
 */
public enum Prop {
  /**
   * Boolean property "checkHomogeneous" controls whether the binder checks
   * that every element of an indexed list has the same kind as the first
   * element before resolving attributes through the list. If false, the
   * first element's kind is assumed for the whole list. Default is true.
   */
  CHECK_HOMOGENEOUS("checkHomogeneous", Boolean.class, true, true),

  /**
   * Boolean property "expandRangeConstants" controls whether references to
   * range constants, such as {@code s.FIELD} where {@code FIELD} is
   * {@code slice(0, 4)}, are replaced by an explicit slice. Default is true.
   */
  EXPAND_RANGE_CONSTANTS("expandRangeConstants", Boolean.class, true, true),

  /**
   * String property "accessorNames" is a comma-separated list of attribute
   * names that denote the signal itself rather than a field. Default is
   * "value,next,v,n".
   */
  ACCESSOR_NAMES("accessorNames", String.class, true, "value,next,v,n"),

  /**
   * String property "rangeFunctions" is a comma-separated list of the
   * functions that may be the iterable of a {@code for} loop. Default is
   * "range,xrange".
   */
  RANGE_FUNCTIONS("rangeFunctions", String.class, true, "range,xrange");

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Returns the value of a string property as a list of comma-separated
   * items. */
  public List<String> listValue(Map<Prop, Object> map) {
    return ImmutableList.copyOf(
        Splitter.on(',')
            .trimResults()
            .omitEmptyStrings()
            .split(stringValue(map)));
  }

  /** Sets the value of a property, allowing strings for boolean types. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Boolean.class && value instanceof String) {
      final String s = ((String) value).toLowerCase(Locale.ROOT);
      checkArgument(s.equals("true") || s.equals("false"),
          "value for property %s must be true or false", camelName);
      set(map, Boolean.valueOf(s));
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      checkArgument(!required, "property %s is required", camelName);
      map.remove(this);
    } else {
      checkArgument(type.isInstance(value),
          "value for property %s must have type %s", camelName, type);
      map.put(this, value);
    }
  }
}

// End Prop.java
