/*
 * Copyright Descent Contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.descent.proxops;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Arguments for constructing an operator: positional values, followed by values given by
 * parameter name. Null values are not allowed.
 *
 * @see ProximalOperators#resolve(Object, OperatorArguments)
 */
public final class OperatorArguments {

  private static final OperatorArguments NONE =
      new OperatorArguments(Collections.<Object>emptyList(), Collections.<String,Object>emptyMap());

  private final List<Object> positional;
  private final Map<String,Object> keywords;

  private OperatorArguments(List<Object> positional, Map<String,Object> keywords) {
    this.positional = positional;
    this.keywords = keywords;
  }

  public static OperatorArguments none() {
    return NONE;
  }

  /**
   * @param positional positional argument values. A lone array that isn't exactly an {@code Object[]},
   *  such as a {@code double[][]} passed on its own, is one argument, not a list of them.
   * @throws ConfigurationException if any value is null
   */
  public static OperatorArguments of(Object... positional) {
    if (positional == null) {
      return NONE;
    }
    if (positional.getClass() != Object[].class) {
      return builder().positional(positional).build();
    }
    if (positional.length == 0) {
      return NONE;
    }
    Builder builder = builder();
    for (Object value : positional) {
      builder.positional(value);
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return positional.isEmpty() && keywords.isEmpty();
  }

  public int getPositionalCount() {
    return positional.size();
  }

  /**
   * @return value of the positional argument at {@code index}
   * @throws IndexOutOfBoundsException if there is no such argument
   */
  public Object getPositional(int index) {
    return positional.get(index);
  }

  /**
   * @return names of arguments given by name, in the order they were given
   */
  public Set<String> getKeywords() {
    return keywords.keySet();
  }

  /**
   * @return value of the named argument, or {@code null} if it wasn't given by name
   */
  public Object getKeyword(String name) {
    return keywords.get(name);
  }

  /**
   * Matches these arguments to an operator's parameters: positional values first, in order,
   * then named values.
   *
   * @param operatorName name of the operator, for messages
   * @param parameterNames names of all parameters, in positional order
   * @param requiredCount how many of the leading parameters must be given
   * @return arguments keyed by parameter name
   * @throws ConfigurationException if arguments are missing, surplus, unknown or given twice
   */
  BoundArguments bind(String operatorName, List<String> parameterNames, int requiredCount) {
    if (positional.size() > parameterNames.size()) {
      throw new ConfigurationException(operatorName + " takes at most " + parameterNames.size() +
                                       " arguments but got " + positional.size());
    }
    Map<String,Object> bound = Maps.newLinkedHashMap();
    for (int i = 0; i < positional.size(); i++) {
      bound.put(parameterNames.get(i), positional.get(i));
    }
    for (Map.Entry<String,Object> entry : keywords.entrySet()) {
      String name = entry.getKey();
      if (!parameterNames.contains(name)) {
        throw new ConfigurationException(operatorName + " has no parameter '" + name + "'; parameters are " +
                                         parameterNames);
      }
      if (bound.containsKey(name)) {
        throw new ConfigurationException(operatorName + " got multiple values for '" + name + '\'');
      }
      bound.put(name, entry.getValue());
    }
    for (int i = 0; i < requiredCount; i++) {
      String name = parameterNames.get(i);
      if (!bound.containsKey(name)) {
        throw new ConfigurationException(operatorName + " is missing required argument '" + name + '\'');
      }
    }
    return new BoundArguments(operatorName, bound);
  }

  @Override
  public String toString() {
    return "OperatorArguments[" + positional + ", " + keywords + ']';
  }

  public static final class Builder {

    private final List<Object> positional = Lists.newArrayList();
    private final Map<String,Object> keywords = Maps.newLinkedHashMap();

    private Builder() {
    }

    /**
     * @throws ConfigurationException if value is null, or if a named value was already added
     */
    public Builder positional(Object value) {
      if (value == null) {
        throw new ConfigurationException("Argument " + positional.size() + " is null");
      }
      if (!keywords.isEmpty()) {
        throw new ConfigurationException("Positional arguments must come before named arguments");
      }
      positional.add(value);
      return this;
    }

    /**
     * @throws ConfigurationException if value is null or name was already used
     */
    public Builder keyword(String name, Object value) {
      if (name == null || name.isEmpty()) {
        throw new ConfigurationException("Argument name is missing");
      }
      if (value == null) {
        throw new ConfigurationException("Argument '" + name + "' is null");
      }
      if (keywords.containsKey(name)) {
        throw new ConfigurationException("Argument '" + name + "' given twice");
      }
      keywords.put(name, value);
      return this;
    }

    public OperatorArguments build() {
      if (positional.isEmpty() && keywords.isEmpty()) {
        return NONE;
      }
      return new OperatorArguments(Collections.unmodifiableList(Lists.newArrayList(positional)),
                                   Collections.unmodifiableMap(Maps.newLinkedHashMap(keywords)));
    }
  }

}
