/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
 
package org.apache.rowguard.reflection;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import org.apache.rowguard.exception.ConfigurationException;

/**
 * Creates instances of pluggable implementations, such as audit sinks, from the class names given
 * in configuration.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ReflectionUtils {

  public static <T> T createInstanceOfClass(
      String className, Class<T> expectedType, Object... constructorArgs) {
    Class<?> clazz;
    try {
      clazz = ReflectionUtils.class.getClassLoader().loadClass(className);
    } catch (ClassNotFoundException ex) {
      throw new ConfigurationException("Class not found: " + className, ex);
    }
    if (!expectedType.isAssignableFrom(clazz)) {
      throw new ConfigurationException(
          String.format("Class %s does not implement %s", className, expectedType.getName()));
    }
    try {
      for (Constructor<?> constructor : clazz.getConstructors()) {
        Class<?>[] parameterTypes = constructor.getParameterTypes();
        if (parameterTypes.length == constructorArgs.length) {
          boolean matches = true;
          for (int i = 0; i < parameterTypes.length; i++) {
            if (!parameterTypes[i].isAssignableFrom(constructorArgs[i].getClass())) {
              matches = false;
              break;
            }
          }
          if (matches) {
            return expectedType.cast(constructor.newInstance(constructorArgs));
          }
        }
      }
      throw new NoSuchMethodException(
          "Could not find a suitable constructor for class: " + className);
    } catch (InstantiationException
        | IllegalAccessException
        | InvocationTargetException
        | NoSuchMethodException e) {
      throw new ConfigurationException("Unable to load class: " + className, e);
    }
  }
}
