/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.diyes.ddd.event;

import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Utilities to inspect {@link Event} class hierarchies. */
public final class EventClasses {
  private EventClasses() {
    // Cannot be instantiated
  }

  /**
   * Collects all instantiable classes of a closed event hierarchy.
   *
   * <p>For a {@code sealed} type the permitted subclasses are traversed recursively, in declaration
   * order. A {@code non-sealed} branch stops the traversal, because its subclasses cannot be known
   * upfront.
   *
   * @param eventClass root of the hierarchy
   * @param <E> is the type of the root
   * @return concrete classes of the hierarchy, including the root itself if it is concrete
   * @throws IllegalArgumentException if the root class is {@code null}
   */
  public static <E extends Event> Set<Class<? extends E>> concreteSubclassesOf(
      final Class<E> eventClass) {
    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    final Set<Class<? extends E>> result = new LinkedHashSet<>();
    collect(eventClass, eventClass, result);
    return Collections.unmodifiableSet(result);
  }

  /**
   * @param eventClass to verify
   * @return {@code true} if the class is neither an interface nor abstract
   */
  public static boolean isConcrete(final Class<?> eventClass) {
    return !eventClass.isInterface() && !Modifier.isAbstract(eventClass.getModifiers());
  }

  private static <E extends Event> void collect(
      final Class<?> current, final Class<E> root, final Set<Class<? extends E>> result) {
    if (isConcrete(current)) {
      result.add(current.asSubclass(root));
    }

    if (current.isSealed()) {
      for (Class<?> permitted : current.getPermittedSubclasses()) {
        collect(permitted, root, result);
      }
    }
  }
}
