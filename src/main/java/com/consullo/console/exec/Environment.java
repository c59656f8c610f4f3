package com.consullo.console.exec;

import java.util.Set;

/**
 * Live namespace owned by the worker context and passed by reference into every evaluation.
 *
 * <p>Mutate it only while no execution is running.
 *
 * @since 1.0
 */
public interface Environment {

  /**
   * Returns the value bound to {@code name}, unwrapped to a Java object where possible.
   *
   * @param name variable name
   * @return value, or {@code null} if unbound
   */
  Object get(String name);

  void put(String name, Object value);

  boolean remove(String name);

  boolean contains(String name);

  /**
   * Returns the names defined by the user or the embedder.
   *
   * @return enumerable names
   */
  Set<String> names();

  /**
   * Returns every visible name, including builtins.
   *
   * @return all names
   */
  Set<String> allNames();

  /**
   * Returns the member names of the object reached by a dotted path such as {@code "a.b"}.
   *
   * @param path dotted path from the top-level namespace
   * @return member names, empty if the path does not resolve to an object
   */
  Set<String> memberNames(String path);
}
