package com.consullo.console.exec.rhino;

import com.consullo.console.exec.Environment;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.Wrapper;

/**
 * {@link Environment} backed by a Rhino global scope.
 *
 * @since 1.0
 */
public final class RhinoEnvironment implements Environment {

  private final ContextFactory factory;
  private final ScriptableObject scope;

  RhinoEnvironment(final ContextFactory factory, final ScriptableObject scope) {
    this.factory = factory;
    this.scope = scope;
  }

  /**
   * Returns the global scope that evaluations run against.
   *
   * @return global scope
   */
  ScriptableObject scope() {
    return this.scope;
  }

  @Override
  public Object get(final String name) {
    Validate.notBlank(name, "name must not be blank");
    try (Context cx = this.factory.enterContext()) {
      final Object value = ScriptableObject.getProperty(this.scope, name);
      return value == Scriptable.NOT_FOUND ? null : unwrap(value);
    }
  }

  @Override
  public void put(final String name, final Object value) {
    Validate.notBlank(name, "name must not be blank");
    try (Context cx = this.factory.enterContext()) {
      ScriptableObject.putProperty(this.scope, name, Context.javaToJS(value, this.scope));
    }
  }

  @Override
  public boolean remove(final String name) {
    Validate.notBlank(name, "name must not be blank");
    try (Context cx = this.factory.enterContext()) {
      return ScriptableObject.hasProperty(this.scope, name)
          && ScriptableObject.deleteProperty(this.scope, name);
    }
  }

  @Override
  public boolean contains(final String name) {
    Validate.notBlank(name, "name must not be blank");
    return ScriptableObject.hasProperty(this.scope, name);
  }

  @Override
  public Set<String> names() {
    return stringIds(this.scope.getIds());
  }

  @Override
  public Set<String> allNames() {
    return stringIds(this.scope.getAllIds());
  }

  @Override
  public Set<String> memberNames(final String path) {
    Validate.notBlank(path, "path must not be blank");
    try (Context cx = this.factory.enterContext()) {
      Object target = this.scope;
      for (String segment : StringUtils.split(path, '.')) {
        if (!(target instanceof Scriptable)) {
          return Collections.emptySet();
        }
        target = ScriptableObject.getProperty((Scriptable) target, segment);
      }
      if (!(target instanceof Scriptable)) {
        // primitives complete against their wrapper prototype
        if (target == Scriptable.NOT_FOUND || target == null || target instanceof Undefined) {
          return Collections.emptySet();
        }
        target = Context.toObject(target, this.scope);
      }
      final Set<String> names = new LinkedHashSet<>();
      for (Scriptable s = (Scriptable) target; s != null; s = s.getPrototype()) {
        names.addAll(stringIds(s instanceof ScriptableObject
            ? ((ScriptableObject) s).getAllIds()
            : s.getIds()));
      }
      return names;
    }
  }

  /**
   * Converts a script value into a plain Java value where one exists.
   *
   * @param value script value
   * @return unwrapped value, {@code null} for undefined
   */
  static Object unwrap(final Object value) {
    if (value instanceof Wrapper) {
      return ((Wrapper) value).unwrap();
    }
    if (value instanceof Undefined) {
      return null;
    }
    if (value instanceof CharSequence) {
      return value.toString();
    }
    return value;
  }

  private static Set<String> stringIds(final Object[] ids) {
    final Set<String> names = new LinkedHashSet<>();
    for (Object id : ids) {
      if (id instanceof String) {
        names.add((String) id);
      }
    }
    return names;
  }
}
