package com.consullo.console.exec.rhino;

import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;

/**
 * Native function installed into the console's global scope.
 */
final class Builtin extends BaseFunction {

  private static final long serialVersionUID = 1L;

  @FunctionalInterface
  interface Body {
    Object call(Context cx, Object[] args);
  }

  private final String functionName;
  private final int arity;
  private final transient Body body;

  private Builtin(final Scriptable scope, final String functionName, final int arity, final Body body) {
    super(scope, ScriptableObject.getFunctionPrototype(scope));
    this.functionName = functionName;
    this.arity = arity;
    this.body = body;
  }

  /**
   * Defines a non-enumerable builtin on {@code scope}.
   *
   * @param scope global scope
   * @param name function name
   * @param arity declared parameter count
   * @param body implementation
   */
  static void define(final ScriptableObject scope, final String name, final int arity, final Body body) {
    ScriptableObject.defineProperty(scope, name, new Builtin(scope, name, arity, body),
        ScriptableObject.DONTENUM);
  }

  @Override
  public Object call(final Context cx, final Scriptable scope, final Scriptable thisObj, final Object[] args) {
    return this.body.call(cx, args);
  }

  @Override
  public String getFunctionName() {
    return this.functionName;
  }

  @Override
  public int getArity() {
    return this.arity;
  }

  @Override
  public int getLength() {
    return this.arity;
  }
}
