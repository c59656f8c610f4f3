package com.consullo.console.complete;

import com.consullo.console.exec.Environment;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.lang3.Validate;

/**
 * Completes names against a live {@link Environment}.
 *
 * <p>{@code "pri"} completes against the top-level names, {@code "obj.fi"} against the members of
 * {@code obj}.
 *
 * @since 1.0
 */
public final class ScopeCompleter implements Completer {

  private final Environment environment;

  public ScopeCompleter(final Environment environment) {
    Validate.notNull(environment, "environment must not be null");
    this.environment = environment;
  }

  @Override
  public List<String> complete(final String line) {
    Validate.notNull(line, "line must not be null");

    int start = line.length();
    while (start > 0 && isPathChar(line.charAt(start - 1))) {
      start--;
    }
    final String token = line.substring(start);
    final int dot = token.lastIndexOf('.');
    if (token.startsWith(".") || token.contains("..")) {
      return List.of();
    }

    final String prefix = dot < 0 ? token : token.substring(dot + 1);
    final Set<String> candidates = dot < 0
        ? this.environment.allNames()
        : this.environment.memberNames(token.substring(0, dot));

    return candidates.stream()
        .filter(name -> name.startsWith(prefix))
        .distinct()
        .sorted()
        .collect(Collectors.toList());
  }

  private static boolean isPathChar(final char c) {
    return c == '.' || Character.isJavaIdentifierPart(c);
  }
}
