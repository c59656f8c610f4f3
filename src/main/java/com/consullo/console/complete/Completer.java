package com.consullo.console.complete;

import java.util.List;

/**
 * Name completion capability offered by some interpreters.
 *
 * @since 1.0
 */
public interface Completer {

  /**
   * Returns candidate completions for the identifier or dotted path at the end of {@code line}.
   *
   * @param line text up to the cursor
   * @return candidate names, sorted
   */
  List<String> complete(final String line);
}
