package com.consullo.console.transcript;

import com.consullo.console.log.LogRecord;

/**
 * Render callback for transcript mutations. Invoked on the foreground thread; implementations must
 * not mutate the transcript.
 *
 * @since 1.0
 */
public interface TranscriptListener {

  void onRecordAdded(int index, LogRecord record);

  default void onRecordChanged(int index, LogRecord record) {
  }

  default void onRecordsRemoved(int fromIndex, int count) {
  }
}
