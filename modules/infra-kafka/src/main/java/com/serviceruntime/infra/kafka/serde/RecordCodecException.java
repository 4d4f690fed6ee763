package com.serviceruntime.infra.kafka.serde;

import com.serviceruntime.infra.kafka.triage.Severity;
import com.serviceruntime.infra.kafka.triage.Triage;

public class RecordCodecException extends RuntimeException implements Triage {
  private final boolean encoding;

  private RecordCodecException(String message, Throwable cause, boolean encoding) {
    super(message, cause);
    this.encoding = encoding;
  }

  public static RecordCodecException encodeFailed(String message, Throwable cause) {
    return new RecordCodecException(message, cause, true);
  }

  public static RecordCodecException decodeFailed(String message, Throwable cause) {
    return new RecordCodecException(message, cause, false);
  }

  public boolean isEncoding() {
    return encoding;
  }

  // Encode failures are fatal; decode failures drop one record.
  @Override
  public Severity severity() {
    return encoding ? Severity.FATAL : Severity.PERMANENT;
  }
}
