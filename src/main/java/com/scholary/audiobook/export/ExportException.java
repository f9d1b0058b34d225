package com.scholary.audiobook.export;

/** Exception thrown when encoding or muxing the final audio fails. */
public class ExportException extends RuntimeException {

  public ExportException(String message) {
    super(message);
  }

  public ExportException(String message, Throwable cause) {
    super(message, cause);
  }
}
