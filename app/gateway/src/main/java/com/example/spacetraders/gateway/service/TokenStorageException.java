package com.example.spacetraders.gateway.service;

import java.nio.file.Path;

public class TokenStorageException extends RuntimeException {

  private final transient Path file;

  public TokenStorageException(Path file, String message, Throwable cause) {
    super(message + ": " + file, cause);
    this.file = file;
  }

  public Path file() {
    return file;
  }
}
