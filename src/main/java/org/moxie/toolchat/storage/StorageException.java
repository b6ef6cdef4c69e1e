package org.moxie.toolchat.storage;

public class StorageException extends Exception {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
