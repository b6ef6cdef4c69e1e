package org.moxie.toolchat.delivery;

public class DeliveryException extends Exception {
  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
