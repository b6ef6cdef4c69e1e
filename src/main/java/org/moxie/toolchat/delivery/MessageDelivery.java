package org.moxie.toolchat.delivery;

public interface MessageDelivery {

  /**
   * Send text to one recipient on one platform.
   *
   * @throws DeliveryException if the platform is unknown or rejects the message
   */
  void deliver(DeliveryTarget target, String text) throws DeliveryException;
}
