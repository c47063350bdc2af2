/*
 * Where: collaboration service layer
 * What: wraps data store failures while writing notifications
 * Why: callers must learn that nothing was recorded, unlike push failures which stay silent
 */
package com.worksync.collaboration.service;

public class NotificationPersistenceException extends RuntimeException {

  public NotificationPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
