package com.worksync.collaboration.digest;

/** Outbound e-mail channel. Implementations throw {@link MailDeliveryException} on failure. */
public interface DigestMailSender {

  void send(DigestEmail email);
}
