/*
 * Where: digest mail channel
 * What: writes rendered mails to the log instead of sending them
 * Why: local runs and tests need the whole digest pipeline without an SMTP server
 */
package com.worksync.collaboration.digest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "collaboration.mail.transport", havingValue = "log", matchIfMissing = true)
public class LocalDigestMailSender implements DigestMailSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalDigestMailSender.class);

  @Override
  public void send(DigestEmail email) {
    logger.info("digest mail (log transport) to={} subject={}", email.to(), email.subject());
    logger.debug("digest mail body to={}\n{}", email.to(), email.textBody());
  }
}
