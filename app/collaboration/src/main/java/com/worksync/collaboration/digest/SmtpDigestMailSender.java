package com.worksync.collaboration.digest;

import com.worksync.collaboration.config.DigestMailProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/** Sends multipart (plain text + HTML) mails through {@link JavaMailSender}. */
@Component
@ConditionalOnProperty(name = "collaboration.mail.transport", havingValue = "smtp")
public class SmtpDigestMailSender implements DigestMailSender {

  private static final Logger logger = LoggerFactory.getLogger(SmtpDigestMailSender.class);

  private final JavaMailSender mailSender;
  private final DigestMailProperties properties;

  public SmtpDigestMailSender(JavaMailSender mailSender, DigestMailProperties properties) {
    this.mailSender = mailSender;
    this.properties = properties;
  }

  @Override
  public void send(DigestEmail email) {
    try {
      final MimeMessage mimeMessage = mailSender.createMimeMessage();
      final MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      helper.setFrom(properties.fromAddress());
      helper.setTo(email.to());
      helper.setSubject(email.subject());
      helper.setText(email.textBody(), email.htmlBody());
      mailSender.send(mimeMessage);
      logger.debug("digest mail sent to={} messageId={}", email.to(), mimeMessage.getMessageID());
    } catch (MailException | MessagingException ex) {
      throw new MailDeliveryException("digest mail failed to=" + email.to(), ex);
    }
  }
}
