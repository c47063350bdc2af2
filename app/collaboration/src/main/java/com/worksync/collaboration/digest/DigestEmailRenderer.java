/*
 * Where: digest mail channel
 * What: renders digest and urgent-alert mails from classpath Thymeleaf templates
 * Why: the HTML body and its plain-text alternative come from one template
 */
package com.worksync.collaboration.digest;

import com.worksync.collaboration.config.DigestMailProperties;
import com.worksync.collaboration.config.DigestProperties;
import com.worksync.collaboration.model.DigestRecipient;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

@Component
public class DigestEmailRenderer {

  static final String DIGEST_TEMPLATE = "digest";
  static final String URGENT_TEMPLATE = "urgent-alert";

  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

  private final TemplateEngine templateEngine;
  private final ZoneId zone;
  private final String appUrl;

  public DigestEmailRenderer(DigestProperties digestProperties, DigestMailProperties mailProperties) {
    this.templateEngine = createTemplateEngine();
    this.zone = digestProperties.zoneId();
    this.appUrl = mailProperties.appUrl();
  }

  public DigestEmail renderDigest(
      DigestJob job,
      DigestRecipient recipient,
      @Nullable DigestSummary summary,
      List<Candidate> candidates) {
    final String subject = job.subjectFor(recipient.displayName());
    final Context context = baseContext(recipient, subject);
    context.setVariable("summary", summary == null ? null : summaryView(summary));
    context.setVariable("candidates", candidates.stream().map(this::candidateView).toList());
    final String html = templateEngine.process(DIGEST_TEMPLATE, context);
    return new DigestEmail(recipient.email(), subject, html, toPlainText(html));
  }

  public DigestEmail renderUrgentAlert(DigestRecipient recipient, Candidate candidate) {
    final String subject = "Urgent: " + candidate.title();
    final Context context = baseContext(recipient, subject);
    context.setVariable("candidate", candidateView(candidate));
    final String html = templateEngine.process(URGENT_TEMPLATE, context);
    return new DigestEmail(recipient.email(), subject, html, toPlainText(html));
  }

  private Context baseContext(DigestRecipient recipient, String subject) {
    final Context context = new Context();
    context.setVariable("subject", subject);
    context.setVariable("displayName", recipient.displayName());
    context.setVariable("appUrl", appUrl);
    return context;
  }

  // Templates read maps so they do not depend on how OGNL resolves record accessors.
  private Map<String, Object> summaryView(DigestSummary summary) {
    final Map<String, Object> view = new LinkedHashMap<>();
    view.put("focusDay", summary.focusDay().toString());
    view.put("tasksDue", summary.tasksDue());
    view.put("meetings", summary.meetings());
    view.put("upcomingDeadlines", summary.upcomingDeadlines());
    view.put("highPriorityItems", summary.highPriorityItems());
    view.put("completedToday", summary.completedToday());
    view.put(
        "schedule",
        summary.schedule().stream()
            .map(
                item ->
                    Map.of(
                        "time", TIME_FORMAT.format(item.at().atZone(zone)),
                        "kind", item.kind(),
                        "title", item.title(),
                        "detail", item.detail()))
            .toList());
    view.put("unreadNotifications", summary.unreadNotifications());
    view.put(
        "pendingNotifications",
        summary.pendingNotifications().stream()
            .map(
                pending ->
                    Map.of(
                        "title", pending.title(),
                        "message", pending.message(),
                        "priority", pending.priority()))
            .toList());
    return view;
  }

  private Map<String, Object> candidateView(Candidate candidate) {
    return Map.of(
        "priority", candidate.priority().wireValue(),
        "kind", candidate.kind().wireValue(),
        "title", candidate.title(),
        "message", candidate.message());
  }

  String toPlainText(String html) {
    String text = html.replaceAll("(?s)<head>.*?</head>", "");
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</(p|h1|h2|li|tr)>", "\n");
    text = text.replaceAll("</td>", " ");
    text = text.replaceAll("<[^>]+>", "");
    text = text.replace("&amp;", "&").replace("&lt;", "<").replace("&gt;", ">");
    text = text.replace("&quot;", "\"").replace("&#39;", "'").replace("&nbsp;", " ");
    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("\\n[ \\t]+", "\n");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }

  private static TemplateEngine createTemplateEngine() {
    final ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    final TemplateEngine engine = new TemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
