package io.vitalconnect.backend.notification.template;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Produces the HTML and plain-text parts of alert emails from the Thymeleaf templates under {@code
 * templates/email/}. Each alert template only carries its own block; the block is rendered first
 * and then placed, unescaped, into the shared {@value #LAYOUT} layout under {@code contentHtml}.
 */
@Service
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);

  static final String DEFAULT_SUBJECT = "VitalConnect";
  static final String LAYOUT = "base";

  /** Applied in order; structural tags become line breaks before everything else is dropped. */
  private static final List<Rewrite> MARKUP_REWRITES =
      List.of(
          new Rewrite("(?s)<head>.*?</head>", ""),
          new Rewrite("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)"),
          new Rewrite("<br\\s*/?>", "\n"),
          new Rewrite("</p>", "\n\n"),
          new Rewrite("</(?:div|tr)>", "\n"),
          new Rewrite("</td>", " "),
          new Rewrite("<[^>]+>", ""));

  /** {@code &amp;} goes last so an escaped entity is decoded only once. */
  private static final List<Map.Entry<String, String>> ENTITIES =
      List.of(
          Map.entry("&lt;", "<"),
          Map.entry("&gt;", ">"),
          Map.entry("&quot;", "\""),
          Map.entry("&nbsp;", " "),
          Map.entry("&#39;", "'"),
          Map.entry("&amp;", "&"));

  private static final List<Rewrite> WHITESPACE_REWRITES =
      List.of(
          new Rewrite("[ \\t]+", " "),
          new Rewrite("\\n[ \\t]+", "\n"),
          new Rewrite("\\n{3,}", "\n\n"));

  private final TemplateEngine engine;

  public EmailTemplateRenderer() {
    this.engine = classpathEngine();
  }

  /**
   * @param templateName alert template without folder or suffix, e.g. "new-occurrence"
   * @param variables template variables; {@code subject}, when present, is the email subject
   */
  public RenderedEmail render(String templateName, Map<String, Object> variables) {
    var context = new Context();
    context.setVariables(variables);
    context.setVariable("contentHtml", engine.process(templateName, context));
    String html = engine.process(LAYOUT, context);

    Object subject = variables.get("subject");
    log.debug("Rendered alert email: template={}, htmlLength={}", templateName, html.length());
    return new RenderedEmail(
        subject != null ? subject.toString() : DEFAULT_SUBJECT, html, toPlainText(html));
  }

  /** Text alternative of the rendered HTML; links keep their target in parentheses. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    String text = Rewrite.applyAll(MARKUP_REWRITES, html);
    for (var entity : ENTITIES) {
      text = text.replace(entity.getKey(), entity.getValue());
    }
    return Rewrite.applyAll(WHITESPACE_REWRITES, text).strip();
  }

  private static TemplateEngine classpathEngine() {
    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    var engine = new TemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }

  private record Rewrite(Pattern pattern, String replacement) {

    Rewrite(String regex, String replacement) {
      this(Pattern.compile(regex), replacement);
    }

    static String applyAll(List<Rewrite> rewrites, String input) {
      String result = input;
      for (var rewrite : rewrites) {
        result = rewrite.pattern().matcher(result).replaceAll(rewrite.replacement());
      }
      return result;
    }
  }
}
