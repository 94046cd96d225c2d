package com.salescrm.backend.services.email;

import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the fixed set of {@code {{placeholder}}} variables of a template
 * from a lead and the sending user.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateRenderer {

    public static final Set<String> AVAILABLE_VARIABLES = Set.of(
            "lead_name", "first_name", "last_name", "company", "email", "phone",
            "user_name", "user_email", "current_date", "current_time");

    public static final int MAX_SUBJECT_LENGTH = 300;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*\\}\\}");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile(
            "<(script|style)[^>]*>.*?</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BR = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_CLOSE = Pattern.compile("</p>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIV_CLOSE = Pattern.compile("</div>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SPACES = Pattern.compile("[ \\t]+");

    private final Clock clock;

    /**
     * Render subject, HTML and text bodies. A blank text body is derived from the rendered HTML.
     */
    public RenderedEmail render(EmailTemplate template, Lead lead, User user) {
        Map<String, String> context = buildContext(lead, user);

        String subject = fitSubject(replaceVariables(template.getSubject(), context));
        String html = replaceVariables(template.getBodyHtml(), context);
        String text = template.getBodyText() != null && !template.getBodyText().isBlank()
                ? replaceVariables(template.getBodyText(), context)
                : htmlToText(html);

        return new RenderedEmail(subject, html, text);
    }

    /**
     * Cut a rendered subject down to what an email row can store.
     */
    public String fitSubject(String subject) {
        if (subject == null || subject.length() <= MAX_SUBJECT_LENGTH) {
            return subject;
        }
        return subject.substring(0, MAX_SUBJECT_LENGTH);
    }

    /**
     * Substitute known variables. Unknown placeholders stay in the output untouched.
     */
    public String replaceVariables(String content, Map<String, String> variables) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(content);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = variables.containsKey(name)
                    ? nullToEmpty(variables.get(name))
                    : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public Map<String, String> buildContext(Lead lead, User user) {
        ZonedDateTime now = ZonedDateTime.now(clock);

        Map<String, String> context = new HashMap<>();
        context.put("lead_name", lead.getFullName());
        context.put("first_name", lead.getFirstName());
        context.put("last_name", lead.getLastName());
        context.put("company", lead.getCompany());
        context.put("email", lead.getEmail());
        context.put("phone", lead.getPhone());
        context.put("user_name", user.getFullName());
        context.put("user_email", user.getEmail());
        context.put("current_date", DATE_FORMAT.format(now));
        context.put("current_time", TIME_FORMAT.format(now));
        return context;
    }

    /**
     * Plain-text rendition of an HTML body: scripts and styles dropped,
     * line breaks and paragraphs kept, entities decoded, whitespace collapsed.
     */
    public String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String text = SCRIPT_OR_STYLE.matcher(html).replaceAll("");
        text = BR.matcher(text).replaceAll("\n");
        text = P_CLOSE.matcher(text).replaceAll("\n\n");
        text = DIV_CLOSE.matcher(text).replaceAll("\n");

        Document.OutputSettings settings = new Document.OutputSettings().prettyPrint(false);
        text = Jsoup.clean(text, "", Safelist.none(), settings);
        text = Parser.unescapeEntities(text, false);

        text = SPACES.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }

    /**
     * Checks a template before it is saved. An empty list means valid.
     */
    public List<String> validate(String subject, String bodyHtml) {
        List<String> errors = new ArrayList<>();

        if (subject == null || subject.isBlank()) {
            errors.add("Subject is required");
        } else if (subject.length() > MAX_SUBJECT_LENGTH) {
            errors.add("Subject is too long (max " + MAX_SUBJECT_LENGTH + " characters)");
        }

        if (bodyHtml == null || bodyHtml.isBlank()) {
            errors.add("Email body is required");
        }

        Set<String> unknown = new LinkedHashSet<>();
        unknown.addAll(findUnknownVariables(subject));
        unknown.addAll(findUnknownVariables(bodyHtml));
        if (!unknown.isEmpty()) {
            errors.add("Invalid variables: " + String.join(", ", unknown));
        }
        return errors;
    }

    private Set<String> findUnknownVariables(String content) {
        Set<String> unknown = new LinkedHashSet<>();
        if (content == null) {
            return unknown;
        }
        Matcher matcher = PLACEHOLDER.matcher(content);
        while (matcher.find()) {
            if (!AVAILABLE_VARIABLES.contains(matcher.group(1))) {
                unknown.add(matcher.group(1));
            }
        }
        return unknown;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
