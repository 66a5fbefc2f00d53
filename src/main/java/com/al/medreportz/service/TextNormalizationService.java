package com.al.medreportz.service;

import com.al.medreportz.config.ExtractionConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans OCR / document-parser output before field extraction.
 *
 * <p>
 * The result only contains ASCII letters, digits, whitespace, the punctuation
 * {@code . , : / ( ) % -} and the canonical unit spellings produced by the
 * artifact repair table. Running the normalizer on its own output returns the
 * same string.
 */
@Service
@Slf4j
public class TextNormalizationService {

    private static final Pattern EMAIL = Pattern.compile("\\S+@\\S+");
    private static final Pattern URL = Pattern.compile("(?i)(?:https?://|www\\.)\\S+");
    private static final Pattern UNICODE_SPACE = Pattern.compile(
            "[\\u00A0\\u1680\\u2000-\\u200A\\u202F\\u205F\\u3000]");
    private static final Pattern UNICODE_LINE_BREAK = Pattern.compile("[\\u0085\\u2028\\u2029]");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern UNSAFE_CHAR = Pattern.compile("[^A-Za-z0-9\\s.,:/()%\\-]");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f]+");
    private static final Pattern EDGE_SPACE = Pattern.compile("(?m)^ +| +$");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private final List<Repair> repairs;

    @Autowired
    public TextNormalizationService(ExtractionConfiguration configuration) {
        List<Repair> compiled = new ArrayList<>();
        for (ExtractionConfiguration.ArtifactRepair repair : configuration.getArtifactRepairs()) {
            compiled.add(new Repair(Pattern.compile(repair.getPattern()),
                    Matcher.quoteReplacement(repair.getReplacement())));
        }
        this.repairs = Collections.unmodifiableList(compiled);
        log.debug("Text normalizer initialized with {} artifact repairs", repairs.size());
    }

    /**
     * Normalizes raw extracted text. Never throws for bad content; null is treated as empty.
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        // Emails go first, '@' does not survive the character filter
        String text = EMAIL.matcher(raw).replaceAll(" ");

        // Non-breaking and other wide spaces separate words like a plain space
        text = UNICODE_SPACE.matcher(text).replaceAll(" ");
        text = UNICODE_LINE_BREAK.matcher(text).replaceAll("\n");
        text = NON_ASCII.matcher(text).replaceAll("");
        text = UNSAFE_CHAR.matcher(text).replaceAll(" ");
        text = URL.matcher(text).replaceAll(" ");

        text = LINE_BREAK.matcher(text).replaceAll("\n");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = EDGE_SPACE.matcher(text).replaceAll("");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        text = text.strip();

        for (Repair repair : repairs) {
            text = repair.pattern.matcher(text).replaceAll(repair.replacement);
        }
        return text;
    }

    private static final class Repair {
        private final Pattern pattern;
        private final String replacement;

        private Repair(Pattern pattern, String replacement) {
            this.pattern = pattern;
            this.replacement = replacement;
        }
    }
}
