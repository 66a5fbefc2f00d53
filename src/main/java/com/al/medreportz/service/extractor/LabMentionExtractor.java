package com.al.medreportz.service.extractor;

import com.al.medreportz.config.ExtractionConfiguration;
import com.al.medreportz.model.RawLabMention;
import com.al.medreportz.model.ResolvedLabResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scans report text line by line for known lab test tokens.
 *
 * <p>
 * A line yields at most one mention: the earliest token on the line (the longest
 * one when two start at the same position) paired with the first word at or after
 * that token which starts with a number. Words shaped like a printed range
 * ("13-17", "(70-99)") are skipped. A second value printed on the same line is
 * not reported.
 */
@Slf4j
@Component
public class LabMentionExtractor implements FieldExtractor<List<RawLabMention>> {

    private static final Pattern LEADING_NUMBER = Pattern.compile(
            "^\\(?(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)");
    private static final Pattern RANGE_WORD = Pattern.compile("^\\(?\\d+(?:\\.\\d+)?-\\d");
    private static final Pattern LABEL_TRIM = Pattern.compile("[\\s:\\-.,(]+$");
    private static final Pattern WORD = Pattern.compile("[^\\s:]+");
    private static final Pattern LIST_MARKER = Pattern.compile("^\\d+[.)] *");

    private final Pattern tokenPattern;
    private final List<String> units;

    @Autowired
    public LabMentionExtractor(ExtractionConfiguration configuration) {
        String alternation = configuration.getLabTokens().stream()
                .filter(token -> token != null && !token.isBlank())
                .map(token -> token.strip().toLowerCase(Locale.ROOT))
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.tokenPattern = Pattern.compile("(?<![A-Za-z])(?:" + alternation + ")(?![A-Za-z])",
                Pattern.CASE_INSENSITIVE);
        this.units = configuration.getUnits().stream()
                .filter(unit -> unit != null && !unit.isBlank())
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<RawLabMention> extract(String text) {
        List<RawLabMention> mentions = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return mentions;
        }
        for (String line : text.split("\n")) {
            Matcher token = tokenPattern.matcher(line);
            if (!token.find()) {
                continue;
            }
            extractFromLine(line, token).ifPresent(mentions::add);
        }
        log.debug("Found {} lab mentions", mentions.size());
        return mentions;
    }

    private Optional<RawLabMention> extractFromLine(String line, Matcher token) {
        Matcher word = WORD.matcher(line);
        word.region(token.start(), line.length());
        int rangeStart = -1;
        while (word.find()) {
            if (RANGE_WORD.matcher(word.group()).find()) {
                if (rangeStart < 0) {
                    rangeStart = word.start();
                }
                continue;
            }
            OptionalDouble value = parseLeadingNumber(word.group());
            if (value.isEmpty()) {
                continue;
            }
            String label = labelFor(line, rangeStart < 0 ? word.start() : rangeStart, token.group());
            return Optional.of(new RawLabMention(label, value.getAsDouble(), inferUnit(line)));
        }
        log.debug("No numeric value on lab line for token '{}'", token.group());
        return Optional.empty();
    }

    private static OptionalDouble parseLeadingNumber(String part) {
        Matcher matcher = LEADING_NUMBER.matcher(part);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(matcher.group(1).replace(",", "")));
        } catch (NumberFormatException e) {
            log.debug("Skipping unparseable numeric token '{}'", part);
            return OptionalDouble.empty();
        }
    }

    /**
     * Text printed before the value, or the matched token when the value comes first.
     */
    private static String labelFor(String line, int valueStart, String matchedToken) {
        String prefix = LIST_MARKER.matcher(line.substring(0, valueStart).strip()).replaceFirst("");
        String label = LABEL_TRIM.matcher(prefix).replaceAll("").strip();
        return label.isEmpty() ? matchedToken : label;
    }

    String inferUnit(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String unit : units) {
            if (lower.contains(unit.toLowerCase(Locale.ROOT))) {
                return unit;
            }
        }
        return ResolvedLabResult.UNIT_UNKNOWN;
    }
}
