package com.stepwise.core.parser;

import com.stepwise.core.model.DomainTag;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TddPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the raw ordered task list into typed {@link Task}s.
 * <p>
 * Line shape: {@code [- [ ]] T001 [TAG] [TAG...] description}. Phase tags may carry
 * a predecessor ({@code [GREEN->T001]}), {@code [after:T003]} declares a plain
 * dependency, {@code [domain:backend]} overrides the classifier, and any other tag
 * is kept as a label. Blank lines and {@code #} lines are skipped.
 */
public class TaskParser {

    private static final Logger log = LoggerFactory.getLogger(TaskParser.class);

    private static final Pattern LIST_PREFIX = Pattern.compile("^\\s*(?:[-*+]\\s+)?(?:\\[[ xX]\\]\\s+)?");
    private static final Pattern TASK_ID = Pattern.compile("^(T\\d+)(?=\\s|\\[|$)");
    private static final Pattern LEADING_TAG = Pattern.compile("^\\s*\\[([^\\]]*)\\]");
    private static final Pattern REFERENCE_TAG = Pattern.compile("^([A-Za-z][A-Za-z-]*)\\s*(?:->|→|:)\\s*(T\\d+)$");
    private static final Pattern DOMAIN_TAG = Pattern.compile("^domain\\s*:\\s*([A-Za-z]+)$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, TddPhase> PHASE_TAGS = Map.of(
            "RED", TddPhase.FAILING_TEST,
            "FAILING-TEST", TddPhase.FAILING_TEST,
            "TEST", TddPhase.FAILING_TEST,
            "GREEN", TddPhase.MAKE_PASS,
            "MAKE-PASS", TddPhase.MAKE_PASS,
            "IMPL", TddPhase.MAKE_PASS,
            "REFACTOR", TddPhase.CLEANUP,
            "CLEANUP", TddPhase.CLEANUP
    );

    private static final List<String> DEPENDENCY_TAGS = List.of("AFTER", "DEPENDS", "DEPENDS-ON");

    private final DomainClassifier classifier;

    public TaskParser(DomainClassifier classifier) {
        this.classifier = classifier;
    }

    public List<Task> parse(Path taskFile) {
        try {
            return parse(Files.readAllLines(taskFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read task list " + taskFile, e);
        }
    }

    /**
     * Parses the lines in order.
     *
     * @throws ParseException naming the first offending line
     */
    public List<Task> parse(List<String> lines) {
        var tasks = new ArrayList<Task>();
        BigInteger previousSequence = null;
        String previousId = null;

        for (int i = 0; i < lines.size(); i++) {
            String raw = lines.get(i);
            int lineNumber = i + 1;
            if (raw == null || raw.isBlank() || raw.strip().startsWith("#")) {
                continue;
            }

            Task task = parseLine(raw, lineNumber);
            BigInteger sequence = task.sequence();
            int order = previousSequence == null ? 1 : sequence.compareTo(previousSequence);
            if (order == 0) {
                throw new ParseException(lineNumber, raw, "duplicate task ID " + task.id());
            }
            if (order < 0) {
                throw new ParseException(lineNumber, raw,
                        "task ID %s is not greater than preceding %s".formatted(task.id(), previousId));
            }
            previousSequence = sequence;
            previousId = task.id();
            tasks.add(task);
        }

        log.info("Parsed {} tasks ({} phase-bound)", tasks.size(),
                tasks.stream().filter(Task::isPhaseBound).count());
        return tasks;
    }

    private Task parseLine(String raw, int lineNumber) {
        String rest = LIST_PREFIX.matcher(raw).replaceFirst("");
        Matcher idMatcher = TASK_ID.matcher(rest);
        if (!idMatcher.find()) {
            throw new ParseException(lineNumber, raw, "line does not start with a task ID (expected T<digits>)");
        }
        String id = idMatcher.group(1);
        rest = rest.substring(idMatcher.end());

        TddPhase phase = TddPhase.NONE;
        String predecessor = null;
        DomainTag explicitDomain = null;
        var labels = new ArrayList<String>();

        Matcher tagMatcher = LEADING_TAG.matcher(rest);
        while (tagMatcher.find()) {
            String tag = tagMatcher.group(1).strip();
            rest = rest.substring(tagMatcher.end());
            tagMatcher = LEADING_TAG.matcher(rest);

            Matcher domainMatcher = DOMAIN_TAG.matcher(tag);
            if (domainMatcher.matches()) {
                explicitDomain = parseDomain(domainMatcher.group(1), raw, lineNumber);
                continue;
            }

            String name = tag;
            String ref = null;
            Matcher refMatcher = REFERENCE_TAG.matcher(tag);
            if (refMatcher.matches()) {
                name = refMatcher.group(1);
                ref = refMatcher.group(2);
            }
            String upper = name.toUpperCase(Locale.ROOT);

            if (PHASE_TAGS.containsKey(upper)) {
                if (phase != TddPhase.NONE) {
                    throw new ParseException(lineNumber, raw, "more than one phase tag");
                }
                phase = PHASE_TAGS.get(upper);
            } else if (ref != null && !DEPENDENCY_TAGS.contains(upper)) {
                throw new ParseException(lineNumber, raw, "unknown reference tag [" + tag + "]");
            } else if (ref == null) {
                labels.add(tag);
            }

            if (ref != null) {
                if (predecessor != null) {
                    throw new ParseException(lineNumber, raw, "more than one predecessor reference");
                }
                predecessor = ref;
            }
        }

        String description = rest.strip();
        if (description.isEmpty()) {
            throw new ParseException(lineNumber, raw, "task " + id + " has no description");
        }
        DomainTag domain = explicitDomain != null ? explicitDomain : classifier.classify(description);

        log.debug("  {} phase={} domain={} pred={} labels={}", id, phase, domain, predecessor, labels);
        return new Task(id, description, phase, domain, predecessor, labels, lineNumber);
    }

    private static DomainTag parseDomain(String value, String raw, int lineNumber) {
        try {
            return DomainTag.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ParseException(lineNumber, raw, "unknown domain '" + value + "'");
        }
    }
}
