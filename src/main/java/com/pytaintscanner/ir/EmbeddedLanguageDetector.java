package com.pytaintscanner.ir;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Guesses the language embedded in a string literal (SQL, shell, XML, HTML, JSON, YAML or a
 * regular expression) with a confidence between 0 and 1. Languages are scored in that order and
 * the first of the highest scores wins; scores of 0.5 and below are ignored.
 */
public class EmbeddedLanguageDetector {

    @Getter
    @AllArgsConstructor
    public static class Detection {
        private final String language;
        private final double confidence;

        @Override
        public String toString() {
            return language + "(" + confidence + ")";
        }
    }

    @AllArgsConstructor
    private static class Rule {
        final Pattern pattern;
        final double score;

        boolean matches(String value) {
            return pattern.matcher(value).find();
        }
    }

    private static final int MIN_LENGTH = 5;
    private static final double THRESHOLD = 0.5;

    private static final List<String> SQL_KEYWORDS = Arrays.asList(
            "select", "insert", "update", "delete", "merge", "create", "alter", "drop", "truncate",
            "from", "where", "join", "inner", "outer", "left", "right", "group", "having", "order",
            "limit", "offset", "union", "distinct", "as", "on", "and", "or", "not", "table",
            "database", "index", "view", "procedure");

    private static final List<String> SHELL_KEYWORDS = Arrays.asList(
            "cd", "ls", "pwd", "mkdir", "rmdir", "rm", "cp", "mv", "cat", "grep", "awk", "sed",
            "find", "xargs", "curl", "wget", "ssh", "scp", "nc", "netcat", "echo", "printf",
            "export", "source", "chmod", "chown", "ps", "kill", "top", "df", "du", "tar", "gzip",
            "apt", "yum", "dnf", "brew", "pip", "npm");

    // openers of a polite sentence, never SQL
    private static final List<String> PROSE_OPENERS = Arrays.asList(
            "please", "can", "could", "would", "should", "may", "might", "the", "a", "an", "this", "that");

    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final List<Pattern> SQL_WORDS = wordPatterns(SQL_KEYWORDS);
    private static final List<Pattern> SHELL_WORDS = wordPatterns(SHELL_KEYWORDS);

    private static final List<Rule> SQL = Arrays.asList(
            new Rule(Pattern.compile("\\bSELECT\\b.+\\bFROM\\b", CI | Pattern.DOTALL), 0.95),
            new Rule(Pattern.compile("\\bINSERT\\s+INTO\\b.+\\bVALUES\\b", CI | Pattern.DOTALL), 0.95),
            new Rule(Pattern.compile("\\bUPDATE\\b.+\\bSET\\b", CI | Pattern.DOTALL), 0.95),
            new Rule(Pattern.compile("\\bCREATE\\s+TABLE\\b", CI), 0.95),
            new Rule(Pattern.compile("\\b(INSERT|UPDATE|DELETE|CREATE|ALTER|DROP)\\b.*\\b(FROM|WHERE|JOIN|SET|VALUES|TABLE)\\b",
                    CI | Pattern.DOTALL), 0.85));

    private static final List<Rule> SHELL = Arrays.asList(
            new Rule(Pattern.compile("\\S+\\s*\\|\\s*\\S+"), 0.85),
            new Rule(Pattern.compile("\\b(" + String.join("|", SHELL_KEYWORDS) + ")\\s+-[a-zA-Z]+", CI), 0.90),
            new Rule(Pattern.compile("(>>|>|<|2>&1)"), 0.80),
            new Rule(Pattern.compile("\\$\\(.*\\)|`.*`"), 0.90),
            new Rule(Pattern.compile("\\$\\{?\\w+\\}?"), 0.70),
            new Rule(Pattern.compile("\\b(" + String.join("|", SHELL_KEYWORDS.subList(0, 10)) + ")\\b.*(&&|\\|\\||;)", CI), 0.85));

    private static final List<Rule> HTML = Arrays.asList(
            new Rule(Pattern.compile("<\\s*([a-zA-Z][a-zA-Z0-9]*)\\b[^>]*>.*?</\\s*\\1\\s*>", Pattern.DOTALL), 0.95),
            new Rule(Pattern.compile("<\\s*[a-zA-Z][a-zA-Z0-9]*\\b[^>]*/\\s*>"), 0.90),
            new Rule(Pattern.compile("<!DOCTYPE\\s+html>", CI), 0.95),
            new Rule(Pattern.compile("<\\s*(html|head|body|div|span|p|a|img|script|style)\\b", CI), 0.85));

    private static final List<Rule> XML = Arrays.asList(
            new Rule(Pattern.compile("<\\?xml\\s+version=", CI), 0.95),
            new Rule(Pattern.compile("xmlns[:=]"), 0.90));

    private static final Pattern JSON_SHAPE = Pattern.compile("^\\s*[\\{\\[].*[\\}\\]]\\s*$", Pattern.DOTALL);

    private static final List<Pattern> YAML_SHAPES = Arrays.asList(
            Pattern.compile("^\\s*[\\w-]+\\s*:\\s*.+", Pattern.MULTILINE),
            Pattern.compile("^\\s*-\\s+\\w+", Pattern.MULTILINE));

    private static final List<Rule> REGEX = Arrays.asList(
            new Rule(Pattern.compile("(\\[\\^?[^\\]]+\\]|\\\\[dDwWsS]|\\{[\\d,]+\\}|\\(.*\\)|\\.\\*|\\.\\+)"), 0.75),
            new Rule(Pattern.compile("(\\^|\\$|\\\\b|\\\\B)"), 0.65));

    private static final List<Pattern> REGEX_FEATURES = Arrays.asList(
            Pattern.compile("\\[\\^?[^\\]]+\\]"),
            Pattern.compile("\\\\[dDwWsS]"),
            Pattern.compile("\\{[\\d,]+\\}"),
            Pattern.compile("\\(.*\\)"),
            Pattern.compile("\\.\\*|\\.\\+"),
            Pattern.compile("\\^|\\$"));

    private final ObjectMapper json = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private final ObjectMapper yaml = new YAMLMapper();

    /** The most likely embedded language, or null when nothing scores above 0.5. */
    public Detection detect(String value) {
        if (value == null || value.trim().length() < MIN_LENGTH) {
            return null;
        }
        Detection best = null;
        best = better(best, "sql", sql(value));
        best = better(best, "shell", shell(value));
        best = better(best, "xml", highest(XML, value));
        best = better(best, "html", highest(HTML, value));
        best = better(best, "json", json(value));
        best = better(best, "yaml", yaml(value));
        best = better(best, "regex", regex(value));
        return best;
    }

    private static Detection better(Detection best, String language, double score) {
        if (score <= THRESHOLD || (best != null && best.confidence >= score)) {
            return best;
        }
        return new Detection(language, score);
    }

    private static double highest(List<Rule> rules, String value) {
        double score = 0.0;
        for (Rule rule : rules) {
            if (rule.matches(value)) {
                score = Math.max(score, rule.score);
            }
        }
        return score;
    }

    private static List<Pattern> wordPatterns(List<String> words) {
        List<Pattern> out = new ArrayList<>();
        for (String word : words) {
            out.add(Pattern.compile("\\b" + word + "\\b", CI));
        }
        return out;
    }

    private static int keywordCount(List<Pattern> keywords, String value) {
        int found = 0;
        for (Pattern kw : keywords) {
            if (kw.matcher(value).find()) {
                found++;
            }
        }
        return found;
    }

    private static double sql(String value) {
        String[] words = value.trim().split("\\s+");
        if (words.length > 0 && PROSE_OPENERS.contains(words[0].toLowerCase(Locale.ROOT))) {
            return 0.0;
        }
        double score = highest(SQL, value);
        int keywords = keywordCount(SQL_WORDS, value);
        if (keywords >= 3) {
            score = Math.max(score, 0.80);
        } else if (keywords >= 2) {
            score = Math.max(score, 0.65);
        }
        return score;
    }

    private static double shell(String value) {
        double score = highest(SHELL, value);
        if (keywordCount(SHELL_WORDS, value) >= 2) {
            score = Math.max(score, 0.75);
        }
        return score;
    }

    private double json(String value) {
        try {
            json.readTree(value);
            String stripped = value.trim();
            return stripped.startsWith("{") || stripped.startsWith("[") ? 0.95 : 0.70;
        } catch (IOException e) {
            return JSON_SHAPE.matcher(value).find() ? 0.50 : 0.0;
        }
    }

    private double yaml(String value) {
        try {
            JsonNode doc = yaml.readTree(value);
            if (doc == null || !(doc.isObject() || doc.isArray())) {
                return 0.0;
            }
            String stripped = value.trim();
            if (stripped.startsWith("{") && value.contains("invalid")) {
                return 0.0;
            }
            return value.contains(":") && !stripped.startsWith("{") ? 0.90 : 0.75;
        } catch (IOException | RuntimeException e) {
            for (Pattern shape : YAML_SHAPES) {
                if (shape.matcher(value).find()) {
                    return 0.55;
                }
            }
            return 0.0;
        }
    }

    private static double regex(String value) {
        double score = highest(REGEX, value);
        int features = 0;
        for (Pattern feature : REGEX_FEATURES) {
            if (feature.matcher(value).find()) {
                features++;
            }
        }
        if (features >= 3) {
            score = Math.max(score, 0.85);
        } else if (features >= 2) {
            score = Math.max(score, 0.70);
        }
        return score;
    }
}
