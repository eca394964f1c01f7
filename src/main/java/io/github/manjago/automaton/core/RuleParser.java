package io.github.manjago.automaton.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the transition-table rule language.
 * <p>
 * Converts rule text into {@link RawRule} records; ids are resolved later by
 * {@link GraphBuilder}.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * // Comment line (also "# " followed by text)
 * &lt;id&gt;] accept
 * &lt;id&gt;] reject
 * &lt;id&gt;] &lt;mode&gt; (&lt;sym&gt;,&lt;target&gt;) (&lt;sym&gt;,&lt;target&gt;) ...
 * &lt;id&gt;] print (&lt;sym&gt;,&lt;target&gt;)
 * </pre>
 *
 * <h2>Mode:</h2>
 * One or two words separated by spaces or hyphens, in any order:
 * <ul>
 *   <li>direction: {@code left}, {@code l}, {@code right}, {@code r}</li>
 *   <li>action: {@code scan}, {@code none}, {@code print},
 *       {@code push}/{@code push1}/{@code write}/{@code write1},
 *       {@code pop}/{@code pop1}/{@code read}/{@code read1},
 *       {@code push2}/{@code write2}, {@code pop2}/{@code read2}</li>
 *   <li>tape write: {@code write-tape:X} or {@code wtape:X}</li>
 * </ul>
 * A lone direction means {@code scan}; a lone action means {@code right}.
 *
 * <h2>Example (one-stack pushdown, a^n b^n):</h2>
 * <pre>
 * 1] scan (a,2)
 * 2] push (a,2) (b,3)
 * 3] pop (b,3) (#,4)
 * 4] accept
 * </pre>
 */
public class RuleParser {

    private static final Logger log = LoggerFactory.getLogger(RuleParser.class);

    // Regex patterns
    private static final Pattern STATE_ID_PATTERN = Pattern.compile("\\d+");
    private static final Pattern WRITE_TAPE_PATTERN =
            Pattern.compile("(?:write-tape|wtape):(\\S)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MODE_SEPARATOR_PATTERN = Pattern.compile("[\\s-]+");

    /**
     * Parse rules from a string.
     *
     * @param source rule text
     * @return parsed rules
     * @throws ParseException if a line is malformed
     */
    public RuleSet parse(String source) throws ParseException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new StringReader(source))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new ParseException("Failed to read source", e);
        }

        return parseLines(lines);
    }

    /**
     * Parse rules from a file.
     *
     * @param path rule file
     * @return parsed rules
     * @throws ParseException if a line is malformed or the file cannot be read
     */
    public RuleSet parseFile(Path path) throws ParseException {
        try {
            return parseLines(Files.readAllLines(path));
        } catch (IOException e) {
            throw new ParseException("Failed to read file: " + path, e);
        }
    }

    private RuleSet parseLines(List<String> lines) throws ParseException {
        List<RawRule> rules = new ArrayList<>();
        int maxId = 0;

        for (int i = 0; i < lines.size(); i++) {
            int lineNum = i + 1;
            String line = lines.get(i).trim();

            if (isSkipped(line)) {
                continue;
            }

            RawRule rule = parseLine(line, lineNum);
            rules.add(rule);
            maxId = Math.max(maxId, rule.id());
            for (RawRule.Edge edge : rule.edges()) {
                maxId = Math.max(maxId, edge.target());
            }
            log.debug("Line {}: {}", lineNum, rule);
        }

        if (rules.isEmpty()) {
            throw new ParseException("No states parsed");
        }

        log.info("Parsed {} rules from {} lines (max state id {})", rules.size(), lines.size(), maxId);
        return new RuleSet(rules, maxId);
    }

    private boolean isSkipped(String line) {
        return line.isEmpty() || line.startsWith("//") || line.startsWith("# ");
    }

    /**
     * Parse a single non-blank rule line.
     */
    private RawRule parseLine(String line, int lineNum) throws ParseException {
        int bracket = line.indexOf(']');
        if (bracket < 0) {
            throw new ParseException("Missing ']' after state id", lineNum);
        }

        int id = parseStateId(line.substring(0, bracket), lineNum);
        String rest = line.substring(bracket + 1).trim();

        String keyword = rest.toLowerCase(Locale.ROOT);
        if (keyword.equals("accept")) {
            return RawRule.accept(lineNum, id);
        }
        if (keyword.equals("reject")) {
            return RawRule.reject(lineNum, id);
        }

        int paren = rest.indexOf('(');
        if (paren < 0) {
            throw new ParseException("Missing '(' (expected <mode> (sym,target) ...)", lineNum);
        }

        Mode mode = parseMode(rest.substring(0, paren).trim(), lineNum);
        List<RawRule.Edge> edges = parseEdges(rest.substring(paren), mode.action() == Action.PRINT, lineNum);

        if (mode.action() == Action.PRINT) {
            if (edges.size() != 1) {
                throw new ParseException("Print takes exactly one (sym,target) pair", lineNum);
            }
            RawRule.Edge edge = edges.get(0);
            if (Symbols.isBoundary(edge.symbol())) {
                throw new ParseException("Print symbol cannot be the boundary marker '"
                        + Symbols.BOUNDARY + "'", lineNum);
            }
            return RawRule.print(lineNum, id, edge.symbol(), edge.target());
        }

        return RawRule.transitions(lineNum, id, mode.direction(), mode.action(), edges, mode.writeSymbol());
    }

    /**
     * Parse a mode: up to one direction word plus one action word.
     */
    private Mode parseMode(String text, int lineNum) throws ParseException {
        if (text.isEmpty()) {
            throw new ParseException("Empty mode", lineNum);
        }

        Action action = null;
        char writeSymbol = Symbols.NONE;

        Matcher writeMatcher = WRITE_TAPE_PATTERN.matcher(text);
        if (writeMatcher.find()) {
            writeSymbol = writeMatcher.group(1).charAt(0);
            if (Symbols.isBoundary(writeSymbol)) {
                throw new ParseException("Cannot write the boundary marker '" + Symbols.BOUNDARY + "'", lineNum);
            }
            action = Action.WRITE_TAPE;
            text = (text.substring(0, writeMatcher.start()) + " " + text.substring(writeMatcher.end())).trim();
        }

        Direction direction = null;
        for (String word : MODE_SEPARATOR_PATTERN.split(text)) {
            if (word.isEmpty()) {
                continue;
            }
            Direction d = Direction.fromWord(word);
            Action a = Action.fromWord(word);
            if (d != null && direction == null) {
                direction = d;
            } else if (a != null && action == null) {
                action = a;
            } else if (d == null && a == null) {
                throw new ParseException("Unknown mode word '" + word + "'", lineNum);
            } else {
                throw new ParseException("Bad mode '" + text + "' (at most one direction and one action)", lineNum);
            }
        }

        return new Mode(
                direction != null ? direction : Direction.RIGHT,
                action != null ? action : Action.SCAN,
                writeSymbol);
    }

    /**
     * Parse a run of {@code (sym,target)} pairs.
     */
    private List<RawRule.Edge> parseEdges(String text, boolean printLine, int lineNum) throws ParseException {
        List<RawRule.Edge> edges = new ArrayList<>();
        int pos = 0;

        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c != '(') {
                throw new ParseException("Unexpected '" + c + "' (expected '(')", lineNum);
            }
            int close = text.indexOf(')', pos);
            if (close < 0) {
                throw new ParseException("Missing ')'", lineNum);
            }
            edges.add(parseEdge(text.substring(pos + 1, close), printLine, lineNum));
            pos = close + 1;
        }

        return edges;
    }

    private RawRule.Edge parseEdge(String inside, boolean printLine, int lineNum) throws ParseException {
        String[] parts = inside.split(",", -1);
        if (parts.length != 2) {
            throw new ParseException("Expected (sym,target), got (" + inside + ")", lineNum);
        }

        String symbol = parts[0].trim();
        if (symbol.length() != 1) {
            throw new ParseException("Bad symbol '" + symbol + "' (must be exactly one character)", lineNum);
        }
        if (symbol.charAt(0) == Symbols.PLACEHOLDER && !printLine) {
            throw new ParseException("Symbol '" + Symbols.PLACEHOLDER + "' is reserved for print states", lineNum);
        }

        String target = parts[1].trim();
        if (!STATE_ID_PATTERN.matcher(target).matches()) {
            throw new ParseException("Bad to-state '" + target + "'", lineNum);
        }

        return new RawRule.Edge(symbol.charAt(0), parsePositive(target, "to-state", lineNum));
    }

    private int parseStateId(String token, int lineNum) throws ParseException {
        String trimmed = token.trim();
        if (!STATE_ID_PATTERN.matcher(trimmed).matches()) {
            throw new ParseException("Bad state id '" + trimmed + "'", lineNum);
        }
        return parsePositive(trimmed, "state id", lineNum);
    }

    private int parsePositive(String digits, String what, int lineNum) throws ParseException {
        try {
            int value = Integer.parseInt(digits);
            if (value < 1) {
                throw new ParseException("The " + what + " must be positive, got " + value, lineNum);
            }
            if (value > TransitionGraph.MAX_ID) {
                throw new ParseException("The " + what + " " + value + " is larger than "
                        + TransitionGraph.MAX_ID, lineNum);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ParseException("The " + what + " is out of range: " + digits, lineNum);
        }
    }

    // ========== Helper classes ==========

    /**
     * Parsed mode of a transition line.
     */
    private record Mode(Direction direction, Action action, char writeSymbol) {}

    /**
     * Malformed rule text.
     */
    public static class ParseException extends AutomatonException {
        private final int lineNum;
        private final String reason;

        public ParseException(String reason) {
            super(reason);
            this.lineNum = -1;
            this.reason = reason;
        }

        public ParseException(String reason, int lineNum) {
            super("Line " + lineNum + ": " + reason);
            this.lineNum = lineNum;
            this.reason = reason;
        }

        public ParseException(String reason, Throwable cause) {
            super(reason, cause);
            this.lineNum = -1;
            this.reason = reason;
        }

        /**
         * @return 1-based line number, or -1 when the error is not tied to a line
         */
        public int getLineNum() {
            return lineNum;
        }

        public String getReason() {
            return reason;
        }
    }
}
