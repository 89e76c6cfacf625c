package com.texflow.core.logparser;

import com.texflow.core.model.ParsedLogEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw TeX engine transcript into structured diagnostics.
 *
 * <p>Pure and deterministic: the result depends only on the input text, so
 * persisted logs can be re-parsed at any time. Malformed or truncated
 * transcripts never raise; when a line number cannot be determined the
 * entry carries line 0 rather than a guess.
 *
 * <p>The currently open source file is tracked with the parenthesis
 * bookkeeping TeX writes into its log: {@code (./chapter.tex} opens a file,
 * the matching {@code )} closes it.
 */
public final class LatexLogParser {

    static final String UNKNOWN_FILE = "unknown";

    private static final Pattern FILE_LINE_ERROR = Pattern.compile("^(\\.{0,2}/[^:]+):(\\d+):\\s*(.+)$");
    private static final Pattern LATEX_ERROR = Pattern.compile("^!\\s+(.+)$");
    private static final Pattern ERROR_LINE_MARKER = Pattern.compile("^l\\.(\\d+)(?:\\s|$)");
    private static final Pattern WARNING = Pattern.compile(
            "^(?:LaTeX|(?:Package|Class)\\s+\\S+)\\s+Warning:\\s*(.+)$");
    private static final Pattern PACKAGE_CONTINUATION = Pattern.compile("^\\([^()\\s]+\\)\\s+(.*)$");
    private static final Pattern INPUT_LINE = Pattern.compile("on input line (\\d+)");
    private static final Pattern UNDEFINED_NOTICE = Pattern.compile(
            "^(pdfTeX warning \\(dest\\):.*has been referenced but does not exist.*"
                    + "|Warning--I didn't find a database entry for .+"
                    + "|WARN - I didn't find a database entry for .+)$");
    private static final Pattern BOX = Pattern.compile("^((?:Over|Under)full\\s+\\\\[hv]box\\s+.+)$");
    private static final Pattern BOX_LINE = Pattern.compile("at lines? (\\d+)");
    private static final Pattern FILE_TOKEN = Pattern.compile("[./][^\\s()]*");

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "tex", "sty", "cls", "clo", "def", "cfg", "fd", "ltx", "bib", "bbl", "aux", "toc", "lof", "lot");

    private static final int ERROR_LOOKAHEAD = 5;
    private static final int MAX_WARNING_CONTINUATION = 10;

    private LatexLogParser() {}

    public static List<ParsedLogEntry> parse(String rawLog) {
        if (rawLog == null || rawLog.isEmpty()) {
            return List.of();
        }
        String[] lines = rawLog.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        var entries = new ArrayList<ParsedLogEntry>();
        var fileStack = new ArrayDeque<String>();

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            String currentFile = currentFile(fileStack);

            Matcher m = FILE_LINE_ERROR.matcher(line);
            if (m.matches()) {
                entries.add(ParsedLogEntry.error(normalizeFile(m.group(1)), toLine(m.group(2)), m.group(3).trim()));
                trackFiles(line, fileStack);
                i++;
                continue;
            }

            m = LATEX_ERROR.matcher(line);
            if (m.matches()) {
                entries.add(ParsedLogEntry.error(currentFile, findErrorLine(lines, i), m.group(1).trim()));
                trackFiles(line, fileStack);
                i++;
                continue;
            }

            m = WARNING.matcher(line);
            if (m.matches()) {
                var text = new StringBuilder(m.group(1).trim());
                trackFiles(line, fileStack);
                int consumed = 0;
                while (!text.toString().endsWith(".")
                        && consumed < MAX_WARNING_CONTINUATION
                        && i + 1 < lines.length
                        && isWarningContinuation(lines[i + 1])) {
                    i++;
                    consumed++;
                    text.append(' ').append(continuationText(lines[i]));
                    trackFiles(lines[i], fileStack);
                }
                String message = text.toString();
                Matcher lineMatcher = INPUT_LINE.matcher(message);
                int lineNumber = lineMatcher.find() ? toLine(lineMatcher.group(1)) : 0;
                entries.add(ParsedLogEntry.warning(currentFile, lineNumber, message));
                i++;
                continue;
            }

            m = UNDEFINED_NOTICE.matcher(line);
            if (m.matches()) {
                entries.add(ParsedLogEntry.warning(currentFile, 0, m.group(1).trim()));
                trackFiles(line, fileStack);
                i++;
                continue;
            }

            m = BOX.matcher(line);
            if (m.matches()) {
                String message = m.group(1).trim();
                Matcher lineMatcher = BOX_LINE.matcher(message);
                int lineNumber = lineMatcher.find() ? toLine(lineMatcher.group(1)) : 0;
                entries.add(ParsedLogEntry.info(currentFile, lineNumber, message));
                trackFiles(line, fileStack);
                i++;
                continue;
            }

            if (!ERROR_LINE_MARKER.matcher(line).find()) {
                trackFiles(line, fileStack);
            }
            i++;
        }
        return List.copyOf(entries);
    }

    public static LogSummary summarize(List<ParsedLogEntry> entries) {
        int errors = 0;
        int warnings = 0;
        int infos = 0;
        for (var entry : entries) {
            switch (entry.type()) {
                case ERROR -> errors++;
                case WARNING -> warnings++;
                case INFO -> infos++;
            }
        }
        return new LogSummary(errors, warnings, infos);
    }

    public static List<ParsedLogEntry> errorsOnly(List<ParsedLogEntry> entries) {
        return entries.stream().filter(ParsedLogEntry::isError).toList();
    }

    /** Human-readable listing, one entry per line. */
    public static String format(List<ParsedLogEntry> entries) {
        if (entries.isEmpty()) {
            return "No issues found.";
        }
        var sb = new StringBuilder();
        for (var entry : entries) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append('[').append(entry.type().name()).append("] ")
                    .append(entry.file()).append(':').append(entry.line())
                    .append(": ").append(entry.message());
        }
        return sb.toString();
    }

    private static int findErrorLine(String[] lines, int errorIndex) {
        int end = Math.min(lines.length, errorIndex + 1 + ERROR_LOOKAHEAD);
        for (int j = errorIndex + 1; j < end; j++) {
            Matcher m = ERROR_LINE_MARKER.matcher(lines[j]);
            if (m.find()) {
                return toLine(m.group(1));
            }
        }
        return 0;
    }

    private static boolean isWarningContinuation(String next) {
        String trimmed = next.stripLeading();
        if (trimmed.isEmpty() || trimmed.startsWith("!") || trimmed.startsWith(")")) {
            return false;
        }
        return !next.startsWith("(") || PACKAGE_CONTINUATION.matcher(next).matches();
    }

    private static String continuationText(String line) {
        Matcher m = PACKAGE_CONTINUATION.matcher(line);
        return m.matches() ? m.group(1).trim() : line.trim();
    }

    /**
     * Pushes every file opened on this line and pops every group closed.
     * Groups that are not files are pushed as empty markers so the stack
     * stays balanced.
     */
    private static void trackFiles(String line, Deque<String> fileStack) {
        int idx = 0;
        while (idx < line.length()) {
            char c = line.charAt(idx);
            if (c == '(') {
                Matcher token = FILE_TOKEN.matcher(line);
                token.region(idx + 1, line.length());
                if (token.lookingAt() && hasSourceExtension(token.group())) {
                    fileStack.push(normalizeFile(token.group()));
                    idx = token.end();
                    continue;
                }
                fileStack.push("");
            } else if (c == ')' && !fileStack.isEmpty()) {
                fileStack.pop();
            }
            idx++;
        }
    }

    private static boolean hasSourceExtension(String token) {
        int dot = token.lastIndexOf('.');
        return dot > 0 && dot < token.length() - 1
                && SOURCE_EXTENSIONS.contains(token.substring(dot + 1));
    }

    private static String currentFile(Deque<String> fileStack) {
        for (String file : fileStack) {
            if (!file.isEmpty()) {
                return file;
            }
        }
        return UNKNOWN_FILE;
    }

    private static String normalizeFile(String file) {
        return file.startsWith("./") ? file.substring(2) : file;
    }

    private static int toLine(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
