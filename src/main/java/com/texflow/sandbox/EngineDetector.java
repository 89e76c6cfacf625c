package com.texflow.sandbox;

import com.texflow.core.model.Engine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks a concrete engine for {@link Engine#AUTO} requests from the main
 * file's content. A {@code % !TEX program = ...} magic comment wins; then
 * package usage; pdflatex otherwise.
 */
public final class EngineDetector {

    static final Engine DEFAULT_ENGINE = Engine.PDFLATEX;

    private static final int MAGIC_COMMENT_LINES = 20;

    private static final Pattern MAGIC_COMMENT = Pattern.compile(
            "^\\s*%\\s*!\\s*TEX\\s+(?:TS-)?program\\s*=\\s*([A-Za-z]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)%.*$", Pattern.MULTILINE);
    private static final Pattern LUA_MARKERS = Pattern.compile(
            "\\\\directlua|\\\\usepackage\\s*(?:\\[[^\\]]*\\])?\\s*\\{[^}]*\\b(?:luacode|luatextra)\\b");
    private static final Pattern XETEX_MARKERS = Pattern.compile(
            "\\\\usepackage\\s*(?:\\[[^\\]]*\\])?\\s*\\{[^}]*\\b(?:fontspec|unicode-math|polyglossia)\\b");

    private EngineDetector() {}

    public static Engine detect(String source) {
        if (source == null || source.isEmpty()) {
            return DEFAULT_ENGINE;
        }

        String[] lines = source.split("\\R", MAGIC_COMMENT_LINES + 1);
        for (int i = 0; i < Math.min(lines.length, MAGIC_COMMENT_LINES); i++) {
            Matcher m = MAGIC_COMMENT.matcher(lines[i]);
            if (m.find()) {
                var engine = Engine.fromName(m.group(1));
                if (engine.isPresent() && engine.get() != Engine.AUTO) {
                    return engine.get();
                }
            }
        }

        String code = COMMENT.matcher(source).replaceAll("");
        if (LUA_MARKERS.matcher(code).find()) {
            return Engine.LUALATEX;
        }
        if (XETEX_MARKERS.matcher(code).find()) {
            return Engine.XELATEX;
        }
        return DEFAULT_ENGINE;
    }
}
