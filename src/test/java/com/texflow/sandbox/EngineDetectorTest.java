package com.texflow.sandbox;

import com.texflow.core.model.Engine;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EngineDetectorTest {

    @Test
    void plainDocumentUsesPdflatex() {
        assertEquals(Engine.PDFLATEX, EngineDetector.detect(
                "\\documentclass{article}\n\\begin{document}Hello\\end{document}"));
    }

    @Test
    void emptyOrNullUsesPdflatex() {
        assertEquals(Engine.PDFLATEX, EngineDetector.detect(""));
        assertEquals(Engine.PDFLATEX, EngineDetector.detect(null));
    }

    @Test
    void magicCommentWins() {
        assertEquals(Engine.LUALATEX, EngineDetector.detect(
                "% !TEX program = lualatex\n\\documentclass{article}\n\\usepackage{fontspec}"));
        assertEquals(Engine.XELATEX, EngineDetector.detect("%!TEX TS-program = XeLaTeX\n\\documentclass{book}"));
    }

    @Test
    void magicCommentNamingAutoIsIgnored() {
        assertEquals(Engine.PDFLATEX, EngineDetector.detect("% !TEX program = auto\n\\documentclass{article}"));
    }

    @Test
    void fontspecSelectsXelatex() {
        assertEquals(Engine.XELATEX, EngineDetector.detect("\\usepackage[no-math]{fontspec}"));
        assertEquals(Engine.XELATEX, EngineDetector.detect("\\usepackage{amsmath,unicode-math}"));
    }

    @Test
    void luaMarkersSelectLualatex() {
        assertEquals(Engine.LUALATEX, EngineDetector.detect("\\directlua{tex.print(1)}"));
        assertEquals(Engine.LUALATEX, EngineDetector.detect("\\usepackage{luacode}"));
    }

    @Test
    void commentedOutPackagesAreIgnored() {
        assertEquals(Engine.PDFLATEX, EngineDetector.detect("% \\usepackage{fontspec}\n\\documentclass{article}"));
    }
}
