package com.texflow.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/compile.
 *
 * @param source inline LaTeX document
 * @param engine auto, pdflatex, xelatex, lualatex or latex; nullable, defaults to auto
 * @param format no longer accepted here; present only so that old clients get a clear 400
 */
public record CompileRequest(
    String source,
    String engine,
    String format
) {}
