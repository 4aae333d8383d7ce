package com.rbparser.format;

import com.rbparser.doc.LayoutPrinter;

/**
 * Options for {@link Formatter}. Immutable; the {@code with} methods return
 * modified copies.
 *
 * @param printWidth         the column at which groups break
 * @param quote              preferred string quote, {@code "} or {@code '}
 * @param trailingComma      add a trailing comma to broken argument lists, arrays and hashes
 * @param disableAutoTernary keep {@code if}/{@code else} with single-statement branches in block form
 */
public record FormatOptions(int printWidth, String quote, boolean trailingComma, boolean disableAutoTernary) {

    public static final FormatOptions DEFAULT =
        new FormatOptions(LayoutPrinter.DEFAULT_PRINT_WIDTH, "\"", false, false);

    public FormatOptions {
        if (printWidth <= 0) {
            throw new IllegalArgumentException("Print width must be positive: " + printWidth);
        }
        if (!quote.equals("\"") && !quote.equals("'")) {
            throw new IllegalArgumentException("Quote must be \" or ': " + quote);
        }
    }

    public FormatOptions withPrintWidth(int printWidth) {
        return new FormatOptions(printWidth, quote, trailingComma, disableAutoTernary);
    }

    public FormatOptions withQuote(String quote) {
        return new FormatOptions(printWidth, quote, trailingComma, disableAutoTernary);
    }

    public FormatOptions withTrailingComma(boolean trailingComma) {
        return new FormatOptions(printWidth, quote, trailingComma, disableAutoTernary);
    }

    public FormatOptions withDisableAutoTernary(boolean disableAutoTernary) {
        return new FormatOptions(printWidth, quote, trailingComma, disableAutoTernary);
    }
}
