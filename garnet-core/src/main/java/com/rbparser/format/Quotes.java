package com.rbparser.format;

import com.rbparser.ast.Node;
import com.rbparser.ast.TStringContent;

import java.util.List;

/**
 * Quote selection for string-like literals.
 */
final class Quotes {

    private Quotes() {
    }

    /**
     * Whether a string must keep the quotes it was written with. Switching is only
     * safe for plain content that reads the same under either quote.
     */
    static boolean locked(List<Node> parts, String preferred) {
        for (Node part : parts) {
            if (!(part instanceof TStringContent content)) {
                return true;
            }
            String value = content.value();
            if (value.contains("\\") || value.contains("#{") || value.contains("#@") || value.contains("#$")
                    || value.contains(preferred)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The closing delimiter of a percent literal or quote, e.g. {@code ]} for
     * {@code %w[}.
     */
    static String closing(String opening) {
        char last = opening.charAt(opening.length() - 1);
        return switch (last) {
            case '(' -> ")";
            case '[' -> "]";
            case '{' -> "}";
            case '<' -> ">";
            default -> String.valueOf(last);
        };
    }

    static boolean isPercent(String opening) {
        return opening.startsWith("%");
    }
}
