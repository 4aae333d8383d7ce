package com.rbparser;

import com.rbparser.ast.Comment;
import com.rbparser.ast.EndContent;
import com.rbparser.ast.HeredocBeg;
import com.rbparser.ast.HeredocEnd;
import com.rbparser.ast.Location;
import com.rbparser.ast.SourceContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Per-parse state shared by the grammar driver and the tree builder: the source
 * and its line index, the token ledger, pending comments, the heredoc stack and
 * the {@code __END__} content.
 */
public final class ParserState implements SourceContext {

    /**
     * A heredoc whose opener has been seen. The terminator is filled in when the
     * lexer reaches it; the string production then swaps in the finished node.
     */
    public static final class HeredocFrame {
        private final HeredocBeg beginning;
        private HeredocEnd ending;

        HeredocFrame(HeredocBeg beginning) {
            this.beginning = beginning;
        }

        public HeredocBeg beginning() {
            return beginning;
        }

        public HeredocEnd ending() {
            return ending;
        }
    }

    private final String source;
    private final LineIndex lineIndex;
    private final TokenLedger ledger;
    private final List<Comment> comments = new ArrayList<>();
    private final Deque<HeredocFrame> heredocs = new ArrayDeque<>();
    private EndContent endContent;
    private Location position = Location.fixed(1, 0);

    public ParserState(String source) {
        this.source = source;
        this.lineIndex = new LineIndex(source);
        this.ledger = new TokenLedger(lineIndex, () -> position);
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public int lineOf(int charOffset) {
        return lineIndex.lineOf(charOffset);
    }

    @Override
    public List<Comment> pendingComments() {
        return comments;
    }

    public LineIndex lineIndex() {
        return lineIndex;
    }

    public TokenLedger ledger() {
        return ledger;
    }

    public Deque<HeredocFrame> heredocs() {
        return heredocs;
    }

    void pushHeredoc(HeredocBeg beginning) {
        heredocs.push(new HeredocFrame(beginning));
    }

    void endHeredoc(HeredocEnd ending) {
        HeredocFrame frame = heredocs.peek();
        if (frame == null) {
            throw new ParseException("Unexpected heredoc terminator",
                ending.location().startLine(), lineIndex.column(ending.location().startChar()));
        }
        frame.ending = ending;
    }

    public EndContent endContent() {
        return endContent;
    }

    void endContent(EndContent endContent) {
        this.endContent = endContent;
    }

    /**
     * Location of the most recently lexed token, used for error reporting.
     */
    public Location position() {
        return position;
    }

    void position(Location position) {
        this.position = position;
    }
}
