package com.rbparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Params(
    List<Node> requireds,            // Ident or MLHSParen
    List<OptionalParam> optionals,
    Node rest,                       // RestParam, ExcessedComma or ArgsForward
    List<Node> posts,
    List<KeywordParam> keywords,
    Node keywordRest,                // KwRestParam
    BlockArg block,
    Location location,
    List<Comment> comments
) implements Node {

    public record OptionalParam(Ident name, Node value) {
    }

    /**
     * A keyword parameter; {@code value} is null for a required keyword.
     */
    public record KeywordParam(Label name, Node value) {
    }

    public Params(
        List<Node> requireds,
        List<OptionalParam> optionals,
        Node rest,
        List<Node> posts,
        List<KeywordParam> keywords,
        Node keywordRest,
        BlockArg block,
        Location location
    ) {
        this(requireds, optionals, rest, posts, keywords, keywordRest, block, location, new ArrayList<>());
    }

    public boolean isEmpty() {
        return requireds.isEmpty() && optionals.isEmpty() && rest == null && posts.isEmpty()
            && keywords.isEmpty() && keywordRest == null && block == null;
    }

    @Override
    public NodeType type() {
        return NodeType.PARAMS;
    }

    @Override
    public List<Node> childNodes() {
        return Nodes.of(requireds, optionals, rest, posts, keywords, keywordRest, block);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitParams(this);
    }
}
