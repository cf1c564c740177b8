package io.flowlint.syntax;

import java.util.List;

/**
 * A {@code get}, {@code set}, {@code add} or {@code remove} accessor of a property or event.
 */
public final class Accessor extends SyntaxNode {

    public enum Kind {
        GET("get"),
        SET("set"),
        ADD("add"),
        REMOVE("remove");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * Accessors that receive an implicit {@code value} parameter.
         */
        public boolean hasValueParameter() {
            return this != GET;
        }
    }

    private final Kind kind;
    private final TextSpan keywordSpan;
    private final BlockStatement body;

    public Accessor(TextSpan span, Kind kind, TextSpan keywordSpan, BlockStatement body) {
        super(span);
        this.kind = kind;
        this.keywordSpan = keywordSpan;
        this.body = adopt(body);
    }

    public Kind kind() {
        return kind;
    }

    public TextSpan keywordSpan() {
        return keywordSpan;
    }

    /**
     * Returns the body, or null for an auto-implemented accessor.
     */
    public BlockStatement body() {
        return body;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(body);
    }
}
