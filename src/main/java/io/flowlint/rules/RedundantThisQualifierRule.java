package io.flowlint.rules;

import io.flowlint.model.Fix;
import io.flowlint.model.Issue;
import io.flowlint.model.Severity;
import io.flowlint.model.TextEdit;
import io.flowlint.semantic.Symbol;
import io.flowlint.semantic.SymbolResolver;
import io.flowlint.syntax.MemberAccessExpression;
import io.flowlint.syntax.TextSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds {@code this.} qualifiers that can be dropped without changing what the name
 * refers to.
 * <p>
 * A qualifier is redundant when the member it qualifies is also what the bare name
 * binds to at the same position. A local, parameter or lambda parameter of the same
 * name makes the qualifier required. When the member cannot be resolved, the
 * qualifier is assumed to be required.
 */
public class RedundantThisQualifierRule implements Rule {

    public static final String NAME = "RedundantThisQualifier";
    public static final String MESSAGE = "'this.' is redundant and can be removed safely.";
    public static final String FIX_TITLE = "Remove 'this.'";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> aliases() {
        return List.of("RedundantThis");
    }

    @Override
    public String description() {
        return "Detects 'this.' qualifiers that do not change name resolution";
    }

    @Override
    public Severity severity() {
        return Severity.HINT;
    }

    @Override
    public List<Issue> inspect(AnalysisContext context) {
        SymbolResolver resolver = context.resolver();
        List<Issue> issues = new ArrayList<>();

        for (MemberAccessExpression access : context.tree().root().descendantsOfType(MemberAccessExpression.class)) {
            if (!access.isThisQualified()) {
                continue;
            }
            Optional<Symbol> member = resolver.resolve(access);
            if (member.isEmpty()) {
                continue;
            }
            Optional<Symbol> bare = resolver.lookup(access.memberName(), access);
            if (bare.isEmpty() || !bare.get().equals(member.get())) {
                continue;
            }

            TextSpan qualifier = new TextSpan(access.target().start(), access.memberNameSpan().start());
            Fix fix = Fix.of(FIX_TITLE, NAME, TextEdit.delete(qualifier.start(), qualifier.end()));
            issues.add(context.issue(this, qualifier)
                    .message(MESSAGE)
                    .fix(fix)
                    .build());
        }
        return issues;
    }
}
