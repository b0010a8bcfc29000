package io.sourcexform.core.rule;

import io.sourcexform.core.error.RuleOrderingException;
import io.sourcexform.core.spi.MutationRule;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static check that no rule emits a reference to a name only a later rule introduces. Any
 * identifier in a rule's rendered text counts as a reference; names no rule introduces are
 * assumed to exist already in the target file.
 */
public final class RuleOrderValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private RuleOrderValidator() {}

    /**
     * @throws RuleOrderingException naming the first offending rule and reference
     */
    public static void validate(List<? extends MutationRule> rules, String migrationId, String source) {
        Set<String> introducedSoFar = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            MutationRule rule = rules.get(i);
            Set<String> own = rule.introducedNames();
            for (String reference : references(rule)) {
                if (own.contains(reference) || introducedSoFar.contains(reference)) {
                    continue;
                }
                for (int j = i + 1; j < rules.size(); j++) {
                    MutationRule later = rules.get(j);
                    if (later.introducedNames().contains(reference)) {
                        throw new RuleOrderingException(
                                "Rule '" + rule.name() + "' references '" + reference
                                        + "', which is introduced by the later rule '" + later.name() + "'",
                                migrationId,
                                source,
                                rule.name(),
                                reference);
                    }
                }
            }
            introducedSoFar.addAll(own);
        }
    }

    private static Set<String> references(MutationRule rule) {
        Set<String> refs = new LinkedHashSet<>();
        for (String text : rule.renderedText()) {
            Matcher m = IDENTIFIER.matcher(text);
            while (m.find()) {
                refs.add(m.group());
            }
        }
        return refs;
    }
}
