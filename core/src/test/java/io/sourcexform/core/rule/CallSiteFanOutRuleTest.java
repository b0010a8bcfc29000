package io.sourcexform.core.rule;

import static io.sourcexform.core.rule.RuleHarness.apply;
import static io.sourcexform.core.rule.RuleHarness.buffer;
import static io.sourcexform.core.rule.RuleHarness.scope;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.error.TemplateSyntaxException;
import io.sourcexform.core.model.EditEntry;
import io.sourcexform.core.model.EditReport;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.template.Template;
import io.sourcexform.core.template.TemplateScope;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CallSiteFanOutRuleTest")
class CallSiteFanOutRuleTest {

    private static final TemplateScope SCOPE =
            scope(Map.of("records", "scope${variant}Records", "calculator", "scope${variant}Calculator"));

    private static final String[] LEGACY = {
        "func (h *Handler) Summary(ctx context.Context) error {",
        "\trecords, err := h.calculator.CalculateBatch(ctx, activities)",
        "\tif err != nil {",
        "\t\treturn nil, err",
        "\t}",
        "\treturn nil",
        "}"
    };

    private static CallSiteFanOutRule summaryCalls() {
        return new CallSiteFanOutRule(
                "summary-calls",
                Anchor.contains("CalculateBatch("),
                List.of(Anchor.contains("if err != nil {")),
                null,
                Template.parse("${records}, err := h.${calculator}.CalculateBatch(ctx, activities)"),
                Template.parse("if err != nil {\n\treturn nil, err\n}"),
                Template.parse("${records}"),
                new CallSiteFanOutRule.Combine(
                        "allRecords",
                        Template.parse("\nallRecords := make([]Record, 0, ${join '+' len(${records})})"),
                        Template.parse("allRecords = append(allRecords, ${records}...)")),
                CallSiteFanOutRule.DEFAULT_WINDOW,
                SCOPE);
    }

    @Test
    @DisplayName("Call with error check → one call and check per variant, then the combined collection")
    void fansOutCallSite() {
        SourceBuffer buffer = buffer(LEGACY);

        EditReport report = apply(summaryCalls(), buffer);

        assertThat(buffer.serialize())
                .isEqualTo(String.join(
                        "\n",
                        "func (h *Handler) Summary(ctx context.Context) error {",
                        "\tscope1Records, err := h.scope1Calculator.CalculateBatch(ctx, activities)",
                        "\tif err != nil {",
                        "\t\treturn nil, err",
                        "\t}",
                        "\tscope2Records, err := h.scope2Calculator.CalculateBatch(ctx, activities)",
                        "\tif err != nil {",
                        "\t\treturn nil, err",
                        "\t}",
                        "\tscope3Records, err := h.scope3Calculator.CalculateBatch(ctx, activities)",
                        "\tif err != nil {",
                        "\t\treturn nil, err",
                        "\t}",
                        "",
                        "\tallRecords := make([]Record, 0, len(scope1Records)+len(scope2Records)+len(scope3Records))",
                        "\tallRecords = append(allRecords, scope1Records...)",
                        "\tallRecords = append(allRecords, scope2Records...)",
                        "\tallRecords = append(allRecords, scope3Records...)",
                        "\treturn nil",
                        "}",
                        ""));
        assertThat(report.entries())
                .containsExactly(EditEntry.applied("summary-calls", 2, "fanned out to 3 variants"));
    }

    @Test
    @DisplayName("Already fanned out → every anchored call skipped, buffer untouched")
    void idempotent() {
        SourceBuffer buffer = buffer(LEGACY);
        apply(summaryCalls(), buffer);
        SourceBuffer migrated = SourceBuffer.of(buffer.serialize());

        EditReport report = apply(summaryCalls(), migrated);

        assertThat(migrated.isModified()).isFalse();
        assertThat(report.appliedCount()).isZero();
        assertThat(report.entries())
                .extracting(EditEntry::reason)
                .containsOnly(AnchoredRule.ALREADY_APPLIED)
                .hasSize(3);
    }

    @Test
    @DisplayName("Migrated function above an unmigrated one → only the unmigrated call fanned out")
    void guardStaysInsideFunction() {
        SourceBuffer helper = buffer(LEGACY);
        apply(summaryCalls(), helper);
        String migrated = helper.serialize().replace("Summary", "loadAll");
        SourceBuffer buffer = SourceBuffer.of(migrated + String.join("\n", LEGACY) + "\n");

        EditReport report = apply(summaryCalls(), buffer);

        assertThat(report.entries())
                .extracting(EditEntry::reason)
                .containsExactly(
                        AnchoredRule.ALREADY_APPLIED,
                        AnchoredRule.ALREADY_APPLIED,
                        AnchoredRule.ALREADY_APPLIED,
                        "fanned out to 3 variants");
        assertThat(report.entries().get(3))
                .isEqualTo(EditEntry.applied("summary-calls", 22, "fanned out to 3 variants"));
        assertThat(buffer.serialize()).startsWith(migrated).endsWith(helper.serialize());
    }

    @Test
    @DisplayName("Following line missing → statement shape mismatch, buffer untouched")
    void shapeMismatch() {
        SourceBuffer buffer = buffer(
                "\trecords, err := h.calculator.CalculateBatch(ctx, activities)", "\tlog(err)", "\tif err != nil {");

        EditReport report = apply(summaryCalls(), buffer);

        assertThat(buffer.isModified()).isFalse();
        assertThat(report.entries())
                .containsExactly(EditEntry.skipped("summary-calls", 1, AnchoredRule.SHAPE_MISMATCH));
    }

    @Test
    @DisplayName("Header rendered once; indentation follows the anchor line")
    void headerAndIndent() {
        CallSiteFanOutRule rule = new CallSiteFanOutRule(
                "notify",
                Anchor.trimmed("notify(2)"),
                List.of(),
                Template.parse("// notify every scope"),
                Template.parse("notify(${variant})"),
                null,
                null,
                null,
                0,
                SCOPE);
        SourceBuffer buffer = buffer("func f() {", "    notify(2)", "}");

        apply(rule, buffer);

        assertThat(buffer.lines())
                .extracting(line -> line.text())
                .containsExactly(
                        "func f() {",
                        "    // notify every scope",
                        "    notify(1)",
                        "    notify(2)",
                        "    notify(3)",
                        "}");
        assertThat(rule.introducedNames()).isEmpty();
    }

    @Test
    @DisplayName("Collections and the combined name are introduced")
    void introducedNames() {
        assertThat(summaryCalls().introducedNames())
                .containsExactlyInAnyOrder("scope1Records", "scope2Records", "scope3Records", "allRecords");
    }

    @Test
    @DisplayName("Statement starting with a blank line → TemplateSyntaxException")
    void blankStatement() {
        assertThatThrownBy(() -> new CallSiteFanOutRule(
                        "bad",
                        Anchor.contains("x"),
                        List.of(),
                        null,
                        Template.parse("\nx${variant}()"),
                        null,
                        null,
                        null,
                        0,
                        SCOPE))
                .isInstanceOf(TemplateSyntaxException.class);
    }
}
