package io.sourcexform.core.rule;

import static io.sourcexform.core.rule.RuleHarness.apply;
import static io.sourcexform.core.rule.RuleHarness.buffer;
import static io.sourcexform.core.rule.RuleHarness.scope;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sourcexform.core.buffer.SourceBuffer;
import io.sourcexform.core.error.TemplateSyntaxException;
import io.sourcexform.core.error.UnbalancedRegionException;
import io.sourcexform.core.model.EditEntry;
import io.sourcexform.core.model.EditReport;
import io.sourcexform.core.scan.Anchor;
import io.sourcexform.core.template.Template;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FieldFanOutRuleTest")
class FieldFanOutRuleTest {

    private static FieldFanOutRule handlerFields() {
        return new FieldFanOutRule(
                "handler-fields",
                Anchor.exact("type Handler struct {"),
                Anchor.contains("calculator    *Scope2Calculator"),
                Template.parse("${calculator} *Scope${variant}Calculator"),
                null,
                scope(Map.of("calculator", "scope${variant}Calculator")));
    }

    private static FieldFanOutRule configFields() {
        return new FieldFanOutRule(
                "config-fields",
                Anchor.contains("Config struct {"),
                null,
                Template.parse("Scope${variant}Calculator *Scope${variant}Calculator"),
                null,
                scope());
    }

    @Nested
    @DisplayName("Fan-out")
    class FanOut {

        @Test
        @DisplayName("Seed declaration → replaced by one declaration per variant, in place")
        void seedReplaced() {
            SourceBuffer buffer = buffer(
                    "type Handler struct {", "\tcalculator    *Scope2Calculator", "\tlogger *Logger", "}");

            EditReport report = apply(handlerFields(), buffer);

            assertThat(buffer.serialize())
                    .isEqualTo(String.join(
                            "\n",
                            "type Handler struct {",
                            "\tscope1Calculator *Scope1Calculator",
                            "\tscope2Calculator *Scope2Calculator",
                            "\tscope3Calculator *Scope3Calculator",
                            "\tlogger *Logger",
                            "}",
                            ""));
            assertThat(report.entries())
                    .containsExactly(EditEntry.applied(
                            "handler-fields", 1, "fanned out to 3 variants (0 kept, 3 added)"));
        }

        @Test
        @DisplayName("Only variant 2 present → 1 and 3 added around it, 2 kept verbatim")
        void variantTwoOnly() {
            SourceBuffer buffer = buffer(
                    "type HandlerConfig struct {",
                    "    Scope2Calculator   *Scope2Calculator // aligned",
                    "    Logger             *Logger",
                    "}");

            EditReport report = apply(configFields(), buffer);

            assertThat(buffer.lines())
                    .extracting(line -> line.text())
                    .containsExactly(
                            "type HandlerConfig struct {",
                            "    Scope1Calculator *Scope1Calculator",
                            "    Scope2Calculator   *Scope2Calculator // aligned",
                            "    Scope3Calculator *Scope3Calculator",
                            "    Logger             *Logger",
                            "}");
            assertThat(report.entries().get(0).reason()).isEqualTo("fanned out to 3 variants (1 kept, 2 added)");
        }

        @Test
        @DisplayName("Partial fan-out out of order → completed and reordered")
        void partialOutOfOrder() {
            SourceBuffer buffer = buffer(
                    "type HandlerConfig struct {",
                    "\tScope3Calculator *Scope3Calculator",
                    "\tScope1Calculator *Scope1Calculator",
                    "}");

            apply(configFields(), buffer);

            assertThat(buffer.serialize())
                    .isEqualTo(String.join(
                            "\n",
                            "type HandlerConfig struct {",
                            "\tScope1Calculator *Scope1Calculator",
                            "\tScope2Calculator *Scope2Calculator",
                            "\tScope3Calculator *Scope3Calculator",
                            "}",
                            ""));
        }

        @Test
        @DisplayName("Every matching block is fanned out")
        void multipleBlocks() {
            SourceBuffer buffer = buffer(
                    "type AConfig struct {",
                    "\tScope2Calculator *Scope2Calculator",
                    "}",
                    "type BConfig struct {",
                    "\tScope2Calculator *Scope2Calculator",
                    "}");

            EditReport report = apply(configFields(), buffer);

            assertThat(report.appliedCount()).isEqualTo(2);
            assertThat(report.entries()).extracting(EditEntry::line).containsExactly(1, 6);
            assertThat(buffer.size()).isEqualTo(10);
        }

        @Test
        @DisplayName("Nested block lines and braces in comments are left alone")
        void nestedIgnored() {
            SourceBuffer buffer = buffer(
                    "type Handler struct {",
                    "\t/* old: { */",
                    "\tinner struct {",
                    "\t\tcalculator    *Scope2Calculator",
                    "\t}",
                    "\tcalculator    *Scope2Calculator",
                    "}");

            apply(handlerFields(), buffer);

            assertThat(buffer.text(3)).isEqualTo("\t\tcalculator    *Scope2Calculator");
            assertThat(buffer.text(5)).isEqualTo("\tscope1Calculator *Scope1Calculator");
            assertThat(buffer.size()).isEqualTo(9);
        }

        @Test
        @DisplayName("Key prefix of a longer identifier → not a variant line")
        void keyBoundary() {
            SourceBuffer buffer = buffer(
                    "type HandlerConfig struct {",
                    "\tScope1CalculatorFactory *Factory",
                    "\tScope2Calculator *Scope2Calculator",
                    "}");

            apply(configFields(), buffer);

            assertThat(buffer.text(1)).isEqualTo("\tScope1CalculatorFactory *Factory");
            assertThat(buffer.text(2)).isEqualTo("\tScope1Calculator *Scope1Calculator");
        }
    }

    @Nested
    @DisplayName("Idempotency and skips")
    class Skips {

        @Test
        @DisplayName("Second application → already applied, buffer untouched")
        void idempotent() {
            SourceBuffer buffer = buffer(
                    "type Handler struct {", "\tcalculator    *Scope2Calculator", "\tlogger *Logger", "}");
            apply(handlerFields(), buffer);
            SourceBuffer migrated = SourceBuffer.of(buffer.serialize());

            EditReport report = apply(handlerFields(), migrated);

            assertThat(migrated.isModified()).isFalse();
            assertThat(report.entries())
                    .containsExactly(EditEntry.skipped("handler-fields", 1, AnchoredRule.ALREADY_APPLIED));
        }

        @Test
        @DisplayName("Anchor absent → single skip without line, buffer untouched")
        void anchorAbsent() {
            SourceBuffer buffer = buffer("package main");

            EditReport report = apply(handlerFields(), buffer);

            assertThat(buffer.isModified()).isFalse();
            assertThat(report.entries())
                    .containsExactly(EditEntry.skipped("handler-fields", 0, AnchoredRule.ANCHOR_NOT_FOUND));
        }

        @Test
        @DisplayName("Block without seed or variant lines → skipped")
        void noSeed() {
            SourceBuffer buffer = buffer("type Handler struct {", "\tlogger *Logger", "}");

            EditReport report = apply(handlerFields(), buffer);

            assertThat(buffer.isModified()).isFalse();
            assertThat(report.entries().get(0).outcome()).isEqualTo(EditEntry.Outcome.SKIPPED);
            assertThat(report.entries().get(0).reason()).isEqualTo("no seed declaration in block");
        }

        @Test
        @DisplayName("Commented-out opener → skipped, the live block below still fanned out")
        void commentedOutOpener() {
            SourceBuffer buffer = buffer(
                    "// type Config struct {",
                    "type Config struct {",
                    "\tScope2Calculator *Scope2Calculator",
                    "}");

            EditReport report = apply(configFields(), buffer);

            assertThat(buffer.text(2)).isEqualTo("\tScope1Calculator *Scope1Calculator");
            assertThat(report.entries()).hasSize(2);
            assertThat(report.entries().get(0))
                    .isEqualTo(EditEntry.skipped("config-fields", 1, AnchoredRule.IN_COMMENT));
            assertThat(report.entries().get(1).outcome()).isEqualTo(EditEntry.Outcome.APPLIED);
        }

        @Test
        @DisplayName("Opener inside a block comment spanning lines → skipped, no abort")
        void openerInBlockComment() {
            SourceBuffer buffer = buffer("/*", "type Config struct {", "*/");

            EditReport report = apply(configFields(), buffer);

            assertThat(buffer.isModified()).isFalse();
            assertThat(report.entries())
                    .containsExactly(EditEntry.skipped("config-fields", 2, AnchoredRule.IN_COMMENT));
        }

        @Test
        @DisplayName("Anchor text inside a string literal → statement shape mismatch, no abort")
        void openerInString() {
            SourceBuffer buffer = buffer("\tname := \"Config struct {\"", "\treturn name");

            EditReport report = apply(configFields(), buffer);

            assertThat(buffer.isModified()).isFalse();
            assertThat(report.entries())
                    .containsExactly(EditEntry.skipped("config-fields", 1, AnchoredRule.SHAPE_MISMATCH));
        }

        @Test
        @DisplayName("Block never closes → UnbalancedRegionException")
        void unbalanced() {
            SourceBuffer buffer = buffer("type Handler struct {", "\tcalculator    *Scope2Calculator");

            assertThatThrownBy(() -> apply(handlerFields(), buffer)).isInstanceOf(UnbalancedRegionException.class);
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Keys default to the declaration's first token and are introduced")
        void keys() {
            FieldFanOutRule rule = handlerFields();

            assertThat(rule.keys()).containsExactly("scope1Calculator", "scope2Calculator", "scope3Calculator");
            assertThat(rule.introducedNames())
                    .containsExactlyInAnyOrder("scope1Calculator", "scope2Calculator", "scope3Calculator");
            assertThat(rule.type()).isEqualTo("field-fan-out");
        }

        @Test
        @DisplayName("Declaration spanning lines → TemplateSyntaxException")
        void multiLineDeclaration() {
            assertThatThrownBy(() -> new FieldFanOutRule(
                            "bad", Anchor.contains("x"), null, Template.parse("a${variant}\nb"), null, scope()))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("exactly one non-blank line");
        }

        @Test
        @DisplayName("Key not varying with the variant → TemplateSyntaxException")
        void constantKey() {
            assertThatThrownBy(() -> new FieldFanOutRule(
                            "bad",
                            Anchor.contains("x"),
                            null,
                            Template.parse("field int // ${variant}"),
                            null,
                            scope()))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("not distinct");
        }
    }
}
