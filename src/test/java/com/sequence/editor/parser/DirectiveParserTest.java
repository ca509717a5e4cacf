package com.sequence.editor.parser;

import com.sequence.editor.model.DirectiveNode;
import com.sequence.editor.model.DirectiveType;
import com.sequence.editor.model.StyleTarget;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DirectiveParser.
 */
class DirectiveParserTest {

    private final DirectiveParser parser = new DirectiveParser(new NodeIdGenerator());

    private DirectiveNode parse(String text) {
        return parser.parse(SourceLine.of(1, text)).orElseThrow();
    }

    @ParameterizedTest
    @CsvSource({
            "title Login flow, TITLE",
            "entryspacing 1.5, ENTRY_SPACING",
            "autonumber 10, AUTONUMBER",
            "autonumber off, AUTONUMBER",
            "space, SPACE",
            "participantspacing equal, PARTICIPANT_SPACING",
            "lifelinestyle #gray;2, LIFELINE_STYLE",
            "linear, LINEAR",
            "parallel off, PARALLEL",
            "bottomparticipants, BOTTOM_PARTICIPANTS",
            "fontfamily mono, FONT_FAMILY",
            "frame Overview, FRAME",
            "destroy B, DESTROY",
            "destroyafter B, DESTROY_AFTER",
            "destroysilent B, DESTROY_SILENT",
            "activate A, ACTIVATE",
            "deactivate A, DEACTIVATE",
            "deactivateafter A, DEACTIVATE_AFTER",
            "autoactivation on, AUTO_ACTIVATION",
            "activecolor #orange, ACTIVE_COLOR",
            "style warn #red, NAMED_STYLE",
            "notestyle #ffffcc, TYPE_STYLE"
    })
    void testDirectiveKinds(String text, DirectiveType expected) {
        assertThat(parse(text).getDirectiveType()).isEqualTo(expected);
    }

    @Test
    void testNumbers() {
        assertThat(parse("entryspacing 1.5").getNumber()).isEqualTo(1.5);
        assertThat(parse("autonumber 10").getNumber()).isEqualTo(10.0);
        assertThat(parse("autonumber off").getNumber()).isNull();
        assertThat(parse("space").getNumber()).isEqualTo(1.0);
        assertThat(parse("space 3").getNumber()).isEqualTo(3.0);
        assertThat(parse("participantspacing 200").getNumber()).isEqualTo(200.0);
        assertThat(parse("participantspacing equal").getText()).isEqualTo(DirectiveNode.EQUAL_SPACING);
    }

    @Test
    void testToggles() {
        assertThat(parse("linear").isEnabled()).isTrue();
        assertThat(parse("linear off").isEnabled()).isFalse();
        assertThat(parse("autoactivation off").isEnabled()).isFalse();
    }

    @Test
    void testActivateWithColor() {
        DirectiveNode directive = parse("activate Server #lightgreen");

        assertThat(directive.getParticipant()).isEqualTo("Server");
        assertThat(directive.getColor()).isEqualTo("#lightgreen");
    }

    @Test
    void testActiveColorScopes() {
        DirectiveNode global = parse("activecolor #orange");
        DirectiveNode scoped = parse("activecolor DB #blue");

        assertThat(global.getParticipant()).isNull();
        assertThat(global.getColor()).isEqualTo("#orange");
        assertThat(scoped.getParticipant()).isEqualTo("DB");
        assertThat(scoped.getColor()).isEqualTo("#blue");
    }

    @Test
    void testLifelineStyleForParticipant() {
        DirectiveNode directive = parse("lifelinestyle DB #gray;1;dashed");

        assertThat(directive.getParticipant()).isEqualTo("DB");
        assertThat(directive.getLifelineStyle().getColor()).isEqualTo("#gray");
        assertThat(directive.getLifelineStyle().getLineStyle()).isEqualTo("dashed");
    }

    @Test
    void testFrameWithOperatorColor() {
        DirectiveNode frame = parse("frame#blue #eeeeff Payment system");

        assertThat(frame.getDirectiveType()).isEqualTo(DirectiveType.FRAME);
        assertThat(frame.getStyle().getOperatorColor()).isEqualTo("#blue");
        assertThat(frame.getStyle().getFill()).isEqualTo("#eeeeff");
        assertThat(frame.getText()).isEqualTo("Payment system");
    }

    @Test
    void testStyleDefinitions() {
        DirectiveNode named = parse("style warn #yellow #red;2,<b>");
        DirectiveNode typed = parse("aboxleftstyle ;3");

        assertThat(named.getStyleName()).isEqualTo("warn");
        assertThat(named.getStyle().getFill()).isEqualTo("#yellow");
        assertThat(named.getStyle().getTextMarkup()).isEqualTo("<b>");
        assertThat(typed.getStyleTarget()).isEqualTo(StyleTarget.ABOX_LEFT);
        assertThat(typed.getStyle().getBorderWidth()).isEqualTo(3);
        assertThat(typed.keyword()).isEqualTo("aboxleftstyle");
    }

    @Test
    void testFontFamilyUnquoted() {
        assertThat(parse("fontfamily \"Fira Code\"").getText()).isEqualTo("Fira Code");
    }

    @Test
    void testUnknownKeywordIsNotADirective() {
        assertThat(parser.parse(SourceLine.of(1, "participant A"))).isEmpty();
        assertThat(parser.parse(SourceLine.of(1, "titled->B:x"))).isEmpty();
    }

    @Test
    void testMalformedPayloadsThrow() {
        assertThatThrownBy(() -> parse("autonumber many")).isInstanceOf(DiagramSyntaxException.class);
        assertThatThrownBy(() -> parse("linear maybe")).isInstanceOf(DiagramSyntaxException.class);
        assertThatThrownBy(() -> parse("activate")).isInstanceOf(DiagramSyntaxException.class);
        assertThatThrownBy(() -> parse("activate A red")).isInstanceOf(DiagramSyntaxException.class);
        assertThatThrownBy(() -> parse("destroy A B")).isInstanceOf(DiagramSyntaxException.class);
    }
}
