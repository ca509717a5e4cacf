package com.sequence.editor.style;

import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.model.ParticipantNode;
import com.sequence.editor.model.Style;
import com.sequence.editor.model.StyleTarget;
import com.sequence.editor.parser.DiagramParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StyleResolver.
 */
class StyleResolverTest {

    private static final String DIAGRAM = String.join("\n",
            "style warn #yellow #red;2;dashed,<b>",
            "participantstyle #eeeeee ;1",
            "participant A ##warn #blue",
            "participant B",
            "participant C ##missing",
            "A-[##warn]->B:call");

    private final DiagramDocument doc = new DiagramParser().parse(DIAGRAM);
    private final StyleResolver resolver = StyleResolver.of(doc);

    private Style participantStyle(String alias) {
        ParticipantNode participant = doc.participantsByAlias().get(alias);
        return resolver.resolve(StyleTarget.PARTICIPANT, participant.getStyle());
    }

    @Test
    void testCollectsDefinitions() {
        assertThat(resolver.namedStyle("warn")).hasValueSatisfying(style -> {
            assertThat(style.getFill()).isEqualTo("#yellow");
            assertThat(style.getBorder()).isEqualTo("#red");
            assertThat(style.getTextMarkup()).isEqualTo("<b>");
        });
        assertThat(resolver.typeStyle(StyleTarget.PARTICIPANT)).isPresent();
        assertThat(resolver.typeStyle(StyleTarget.NOTE)).isEmpty();
        assertThat(resolver.namedStyle("missing")).isEmpty();
    }

    @Test
    void testInlineBeatsNamedBeatsType() {
        Style a = participantStyle("A");

        assertThat(a.getFill()).isEqualTo("#blue");
        assertThat(a.getBorder()).isEqualTo("#red");
        assertThat(a.getBorderWidth()).isEqualTo(2);
        assertThat(a.getBorderStyle()).isEqualTo("dashed");
        assertThat(a.getTextMarkup()).isEqualTo("<b>");
        assertThat(a.getStyleName()).isNull();
    }

    @Test
    void testTypeStyleFillsUnsetKeys() {
        Style b = participantStyle("B");

        assertThat(b.getFill()).isEqualTo("#eeeeee");
        assertThat(b.getBorderWidth()).isEqualTo(1);
        assertThat(b.getBorder()).isNull();
    }

    @Test
    void testUndefinedNameFallsBackSilently() {
        assertThat(participantStyle("C")).isEqualTo(participantStyle("B"));
    }

    @Test
    void testMessageUsesNamedStyle() {
        MessageNode call = doc.nodesOfType(MessageNode.class).get(0);

        Style resolved = resolver.resolve(StyleTarget.MESSAGE, call.getStyle());

        assertThat(resolved.getBorderStyle()).isEqualTo("dashed");
        assertThat(resolved.getBorderWidth()).isEqualTo(2);
    }

    @Test
    void testLaterDefinitionWins() {
        DiagramDocument redefined = new DiagramParser().parse("style s #aaa\nstyle s #bbb");

        assertThat(StyleResolver.of(redefined).namedStyle("s"))
                .map(Style::getFill)
                .hasValue("#bbb");
    }

    @Test
    void testNullInlineAndTarget() {
        StyleResolver direct = new StyleResolver(Map.of(), Map.of(StyleTarget.NOTE,
                Style.builder().fill("#fff").build()));

        assertThat(direct.resolve(null, null)).isEqualTo(Style.EMPTY);
        assertThat(direct.resolve(StyleTarget.NOTE, null).getFill()).isEqualTo("#fff");
    }
}
