package com.sequence.editor.serializer;

import com.sequence.editor.model.*;
import com.sequence.editor.parser.DiagramParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DiagramSerializer.
 */
class DiagramSerializerTest {

    private final DiagramParser parser = new DiagramParser();
    private final DiagramSerializer serializer = new DiagramSerializer();

    private String canonical(String text) {
        return serializer.serialize(parser.parse(text));
    }

    @Test
    void testFragmentIndentationIsNormalized() {
        String text = """
                alt ok
                A->B:1
                      loop retry
                B->A:2
                end
                else   failed
                    A->B:3
                end""";

        assertThat(canonical(text)).isEqualTo("""
                alt ok
                  A->B:1
                  loop retry
                    B->A:2
                  end
                else failed
                  A->B:3
                end""");
    }

    @Test
    void testDirectiveShortForms() {
        String text = "space 1\nspace 3\nautonumber 5\nautonumber off\nlinear on\nparallel off\nautoactivation\nentryspacing 2.0";

        assertThat(canonical(text)).isEqualTo(
                "space\nspace 3\nautonumber 5\nautonumber off\nlinear\nparallel off\nautoactivation on\nentryspacing 2");
    }

    @Test
    void testBareArrowWhenMessageHasNoStyle() {
        assertThat(canonical("A-[]->B:x")).isEqualTo("A->B:x");
        assertThat(canonical("A-[#red;3]->B:x")).isEqualTo("A-[#red;3]->B:x");
        assertThat(canonical("A<-[##warn]-B:x")).isEqualTo("A<-[##warn]-B:x");
    }

    @Test
    void testMessageParts() {
        assertThat(canonical("A->(3)*B:spawn")).isEqualTo("A->(3)*B:spawn");
        assertThat(canonical("A -> B")).isEqualTo("A->B:");
        assertThat(canonical("A->B:<<create>>")).isEqualTo("A->*B:<<create>>");
    }

    @Test
    void testStyleComponentOrder() {
        assertThat(canonical("participant A #red;2")).isEqualTo("participant A #red;2");
        assertThat(canonical("participant A #fff #000;1;dashed")).isEqualTo("participant A #fff #000;1;dashed");
        assertThat(canonical("participant A ;3")).isEqualTo("participant A ;3");
        assertThat(canonical("participant A ##boxed #fff")).isEqualTo("participant A ##boxed #fff");
    }

    @Test
    void testParticipantDisplayNamesAreEscaped() {
        String text = "actor \"Customer\\nPortal\" as C";

        assertThat(canonical(text)).isEqualTo(text);
    }

    @Test
    void testGroupedParticipantsAreEmittedOnlyInsideTheirGroup() {
        String text = """
                participant Client
                participantgroup #lightblue Backend
                  participant API
                  participantgroup Storage
                    database DB
                  end
                end
                Client->API:call""";

        String out = canonical(text);

        assertThat(out).isEqualTo(text);
        assertThat(out.lines().filter(l -> l.trim().startsWith("participant API"))).hasSize(1);
    }

    @Test
    void testFragmentHeaderParts() {
        assertThat(canonical("opt#red #lightyellow when ready\nend")).isEqualTo("opt#red #lightyellow when ready\nend");
        assertThat(canonical("expandable- details\nend")).isEqualTo("expandable- details\nend");
        assertThat(canonical("expandable details\nend")).isEqualTo("expandable+ details\nend");
        assertThat(canonical("alt x\nelse #pink other\nend")).isEqualTo("alt x\nelse #pink other\nend");
    }

    @Test
    void testErrorsBecomeComments() {
        assertThat(canonical("A->B:x\n???")).isEqualTo("A->B:x\n// ???");
    }

    @Test
    void testUnterminatedBlockIsClosed() {
        assertThat(canonical("alt cond\nA->B:x")).isEqualTo("alt cond\n  A->B:x\nend");
    }

    @Test
    void testNotesDividersAndStyles() {
        String text = """
                note over A,B #yellow:shared
                rbox right of A:r
                ==Phase 2== #eee
                style warn #yellow #red;2,<b>
                notestyle ,#literal
                lifelinestyle DB #gray;1;dashed
                frame#blue #eef Payments
                fontfamily "Fira Code"
                participantspacing equal""";

        assertThat(canonical(text)).isEqualTo(text);
    }

    @Test
    void testToggledFragmentSerializesNewState() {
        DiagramDocument doc = parser.parse("expandable+ details\nA->B:x\nend");
        FragmentNode fragment = doc.nodesOfType(FragmentNode.class).get(0);

        DiagramDocument toggled = doc.withNode(fragment.withCollapsed(true));

        assertThat(serializer.serialize(toggled)).isEqualTo("expandable- details\n  A->B:x\nend");
        assertThat(fragment.isCollapsed()).isFalse();
    }

    @Test
    void testHandBuiltDocument() {
        ParticipantNode a = ParticipantNode.builder().id("p1").participantType(ParticipantType.PARTICIPANT).alias("A").build();
        MessageNode m = MessageNode.builder().id("m1").from("A").to("B").arrowType(ArrowType.DASHED_ASYNC).label("reply").build();
        FragmentNode loop = FragmentNode.builder().id("f1").fragmentType(FragmentType.LOOP).condition("forever")
                .entries(List.of("m1")).build();

        String out = serializer.serialize(new DiagramDocument(List.of(a, loop, m)));

        assertThat(out).isEqualTo("participant A\nloop forever\n  A-->>B:reply\nend");
    }
}
