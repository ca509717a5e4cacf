package com.sequence.editor.layout;

import com.sequence.editor.model.*;
import com.sequence.editor.parser.DiagramParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LayoutEngine.
 */
class LayoutEngineTest {

    private final DiagramParser parser = new DiagramParser();
    private final LayoutEngine engine = new LayoutEngine();

    private DiagramDocument doc;
    private LayoutResult result;

    private void layout(String text) {
        doc = parser.parse(text);
        result = engine.calculateLayout(doc);
    }

    private MessageGeometry message(int index) {
        String id = doc.nodesOfType(MessageNode.class).get(index).getId();
        return result.geometry(id, MessageGeometry.class).orElseThrow();
    }

    private FragmentGeometry fragment(int index) {
        String id = doc.nodesOfType(FragmentNode.class).get(index).getId();
        return result.geometry(id, FragmentGeometry.class).orElseThrow();
    }

    @Test
    void testParticipantRow() {
        layout("participant User\nparticipant Service\nparticipant VeryLongServiceName");

        ParticipantGeometry user = result.getParticipantLayout().get("User");
        ParticipantGeometry service = result.getParticipantLayout().get("Service");
        ParticipantGeometry longName = result.getParticipantLayout().get("VeryLongServiceName");
        assertThat(user.getX()).isEqualTo(50);
        assertThat(user.getY()).isEqualTo(50);
        assertThat(user.getWidth()).isEqualTo(80);
        assertThat(user.getHeight()).isEqualTo(60);
        assertThat(service.getX()).isEqualTo(200);
        assertThat(longName.getX()).isEqualTo(350);
        assertThat(longName.getWidth()).isEqualTo(19 * 7.5 + 20);
    }

    @Test
    void testSimpleRequestResponse() {
        layout("participant User\nparticipant Service\nUser->Service:login\nService-->User:ok");

        MessageGeometry login = message(0);
        MessageGeometry ok = message(1);
        assertThat(login.getY()).isEqualTo(150);
        assertThat(login.getFromX()).isEqualTo(90);
        assertThat(login.getToX()).isEqualTo(240);
        assertThat(login.getHeight()).isEqualTo(50);
        assertThat(ok.getY()).isEqualTo(200);
        assertThat(ok.getFromX()).isEqualTo(240);
        assertThat(result.getTotalHeight()).isEqualTo(300);
    }

    @Test
    void testDelaySlopesTheArrow() {
        layout("participant A\nparticipant B\nA->(3)B:slow\nA->B:fast");

        MessageGeometry slow = message(0);
        MessageGeometry fast = message(1);
        assertThat(slow.getEndY()).isGreaterThan(slow.getY());
        assertThat(slow.getEndY() - slow.getY()).isEqualTo(30);
        assertThat(slow.getDelay()).isEqualTo(3);
        assertThat(fast.getEndY()).isEqualTo(fast.getY());
        assertThat(fast.getY()).isEqualTo(150 + 50 + 30);
    }

    @Test
    void testTitleShiftsEverythingDown() {
        layout("title Demo\nparticipant A\nA->A:x");

        assertThat(result.getParticipantLayout().get("A").getY()).isEqualTo(80);
        assertThat(message(0).getY()).isEqualTo(180);
    }

    @Test
    void testEntrySpacingScalesMessageSpacing() {
        layout("entryspacing 2\nparticipant A\nparticipant B\nA->B:1\nA->B:2");

        assertThat(message(1).getY() - message(0).getY()).isEqualTo(100);
    }

    @Test
    void testMultilineLabelReservesSpaceAbove() {
        layout("participant A\nparticipant B\nA->B:first\\nsecond\nA->B:next");

        assertThat(message(0).getY()).isEqualTo(166);
        assertThat(message(0).getHeight()).isEqualTo(66);
        assertThat(message(1).getY()).isEqualTo(216);
    }

    @Test
    void testLinearPackingSharesLevelsForTouchingSpans() {
        layout("participant A\nparticipant B\nparticipant C\nlinear\nA->B:1\nB->C:2\nA->C:3\nlinear off\nA->B:4");

        assertThat(message(1).getY()).isEqualTo(message(0).getY());
        assertThat(message(2).getY()).isGreaterThan(message(0).getY());
        assertThat(message(2).getY()).isEqualTo(200);
        assertThat(message(3).getY()).isEqualTo(250);
    }

    @Test
    void testParallelPacksDisjointMessages() {
        layout("participant A\nparticipant B\nparticipant C\nparticipant D\nparallel\nA->B:1\nC->D:2\nparallel off\nA->D:3");

        assertThat(message(0).getY()).isEqualTo(message(1).getY());
        assertThat(message(2).getY()).isEqualTo(message(0).getY() + 50);
    }

    @Test
    void testNonMessageClosesPackedLevel() {
        layout("participant A\nparticipant B\nparticipant C\nlinear\nA->B:1\n==break==\nB->C:2\nlinear off");

        assertThat(message(1).getY()).isGreaterThan(message(0).getY());
    }

    @Test
    void testAutonumberResetsInsteadOfResuming() {
        layout("autonumber 5\nA->B:1\nA->B:2\nautonumber off\nA->B:3\nautonumber 1\nA->B:4");

        assertThat(message(0).getNumber()).isEqualTo(5);
        assertThat(message(1).getNumber()).isEqualTo(6);
        assertThat(message(2).getNumber()).isNull();
        assertThat(message(3).getNumber()).isEqualTo(1);
    }

    @Test
    void testBoundaryAndUnknownEndpoints() {
        layout("participant A\nparticipant B\n[->A:in\nB->]:out\nA->Ghost:lost");

        assertThat(message(0).getFromX()).isEqualTo(20);
        assertThat(message(0).isBoundary()).isTrue();
        assertThat(message(1).getToX()).isEqualTo(310);
        assertThat(message(2).getUnknownTo()).isEqualTo("Ghost");
        assertThat(message(2).getToX()).isEqualTo(165);
        assertThat(message(2).getUnknownFrom()).isNull();
    }

    @Test
    void testCreateMessageRecordsCreationPoint() {
        layout("participant A\nparticipant B\nA->A:warmup\nA->*B:new");

        assertThat(result.getCreationY()).containsEntry("B", 200.0);
    }

    @Test
    void testVerticalIncrementsPerKind() {
        layout("participant A\n\nA->A:after blank\nspace 2\nA->A:after space\n???\nA->A:after error");

        assertThat(message(0).getY()).isEqualTo(170);
        assertThat(message(1).getY()).isEqualTo(170 + 50 + 40);
        String errorId = doc.getErrors().get(0).getId();
        BoxGeometry error = result.geometry(errorId, BoxGeometry.class).orElseThrow();
        assertThat(error.getY()).isEqualTo(310);
        assertThat(error.getHeight()).isEqualTo(40);
        assertThat(error.getX()).isEqualTo(40);
        assertThat(error.getWidth()).isEqualTo(100);
        assertThat(message(2).getY()).isEqualTo(360);
    }

    @Test
    void testNoteAndDivider() {
        layout("participant A\nnote over A:hi\n==Phase==\nA->A:x");

        NoteGeometry note = result.geometry(doc.nodesOfType(NoteNode.class).get(0).getId(), NoteGeometry.class)
                .orElseThrow();
        assertThat(note.getX()).isEqualTo(65);
        assertThat(note.getY()).isEqualTo(150);
        assertThat(note.getWidth()).isEqualTo(50);
        assertThat(note.getHeight()).isEqualTo(28);
        assertThat(note.getConnectorX()).isNull();

        BoxGeometry divider = result.geometry(doc.nodesOfType(DividerNode.class).get(0).getId(), BoxGeometry.class)
                .orElseThrow();
        assertThat(divider.getY()).isEqualTo(213);
        assertThat(divider.getX()).isEqualTo(30);
        assertThat(divider.getWidth()).isEqualTo(120);
        assertThat(message(0).getY()).isEqualTo(213 + 24 + 35);
    }

    @Test
    void testSideNotesPointAtLifeline() {
        layout("participant A\nparticipant B\nnote right of A:r\nnote left of B:l");

        List<NoteNode> notes = doc.nodesOfType(NoteNode.class);
        NoteGeometry right = result.geometry(notes.get(0).getId(), NoteGeometry.class).orElseThrow();
        NoteGeometry left = result.geometry(notes.get(1).getId(), NoteGeometry.class).orElseThrow();
        assertThat(right.getConnectorX()).isEqualTo(90);
        assertThat(right.getX()).isEqualTo(98);
        assertThat(left.getConnectorX()).isEqualTo(240);
        assertThat(left.getX()).isEqualTo(240 - 50 - 8);
    }

    @Test
    void testFragmentBoundsAndHeight() {
        layout("participant A\nparticipant B\nparticipant C\nalt x\nA->B:1\nend\nA->B:2");

        FragmentGeometry alt = fragment(0);
        assertThat(alt.getX()).isEqualTo(30);
        assertThat(alt.getWidth()).isEqualTo(270);
        assertThat(alt.getY()).isEqualTo(150);
        assertThat(message(0).getY()).isEqualTo(195);
        assertThat(alt.getHeight()).isEqualTo(100);
        assertThat(message(1).getY()).isEqualTo(270);
    }

    @Test
    void testNestedFragmentIsInsideOuter() {
        layout("participant A\nparticipant B\nparticipant C\nalt outer\nloop inner\nB->C:1\nend\nend");

        FragmentGeometry outer = fragment(0);
        FragmentGeometry inner = fragment(1);
        assertThat(inner.getX()).isEqualTo(180);
        assertThat(inner.getWidth()).isEqualTo(270);
        assertThat(outer.getX()).isEqualTo(160);
        assertThat(outer.getX() + outer.getWidth()).isGreaterThan(inner.getX() + inner.getWidth());
        assertThat(inner.getY()).isGreaterThan(outer.getY());
        assertThat(inner.getBottom()).isLessThan(outer.getBottom());
        assertThat(outer.getHeight()).isEqualTo(170);
    }

    @Test
    void testElseDividersAreRecorded() {
        layout("participant A\nparticipant B\nalt a\nA->B:1\nelse b\nB->A:2\nend");

        assertThat(fragment(0).getElseDividerYs()).containsExactly(245.0);
        assertThat(message(1).getY()).isEqualTo(280);
    }

    @Test
    void testFragmentWithoutParticipantsSpansAll() {
        layout("participant A\nparticipant B\nopt nothing\nend");

        FragmentGeometry opt = fragment(0);
        assertThat(opt.getX()).isEqualTo(30);
        assertThat(opt.getWidth()).isEqualTo(270);
    }

    @Test
    void testCollapsedExpandableReservesHeaderOnly() {
        layout("participant A\nparticipant B\nexpandable- details\nA->B:hidden\nend");

        FragmentGeometry expandable = fragment(0);
        assertThat(expandable.isCollapsed()).isTrue();
        assertThat(expandable.getHeight()).isEqualTo(45 + 10 + 5);
        String hiddenId = doc.nodesOfType(MessageNode.class).get(0).getId();
        assertThat(result.getLayout()).doesNotContainKey(hiddenId);
    }

    @Test
    void testManualActivationStacking() {
        layout("participant A\nparticipant B\nactivate A\nA->B:1\nactivate A\nA->B:2\ndeactivate A\nA->B:3\ndeactivate A");

        List<ActivationBar> bars = result.barsFor("A");
        assertThat(bars).hasSize(2);
        ActivationBar inner = bars.get(0);
        ActivationBar outer = bars.get(1);
        assertThat(inner.getStartY()).isEqualTo(200);
        assertThat(inner.getEndY()).isEqualTo(250);
        assertThat(inner.getDepth()).isEqualTo(1);
        assertThat(outer.getStartY()).isEqualTo(150);
        assertThat(outer.getEndY()).isEqualTo(300);
        assertThat(outer.getDepth()).isZero();
        assertThat(outer.contains(inner)).isTrue();
    }

    @Test
    void testBackToBackActivationsNest() {
        layout("activate A\nactivate A\ndeactivate A\ndeactivate A");

        List<ActivationBar> bars = result.barsFor("A");
        assertThat(bars).hasSize(2);
        assertThat(bars.get(1).contains(bars.get(0))).isTrue();
    }

    @Test
    void testOpenActivationsCloseAtEnd() {
        layout("participant A\nactivate A\nA->A:work");

        assertThat(result.barsFor("A")).singleElement()
                .satisfies(bar -> assertThat(bar.getEndY()).isEqualTo(200));
    }

    @Test
    void testDeactivateWithoutActivateIsIgnored() {
        layout("participant A\ndeactivate A");

        assertThat(result.getActivationBars()).isEmpty();
        String markerId = doc.nodesOfType(DirectiveNode.class).get(0).getId();
        assertThat(result.geometry(markerId, MarkerGeometry.class)).isPresent();
    }

    @Test
    void testActivationColorPrecedence() {
        layout("activecolor #aaa\nactivecolor B #bbb\nactivate A\nactivate B\nactivate A #ccc");

        assertThat(result.barsFor("A")).extracting(ActivationBar::getColor).containsExactly("#ccc", "#aaa");
        assertThat(result.barsFor("B")).extracting(ActivationBar::getColor).containsExactly("#bbb");
    }

    @Test
    void testAutoActivation() {
        layout("participant A\nparticipant B\nautoactivation on\nA->B:call\nB-->A:return\nautoactivation off\nA->B:again");

        assertThat(result.barsFor("B")).singleElement().satisfies(bar -> {
            assertThat(bar.isAuto()).isTrue();
            assertThat(bar.getStartY()).isEqualTo(150);
            assertThat(bar.getEndY()).isEqualTo(200);
        });
        assertThat(result.barsFor("A")).isEmpty();
    }

    @Test
    void testLifecycleMarkers() {
        layout("participant A\nparticipant B\ndestroyafter B\nA->A:x");

        DirectiveNode destroy = doc.nodesOfType(DirectiveNode.class).get(0);
        MarkerGeometry marker = result.geometry(destroy.getId(), MarkerGeometry.class).orElseThrow();
        assertThat(marker.getY()).isEqualTo(150);
        assertThat(marker.getKind()).isEqualTo(DirectiveType.DESTROY_AFTER);
        assertThat(marker.getParticipant()).isEqualTo("B");
        assertThat(message(0).getY()).isEqualTo(200);
    }

    @Test
    void testParticipantSpacingDirectives() {
        layout("participantspacing 300\nparticipant A\nparticipant B");
        assertThat(result.getParticipantLayout().get("B").getX()).isEqualTo(350);

        layout("participantspacing equal\nparticipant A\nparticipant B\nparticipant C\nA->B:" + "x".repeat(30));
        assertThat(result.getParticipantLayout().get("B").getX()).isEqualTo(280);
        assertThat(result.getParticipantLayout().get("C").getX()).isEqualTo(510);
    }

    @Test
    void testNotesAndLabelsWidenGaps() {
        layout("participant A\nparticipant B\nnote left of B:a very long note text here");
        assertThat(result.getParticipantLayout().get("B").getX()).isEqualTo(50 + 214);

        layout("participant A\nparticipant B\nA->A:" + "y".repeat(20));
        assertThat(result.getParticipantLayout().get("B").getX()).isEqualTo(50 + 195);
    }

    @Test
    void testParticipantGroupBox() {
        layout("participantgroup G\nparticipant A\nend\nparticipant B");

        String groupId = doc.nodesOfType(ParticipantGroupNode.class).get(0).getId();
        BoxGeometry box = result.geometry(groupId, BoxGeometry.class).orElseThrow();
        assertThat(box.getX()).isEqualTo(40);
        assertThat(box.getWidth()).isEqualTo(100);
        assertThat(box.getY()).isEqualTo(15);
        assertThat(box.getBottom()).isEqualTo(160);
    }

    @Test
    void testFrameAndBottomParticipants() {
        layout("frame Overview\nbottomparticipants\nparticipant A\nA->A:x");

        String frameId = doc.nodesOfType(DirectiveNode.class).get(0).getId();
        BoxGeometry frame = result.geometry(frameId, BoxGeometry.class).orElseThrow();
        assertThat(frame.getX()).isEqualTo(10);
        assertThat(frame.getY()).isEqualTo(10);
        assertThat(frame.getWidth()).isEqualTo(160);
        assertThat(frame.getHeight()).isEqualTo(240);
        assertThat(result.getTotalHeight()).isEqualTo(200 + 50 + 70);
    }

    @Test
    void testUnterminatedBlockStillLaysOut() {
        layout("alt cond\nA->B:x");

        assertThat(fragment(0).getHeight()).isPositive();
        assertThat(result.getLayout()).containsKey(doc.getErrors().get(0).getId());
    }

    @Test
    void testCustomConfig() {
        LayoutEngine tight = new LayoutEngine(LayoutConfig.defaults().toBuilder().messageSpacing(20).build());

        LayoutResult tightResult = tight.calculateLayout(parser.parse("A->B:1\nA->B:2"));

        assertThat(tightResult.getTotalHeight()).isEqualTo(150 + 40 + 50);
    }

    @Test
    void testEmptyDocument() {
        layout("");

        assertThat(result.getLayout()).isEmpty();
        assertThat(result.getParticipantLayout()).isEmpty();
        assertThat(result.getTotalHeight()).isEqualTo(200);
    }
}
