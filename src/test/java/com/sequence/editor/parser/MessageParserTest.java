package com.sequence.editor.parser;

import com.sequence.editor.model.ArrowType;
import com.sequence.editor.model.DiagramDocument;
import com.sequence.editor.model.MessageNode;
import com.sequence.editor.serializer.DiagramSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MessageParser.
 */
class MessageParserTest {

    private final MessageParser parser = new MessageParser(new NodeIdGenerator());

    private MessageNode parse(String text) {
        Optional<MessageNode> message = parser.parse(SourceLine.of(1, text));
        assertThat(message).as("parse of %s", text).isPresent();
        return message.get();
    }

    @ParameterizedTest
    @CsvSource({
            "->, SYNC",
            "->>, ASYNC",
            "-->, DASHED",
            "-->>, DASHED_ASYNC",
            "<-, REVERSE",
            "<--, REVERSE_DASHED",
            "<->, BIDIRECTIONAL",
            "<->>, BIDIRECTIONAL_ASYNC",
            "<-->>, BIDIRECTIONAL_DASHED_ASYNC",
            "-x, LOST",
            "--x, DASHED_LOST"
    })
    void testArrowDecomposition(String arrow, ArrowType expected) {
        String text = "A" + arrow + "B:msg";

        MessageNode message = parse(text);

        assertThat(message.getFrom()).isEqualTo("A");
        assertThat(message.getTo()).isEqualTo("B");
        assertThat(message.getArrowType()).isEqualTo(expected);
        assertThat(message.getLabel()).isEqualTo("msg");

        DiagramDocument doc = new DiagramParser().parse(text);
        assertThat(new DiagramSerializer().serialize(doc)).isEqualTo(text);
    }

    @Test
    void testStyledArrow() {
        MessageNode message = parse("A-[#red;3]->B:msg");

        assertThat(message.getArrowType()).isEqualTo(ArrowType.SYNC);
        assertThat(message.getStyle().getBorder()).isEqualTo("#red");
        assertThat(message.getStyle().getBorderWidth()).isEqualTo(3);
    }

    @Test
    void testStyledReverseArrowWithNamedStyle() {
        MessageNode message = parse("A<-[##warn]--B:back");

        assertThat(message.getArrowType()).isEqualTo(ArrowType.REVERSE_DASHED);
        assertThat(message.getStyle().getStyleName()).isEqualTo("warn");
        assertThat(message.getStyle().getBorder()).isNull();
    }

    @Test
    void testStyledBidirectionalDashedAsync() {
        MessageNode message = parse("A<-[#blue]-->>B:both");

        assertThat(message.getArrowType()).isEqualTo(ArrowType.BIDIRECTIONAL_DASHED_ASYNC);
        assertThat(message.getStyle().getBorder()).isEqualTo("#blue");
    }

    @Test
    void testDelay() {
        assertThat(parse("A->(5)B:slow").getDelay()).isEqualTo(5);
        assertThat(parse("A->(0)B:instant").getDelay()).isNull();
        assertThat(parse("A->B:x").getDelay()).isNull();
    }

    @Test
    void testCreateMarkers() {
        MessageNode star = parse("A->*B:new");
        assertThat(star.isCreate()).isTrue();
        assertThat(star.getTo()).isEqualTo("B");

        assertThat(parse("A->B:<<create>> worker").isCreate()).isTrue();
        assertThat(parse("A->B:plain").isCreate()).isFalse();
    }

    @Test
    void testDelayAndCreateTogether() {
        MessageNode message = parse("A->(2)*B:spawn");

        assertThat(message.getDelay()).isEqualTo(2);
        assertThat(message.isCreate()).isTrue();
    }

    @Test
    void testLabelIsOptionalAndKeepsColons() {
        assertThat(parse("A->B").getLabel()).isEmpty();
        assertThat(parse("A->B:at 10:30").getLabel()).isEqualTo("at 10:30");
    }

    @Test
    void testWhitespaceAroundArrow() {
        MessageNode message = parse("A -> B:hi");

        assertThat(message.getFrom()).isEqualTo("A");
        assertThat(message.getTo()).isEqualTo("B");
    }

    @Test
    void testBoundaryMessages() {
        MessageNode in = parse("[->A:request");
        MessageNode out = parse("A->]:response");

        assertThat(in.getFrom()).isEqualTo(MessageNode.LEFT_BOUNDARY);
        assertThat(in.isBoundary()).isTrue();
        assertThat(out.getTo()).isEqualTo(MessageNode.RIGHT_BOUNDARY);
    }

    @Test
    void testSelfMessage() {
        assertThat(parse("A->A:think").isSelf()).isTrue();
    }

    @Test
    void testNonMessageLines() {
        assertThat(parser.parse(SourceLine.of(1, "just some words"))).isEmpty();
        assertThat(parser.parse(SourceLine.of(1, "A=>B:x"))).isEmpty();
    }
}
