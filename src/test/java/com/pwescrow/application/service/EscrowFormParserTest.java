package com.pwescrow.application.service;

import com.pwescrow.application.port.in.EscrowFormUseCase.EscrowFormCommand;
import com.pwescrow.domain.model.ChatUser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EscrowFormParserTest {

    private final EscrowFormParser parser = new EscrowFormParser();
    private final ChatUser creator = ChatUser.builder().id("1001").build();

    @Test
    void parse_mapsEightLinesToFieldsIgnoringBlankLines() {
        String text = "@buyer\n@seller\n\nInstagram Account Sale\nFull access + original email\r\n"
                + "10000\n24h\n   No refunds after release  \nYes\n";

        EscrowFormCommand command = parser.parse("-100", creator, text);

        assertEquals("-100", command.chatId());
        assertSame(creator, command.creator());
        assertEquals("@buyer", command.buyer());
        assertEquals("@seller", command.seller());
        assertEquals("Instagram Account Sale", command.dealTitle());
        assertEquals("Full access + original email", command.description());
        assertEquals("10000", command.amount());
        assertEquals("24h", command.delivery());
        assertEquals("No refunds after release", command.refundConditions());
        assertEquals("Yes", command.disputeAgreement());
    }

    @Test
    void parse_rejectsShortForms() {
        FormValidationException error = assertThrows(FormValidationException.class,
                () -> parser.parse("-100", creator, "@buyer\n@seller\nTitle"));

        assertEquals(1, error.getErrors().size());
        assertTrue(error.getErrors().get(0).contains("expected 8 non-empty lines"));
        assertThrows(FormValidationException.class, () -> parser.parse("-100", creator, null));
    }

    @Test
    void template_hasOneLinePerField() {
        assertEquals(EscrowFormParser.FIELD_COUNT, EscrowFormParser.TEMPLATE.split("\n").length);
    }
}
