package com.williamcallahan.agentbridge.service.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class PromptComposerTest {

    @Test
    void newConversationRendersTheWholeTranscript() {
        List<ConversationTurn> turns = List.of(
                new ConversationTurn("system", "Be brief."),
                new ConversationTurn("user", "Hi"),
                new ConversationTurn("assistant", "  "),
                new ConversationTurn(null, "orphan"));

        assertEquals("system:\nBe brief.\n\nuser:\nHi\n\nunknown:\norphan\n", PromptComposer.compose(turns, false));
    }

    @Test
    void continuedConversationSendsOnlyTheLastUserMessage() {
        List<ConversationTurn> turns = List.of(
                new ConversationTurn("user", "First"),
                new ConversationTurn("assistant", "Reply"),
                new ConversationTurn("user", "Second"));

        assertEquals("Second", PromptComposer.compose(turns, true));
    }

    @Test
    void blankPromptsAreRejected() {
        assertThrows(EmptyPromptException.class,
                () -> PromptComposer.compose(List.of(new ConversationTurn("user", " ")), false));
        assertThrows(EmptyPromptException.class,
                () -> PromptComposer.compose(List.of(new ConversationTurn("assistant", "x")), true));
        assertThrows(EmptyPromptException.class,
                () -> PromptComposer.compose(List.of(new ConversationTurn("user", "")), true));
    }
}
