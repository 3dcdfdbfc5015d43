package me.golemcore.gateway.domain.handler;

import me.golemcore.gateway.domain.model.AgentRequest;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContactCard;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.outbound.AgentPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ContactContentHandlerTest {

    private AgentPort agentPort;
    private ContactContentHandler handler;

    @BeforeEach
    void setUp() {
        agentPort = mock(AgentPort.class);
        handler = new ContactContentHandler(new HandlerSupport(agentPort, new MessageService()));
    }

    @Test
    void shouldDescribeContact() {
        ContactCard card = new ContactCard("+15550100", "Ann", "Lee", "42");

        assertEquals("👤 Contact: Ann Lee\nPhone: +15550100\nUser ID: 42", ContactContentHandler.describe(card));
    }

    @Test
    void shouldOmitMissingFields() {
        assertEquals("👤 Contact: Ann", ContactContentHandler.describe(new ContactCard(null, "Ann", null, null)));
    }

    @Test
    void shouldSubmitEveryContact() {
        CombinedMessage message = new CombinedMessage("100", "u1", List.of(
                contact(1, new ContactCard("+1", "Ann", null, null)),
                contact(2, new ContactCard("+2", "Bob", null, null))), 0, null);

        HandlerResult result = handler.handle(message, true);

        assertEquals(HandlerResult.Status.HANDLED, result.status());
        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(agentPort).submit(captor.capture());
        assertEquals("👤 Contact: Ann\nPhone: +1\n\n👤 Contact: Bob\nPhone: +2", captor.getValue().getPrompt());
    }

    @Test
    void shouldSkipWithoutContacts() {
        CombinedMessage message = CombinedMessage.single(InboundEvent.builder().conversationId("100").eventId(1)
                .kind(ContentKind.TEXT).text("hi").build(), null);

        assertEquals(HandlerResult.Status.SKIPPED, handler.handle(message, false).status());
        verify(agentPort, never()).submit(any());
    }

    private static InboundEvent contact(long id, ContactCard card) {
        return InboundEvent.builder().conversationId("100").eventId(id).kind(ContentKind.CONTACT).contact(card)
                .build();
    }
}
