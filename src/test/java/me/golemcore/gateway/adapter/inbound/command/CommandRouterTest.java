package me.golemcore.gateway.adapter.inbound.command;

import me.golemcore.gateway.domain.model.AgentRequest;
import me.golemcore.gateway.domain.model.BufferStatus;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.domain.service.TaskTracker;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.CommandPort;
import me.golemcore.gateway.port.inbound.InboundEventPort;
import me.golemcore.gateway.port.outbound.AgentModePort;
import me.golemcore.gateway.port.outbound.AgentPort;
import me.golemcore.gateway.port.outbound.CollectModePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandRouterTest {

    private static final String CHAT_ID = "100";

    private InboundEventPort inboundEventPort;
    private CollectModePort collectMode;
    private AgentModePort agentMode;
    private AgentPort agentPort;
    private TaskTracker taskTracker;
    private MessageService messageService;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        inboundEventPort = mock(InboundEventPort.class);
        collectMode = mock(CollectModePort.class);
        agentMode = mock(AgentModePort.class);
        agentPort = mock(AgentPort.class);
        taskTracker = mock(TaskTracker.class);
        messageService = new MessageService();
        GatewayProperties properties = new GatewayProperties();
        properties.getCommands().setAgentCommands(List.of("Claude", "meta", "help"));
        when(inboundEventPort.getBufferStatus(any())).thenReturn(Optional.empty());

        router = new CommandRouter(inboundEventPort, collectMode, agentMode, agentPort, taskTracker,
                messageService, properties);
    }

    @Test
    void shouldRecognizeBuiltinAndAgentCommands() {
        assertTrue(router.hasCommand("help"));
        assertTrue(router.hasCommand("claude"));
        assertTrue(router.hasCommand("meta"));
        assertFalse(router.hasCommand("dev"));
        assertFalse(router.hasCommand(null));
    }

    @Test
    void shouldListEveryCommandInHelp() {
        CommandPort.CommandResult result = execute("help", List.of(), null);

        assertTrue(result.success());
        assertTrue(result.output().startsWith(messageService.getMessage("command.help.title")));
        assertTrue(result.output().contains("/collect [stop]"));
        assertTrue(result.output().contains("/claude <text>"));
        assertEquals(9, router.listCommands().size());
    }

    @Test
    void shouldGreetOnStart() {
        assertEquals(messageService.getMessage("command.start"), execute("start", List.of(), null).output());
    }

    @Test
    void shouldReportStatus() {
        when(inboundEventPort.getBufferStatus(CHAT_ID)).thenReturn(Optional.of(new BufferStatus(CHAT_ID, 2,
                Instant.now(), List.of(ContentKind.TEXT, ContentKind.PHOTO), 1)));
        when(collectMode.isCollecting(CHAT_ID)).thenReturn(true);
        when(collectMode.queuedCount(CHAT_ID)).thenReturn(3);
        when(agentMode.isAgentMode(CHAT_ID)).thenReturn(true);
        when(taskTracker.activeCount()).thenReturn(4);

        String output = execute("status", List.of(), null).output();

        assertTrue(output.contains(messageService.getMessage("command.status.buffer", 2, "text, photo", 1)));
        assertTrue(output.contains(messageService.getMessage("command.status.collect", 3)));
        assertTrue(output.contains(messageService.getMessage("command.mode.agent")));
        assertTrue(output.contains(messageService.getMessage("command.status.tasks", 4)));
    }

    @Test
    void shouldReportEmptyBufferInStatus() {
        String output = execute("status", List.of(), null).output();

        assertTrue(output.contains(messageService.getMessage("command.status.buffer.empty")));
        assertTrue(output.contains(messageService.getMessage("command.mode.chat")));
    }

    @Test
    void shouldCancelBufferAndCollectQueue() {
        when(inboundEventPort.cancelBuffer(CHAT_ID)).thenReturn(2);
        when(collectMode.isCollecting(CHAT_ID)).thenReturn(true);
        when(collectMode.stop(CHAT_ID)).thenReturn(5);

        CommandPort.CommandResult result = execute("cancel", List.of(), null);

        assertEquals(messageService.getMessage("command.cancel.done", 2, 5), result.output());
    }

    @Test
    void shouldSayNothingToCancel() {
        assertEquals(messageService.getMessage("command.cancel.nothing"), execute("cancel", List.of(), null).output());
        verify(collectMode, never()).stop(CHAT_ID);
    }

    @Test
    void shouldStartCollectMode() {
        when(collectMode.start(CHAT_ID)).thenReturn(true);

        assertEquals(messageService.getMessage("command.collect.started"),
                execute("collect", List.of(), null).output());
    }

    @Test
    void shouldReportCollectModeAlreadyActive() {
        when(collectMode.start(CHAT_ID)).thenReturn(false);
        when(collectMode.queuedCount(CHAT_ID)).thenReturn(2);

        assertEquals(messageService.getMessage("command.collect.already", 2),
                execute("collect", List.of(), null).output());
    }

    @Test
    void shouldStopCollectMode() {
        when(collectMode.isCollecting(CHAT_ID)).thenReturn(true);
        when(collectMode.stop(CHAT_ID)).thenReturn(3);

        assertEquals(messageService.getMessage("command.collect.stopped", 3),
                execute("collect", List.of("STOP"), null).output());
    }

    @Test
    void shouldReportCollectStopWhenInactive() {
        assertEquals(messageService.getMessage("command.collect.not-active"),
                execute("collect", List.of("stop"), null).output());
    }

    @Test
    void shouldSwitchAgentMode() {
        when(agentMode.isAgentMode(CHAT_ID)).thenReturn(false);

        assertEquals(messageService.getMessage("command.agent.on"), execute("agent", List.of("on"), null).output());
        verify(agentMode).setAgentMode(CHAT_ID, true);

        assertEquals(messageService.getMessage("command.agent.off"), execute("agent", List.of("off"), null).output());
        verify(agentMode).setAgentMode(CHAT_ID, false);
    }

    @Test
    void shouldToggleAgentModeWithoutArgs() {
        when(agentMode.isAgentMode(CHAT_ID)).thenReturn(true);

        execute("agent", List.of(), null);

        verify(agentMode).setAgentMode(CHAT_ID, false);
    }

    @Test
    void shouldRejectInvalidAgentArgument() {
        CommandPort.CommandResult result = execute("agent", List.of("maybe"), null);

        assertFalse(result.success());
        assertEquals(messageService.getMessage("command.agent.usage"), result.output());
    }

    @Test
    void shouldForwardAgentCommandWithScope() {
        CombinedMessage message = new CombinedMessage(CHAT_ID, "u1", List.of(
                event(1, ContentKind.COMMAND, "/claude refactor the parser"),
                event(2, ContentKind.TEXT, "and add tests")), 0, null);

        CommandPort.CommandResult result = execute("claude", List.of("refactor", "the", "parser"), message);

        assertTrue(result.success());
        assertNull(result.output());
        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(agentPort).submit(captor.capture());
        assertEquals("refactor the parser and add tests", captor.getValue().getPrompt());
        assertEquals("claude", captor.getValue().getScope());
        assertTrue(captor.getValue().isAgentMode());
        assertEquals(ContentKind.COMMAND, captor.getValue().getSource());
    }

    @Test
    void shouldHandBurstWithMediaBackForContentDispatch() {
        InboundEvent photo = InboundEvent.builder().conversationId(CHAT_ID).senderId("u1").eventId(2)
                .kind(ContentKind.PHOTO).media(new MediaRef("p2", "photo.jpg", "image/jpeg", 100)).build();
        InboundEvent voice = InboundEvent.builder().conversationId(CHAT_ID).senderId("u1").eventId(3)
                .kind(ContentKind.VOICE).media(new MediaRef("v3", "voice.ogg", "audio/ogg", 100)).build();
        CombinedMessage message = new CombinedMessage(CHAT_ID, "u1", List.of(
                event(1, ContentKind.COMMAND, "/claude what is on this picture"), photo, voice), 0, null);

        CommandPort.CommandResult result = execute("claude", List.of("what", "is", "on", "this", "picture"),
                message);

        assertTrue(result.success());
        assertNull(result.output());
        verify(agentPort, never()).submit(any());
        CombinedMessage forwarded = assertInstanceOf(CombinedMessage.class, result.data());
        assertEquals("claude", forwarded.getAgentScope());
        assertEquals("what is on this picture", forwarded.combinedText());
        assertEquals(List.of(ContentKind.TEXT, ContentKind.PHOTO, ContentKind.VOICE),
                forwarded.getEvents().stream().map(InboundEvent::getKind).toList());
        assertTrue(forwarded.commands().isEmpty());
    }

    @Test
    void shouldDropBareCommandWhenForwardingMedia() {
        InboundEvent document = InboundEvent.builder().conversationId(CHAT_ID).senderId("u1").eventId(2)
                .kind(ContentKind.DOCUMENT).media(new MediaRef("d2", "report.pdf", "application/pdf", 100))
                .build();
        CombinedMessage message = new CombinedMessage(CHAT_ID, "u1", List.of(
                event(1, ContentKind.COMMAND, "/meta"), document), 0, null);

        CommandPort.CommandResult result = execute("meta", List.of(), message);

        assertTrue(result.success());
        CombinedMessage forwarded = assertInstanceOf(CombinedMessage.class, result.data());
        assertEquals(List.of(document), forwarded.getEvents());
        assertEquals("meta", forwarded.getAgentScope());
    }

    @Test
    void shouldRefuseEmptyForward() {
        CombinedMessage message = CombinedMessage.single(event(1, ContentKind.COMMAND, "/meta"), null);

        CommandPort.CommandResult result = execute("meta", List.of(), message);

        assertFalse(result.success());
        assertEquals(messageService.getMessage("command.forward.empty", "meta"), result.output());
        verify(agentPort, never()).submit(any());
    }

    @Test
    void shouldReportUnknownCommand() {
        CommandPort.CommandResult result = execute("dev", List.of(), null);

        assertFalse(result.success());
        assertEquals(messageService.getMessage("command.unknown", "dev"), result.output());
    }

    @Test
    void shouldTurnUnexpectedFailureIntoErrorResult() {
        when(inboundEventPort.cancelBuffer(CHAT_ID)).thenThrow(new IllegalStateException("boom"));

        CommandPort.CommandResult result = execute("cancel", List.of(), null);

        assertFalse(result.success());
        assertEquals(messageService.getMessage("command.error", "cancel"), result.output());
    }

    private CommandPort.CommandResult execute(String command, List<String> args, CombinedMessage message) {
        Map<String, Object> context = message != null
                ? Map.of(CommandPort.CONTEXT_CONVERSATION_ID, CHAT_ID, CommandPort.CONTEXT_MESSAGE, message)
                : Map.of(CommandPort.CONTEXT_CONVERSATION_ID, CHAT_ID);
        return router.execute(command, args, context).join();
    }

    private static InboundEvent event(long id, ContentKind kind, String text) {
        return InboundEvent.builder().conversationId(CHAT_ID).senderId("u1").eventId(id).kind(kind).text(text)
                .build();
    }
}
