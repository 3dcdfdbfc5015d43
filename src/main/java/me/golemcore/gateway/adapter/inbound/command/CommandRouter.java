package me.golemcore.gateway.adapter.inbound.command;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AgentRequest;
import me.golemcore.gateway.domain.model.BufferStatus;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.CommandInvocation;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.service.TaskTracker;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.CommandPort;
import me.golemcore.gateway.port.inbound.InboundEventPort;
import me.golemcore.gateway.port.outbound.AgentModePort;
import me.golemcore.gateway.port.outbound.AgentPort;
import me.golemcore.gateway.port.outbound.CollectModePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Routes slash commands to appropriate handlers.
 *
 * <ul>
 * <li>/help - List available commands
 * <li>/start - Greeting
 * <li>/status - Pending buffer, collect queue, mode and background tasks
 * <li>/cancel - Drop the pending buffer and the collect queue
 * <li>/collect [stop] - Enter or leave collect mode
 * <li>/agent [on|off] - Toggle agent mode
 * <li>/mode - Show the current mode
 * <li>/claude, /meta, /dev (configurable) - Forward the message to the agent
 * with a working scope
 * </ul>
 *
 * <p>
 * Commands run on the conversation's dispatch thread, so the returned future is
 * always completed.
 *
 * @see me.golemcore.gateway.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_HELP = "help";
    private static final String CMD_START = "start";
    private static final String CMD_STATUS = "status";
    private static final String CMD_CANCEL = "cancel";
    private static final String CMD_COLLECT = "collect";
    private static final String CMD_AGENT = "agent";
    private static final String CMD_MODE = "mode";
    private static final String SUBCMD_STOP = "stop";
    private static final String ARG_ON = "on";
    private static final String ARG_OFF = "off";

    private static final List<String> BUILTIN_COMMANDS = List.of(
            CMD_HELP, CMD_START, CMD_STATUS, CMD_CANCEL, CMD_COLLECT, CMD_AGENT, CMD_MODE);

    private final InboundEventPort inboundEventPort;
    private final CollectModePort collectMode;
    private final AgentModePort agentMode;
    private final AgentPort agentPort;
    private final TaskTracker taskTracker;
    private final MessageService messageService;
    private final Set<String> agentCommands;

    @SuppressWarnings("java:S107")
    public CommandRouter(InboundEventPort inboundEventPort, CollectModePort collectMode, AgentModePort agentMode,
            AgentPort agentPort, TaskTracker taskTracker, MessageService messageService,
            GatewayProperties properties) {
        this.inboundEventPort = inboundEventPort;
        this.collectMode = collectMode;
        this.agentMode = agentMode;
        this.agentPort = agentPort;
        this.taskTracker = taskTracker;
        this.messageService = messageService;
        this.agentCommands = properties.getCommands().getAgentCommands().stream()
                .map(command -> command.toLowerCase(Locale.ROOT))
                .filter(command -> !BUILTIN_COMMANDS.contains(command))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.info("CommandRouter initialized with commands: {}, agent commands: {}", BUILTIN_COMMANDS,
                agentCommands);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        String conversationId = (String) context.get(CONTEXT_CONVERSATION_ID);
        log.debug("[Command] /{} {} in {}", command, args, conversationId);
        CommandResult result;
        try {
            result = dispatch(command, args, conversationId, context);
        } catch (RuntimeException e) {
            log.error("[Command] /{} failed in {}", command, conversationId, e);
            result = CommandResult.failure(messageService.getMessage("command.error", command));
        }
        return CompletableFuture.completedFuture(result);
    }

    private CommandResult dispatch(String command, List<String> args, String conversationId,
            Map<String, Object> context) {
        if (agentCommands.contains(command)) {
            return forwardToAgent(command, conversationId, context);
        }
        return switch (command) {
        case CMD_HELP -> CommandResult.success(handleHelp());
        case CMD_START -> CommandResult.success(messageService.getMessage("command.start"));
        case CMD_STATUS -> CommandResult.success(handleStatus(conversationId));
        case CMD_CANCEL -> CommandResult.success(handleCancel(conversationId));
        case CMD_COLLECT -> CommandResult.success(handleCollect(args, conversationId));
        case CMD_AGENT -> handleAgent(args, conversationId);
        case CMD_MODE -> CommandResult.success(modeText(conversationId));
        default -> CommandResult.failure(messageService.getMessage("command.unknown", command));
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return command != null && (BUILTIN_COMMANDS.contains(command) || agentCommands.contains(command));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        List<CommandDefinition> definitions = new ArrayList<>();
        definitions.add(new CommandDefinition(CMD_HELP, messageService.getMessage("command.help.desc"), "/help"));
        definitions.add(new CommandDefinition(CMD_START, messageService.getMessage("command.start.desc"), "/start"));
        definitions.add(
                new CommandDefinition(CMD_STATUS, messageService.getMessage("command.status.desc"), "/status"));
        definitions.add(
                new CommandDefinition(CMD_CANCEL, messageService.getMessage("command.cancel.desc"), "/cancel"));
        definitions.add(new CommandDefinition(CMD_COLLECT, messageService.getMessage("command.collect.desc"),
                "/collect [stop]"));
        definitions.add(new CommandDefinition(CMD_AGENT, messageService.getMessage("command.agent.desc"),
                "/agent [on|off]"));
        definitions.add(new CommandDefinition(CMD_MODE, messageService.getMessage("command.mode.desc"), "/mode"));
        for (String agentCommand : agentCommands) {
            definitions.add(new CommandDefinition(agentCommand,
                    messageService.getMessage("command.forward.desc", agentCommand),
                    "/" + agentCommand + " <text>"));
        }
        return definitions;
    }

    private String handleHelp() {
        StringBuilder sb = new StringBuilder(messageService.getMessage("command.help.title"));
        for (CommandDefinition definition : listCommands()) {
            sb.append('\n').append(definition.usage()).append(" - ").append(definition.description());
        }
        return sb.toString();
    }

    private String handleStatus(String conversationId) {
        StringBuilder sb = new StringBuilder(messageService.getMessage("command.status.title"));
        Optional<BufferStatus> buffer = inboundEventPort.getBufferStatus(conversationId);
        if (buffer.isPresent()) {
            BufferStatus status = buffer.get();
            String kinds = status.kinds().stream()
                    .map(kind -> kind.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            sb.append('\n').append(messageService.getMessage("command.status.buffer",
                    status.eventCount(), kinds, status.overflowCount()));
        } else {
            sb.append('\n').append(messageService.getMessage("command.status.buffer.empty"));
        }
        if (collectMode.isCollecting(conversationId)) {
            sb.append('\n').append(messageService.getMessage("command.status.collect",
                    collectMode.queuedCount(conversationId)));
        }
        sb.append('\n').append(modeText(conversationId));
        sb.append('\n').append(messageService.getMessage("command.status.tasks", taskTracker.activeCount()));
        return sb.toString();
    }

    private String handleCancel(String conversationId) {
        int dropped = inboundEventPort.cancelBuffer(conversationId);
        int discarded = collectMode.isCollecting(conversationId) ? collectMode.stop(conversationId) : 0;
        log.info("[Command] Cancel in {}: {} buffered event(s), {} collected message(s) dropped", conversationId,
                dropped, discarded);
        if (dropped == 0 && discarded == 0) {
            return messageService.getMessage("command.cancel.nothing");
        }
        return messageService.getMessage("command.cancel.done", dropped, discarded);
    }

    private String handleCollect(List<String> args, String conversationId) {
        if (!args.isEmpty() && SUBCMD_STOP.equalsIgnoreCase(args.get(0))) {
            if (!collectMode.isCollecting(conversationId)) {
                return messageService.getMessage("command.collect.not-active");
            }
            int discarded = collectMode.stop(conversationId);
            return messageService.getMessage("command.collect.stopped", discarded);
        }
        if (!collectMode.start(conversationId)) {
            return messageService.getMessage("command.collect.already",
                    collectMode.queuedCount(conversationId));
        }
        return messageService.getMessage("command.collect.started");
    }

    private CommandResult handleAgent(List<String> args, String conversationId) {
        boolean current = agentMode.isAgentMode(conversationId);
        boolean target;
        if (args.isEmpty()) {
            target = !current;
        } else if (ARG_ON.equalsIgnoreCase(args.get(0))) {
            target = true;
        } else if (ARG_OFF.equalsIgnoreCase(args.get(0))) {
            target = false;
        } else {
            return CommandResult.failure(messageService.getMessage("command.agent.usage"));
        }
        agentMode.setAgentMode(conversationId, target);
        return CommandResult.success(messageService.getMessage(target ? "command.agent.on" : "command.agent.off"));
    }

    private String modeText(String conversationId) {
        return messageService.getMessage(
                agentMode.isAgentMode(conversationId) ? "command.mode.agent" : "command.mode.chat");
    }

    private CommandResult forwardToAgent(String command, String conversationId, Map<String, Object> context) {
        Object routed = context.get(CONTEXT_MESSAGE);
        if (!(routed instanceof CombinedMessage message)) {
            return CommandResult.failure(messageService.getMessage("command.forward.empty", command));
        }
        if (hasMedia(message)) {
            CombinedMessage forwarded = withoutCommandTokens(message).withAgentScope(command);
            log.info("[Command] Forwarded /{} from {} with {} event(s) to content handlers", command,
                    conversationId, forwarded.getEvents().size());
            return new CommandResult(true, null, forwarded);
        }
        String prompt = stripCommand(message);
        if (prompt.isBlank()) {
            return CommandResult.failure(messageService.getMessage("command.forward.empty", command));
        }
        agentPort.submit(AgentRequest.builder()
                .conversationId(conversationId)
                .senderId(message.getSenderId())
                .prompt(prompt)
                .agentMode(true)
                .scope(command)
                .source(ContentKind.COMMAND)
                .build());
        log.info("[Command] Forwarded /{} from {} ({} chars)", command, conversationId, prompt.length());
        return CommandResult.success(null);
    }

    private static boolean hasMedia(CombinedMessage message) {
        return message.getEvents().stream()
                .anyMatch(event -> event.getKind() != ContentKind.TEXT && event.getKind() != ContentKind.COMMAND);
    }

    /**
     * Same events with every command turned into a text event holding only its
     * arguments. Commands without arguments are dropped.
     */
    static CombinedMessage withoutCommandTokens(CombinedMessage message) {
        List<InboundEvent> events = new ArrayList<>();
        for (InboundEvent event : message.getEvents()) {
            if (event.getKind() != ContentKind.COMMAND) {
                events.add(event);
                continue;
            }
            String arguments = CommandInvocation.parse(event.getText())
                    .map(CommandInvocation::argumentText)
                    .orElse("");
            if (!arguments.isBlank()) {
                events.add(event.toBuilder().kind(ContentKind.TEXT).text(arguments.trim()).build());
            }
        }
        return message.withEvents(events);
    }

    /**
     * Combined text of the message with the slash token of each command event
     * replaced by its arguments.
     */
    static String stripCommand(CombinedMessage message) {
        List<String> parts = new ArrayList<>();
        for (InboundEvent event : message.getEvents()) {
            String text = event.textContent();
            if (text == null || text.isBlank()) {
                continue;
            }
            if (event.getKind() == ContentKind.COMMAND) {
                text = CommandInvocation.parse(text).map(CommandInvocation::argumentText).orElse(text);
            }
            if (!text.isBlank()) {
                parts.add(text.trim());
            }
        }
        return String.join(" ", parts);
    }
}
