package com.linlay.agentteam.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentteam.config.ChatProperties;
import com.linlay.agentteam.model.ModelBinding;
import com.linlay.agentteam.session.SessionTranscriptStore;
import com.linlay.agentteam.session.TranscriptMessage;
import com.linlay.agentteam.tool.BaseTool;
import com.linlay.agentteam.tool.BaseToolCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Coordinate-mode team execution on Spring AI chat models.
 * <p>
 * The delegator model picks a member by name from the roster, the member answers with its own
 * tools, and the turn is appended to the session transcript. With no members, or a routing
 * answer naming nobody, the delegator answers itself.
 */
@Component
public class SpringAiExecutionEngine implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(SpringAiExecutionEngine.class);

    private final ObjectMapper objectMapper;
    private final SessionTranscriptStore transcriptStore;
    private final ChatProperties chatProperties;
    private final Clock clock;

    @Autowired
    public SpringAiExecutionEngine(ObjectMapper objectMapper, SessionTranscriptStore transcriptStore, ChatProperties chatProperties) {
        this(objectMapper, transcriptStore, chatProperties, Clock.systemDefaultZone());
    }

    SpringAiExecutionEngine(ObjectMapper objectMapper, SessionTranscriptStore transcriptStore, ChatProperties chatProperties, Clock clock) {
        this.objectMapper = objectMapper;
        this.transcriptStore = transcriptStore;
        this.chatProperties = chatProperties == null ? new ChatProperties() : chatProperties;
        this.clock = clock;
    }

    @Override
    public AgentRuntime buildAgent(ModelBinding model, String name, String role, List<BaseTool> tools) {
        // tool names must be unique per request; the last tool of a name wins
        Map<String, BaseTool> byName = new LinkedHashMap<>();
        if (tools != null) {
            for (BaseTool tool : tools) {
                if (byName.put(tool.name(), tool) != null) {
                    log.warn("Agent '{}' has more than one tool named '{}', keeping the last", name, tool.name());
                }
            }
        }
        List<BaseTool> uniqueTools = new ArrayList<>(byName.values());
        List<ToolCallback> callbacks = new ArrayList<>(uniqueTools.size());
        for (BaseTool tool : uniqueTools) {
            callbacks.add(new BaseToolCallback(tool, objectMapper));
        }
        return new AgentRuntime(name, role, model, uniqueTools, callbacks);
    }

    @Override
    public DelegatorRuntime buildDelegator(ModelBinding model, List<AgentRuntime> members, String instructions, boolean historyEnabled) {
        return new DelegatorRuntime(model, members, instructions, historyEnabled);
    }

    @Override
    public Mono<RunResult> run(DelegatorRuntime delegator, RunContext context, String message) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        return Mono.fromCallable(() -> runBlocking(delegator, context, message, cancelled::get))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> cancelled.set(true));
    }

    RunResult runBlocking(DelegatorRuntime delegator, RunContext context, String message) {
        return runBlocking(delegator, context, message, () -> false);
    }

    /**
     * A run cancelled before its answer arrives, by timeout or by the caller, leaves the
     * transcript untouched.
     */
    RunResult runBlocking(DelegatorRuntime delegator, RunContext context, String message, BooleanSupplier cancelled) {
        Instant receivedAt = clock.instant();
        List<TranscriptMessage> history = delegator.historyEnabled()
                ? transcriptStore.loadRecentMessages(context.tenantId(), context.instanceId(), context.sessionId(), chatProperties.historyWindow())
                : List.of();

        AgentRuntime member = route(delegator, history, message);
        String answer;
        if (member == null) {
            answer = complete(delegator.model(), delegator.instructions(), history, message, List.of());
        } else {
            answer = complete(member.model(), memberSystemPrompt(member), history, message, member.toolCallbacks());
        }
        String memberName = member == null ? null : member.name();
        log.debug("session {} answered by {}", context.sessionId(), memberName == null ? "delegator" : memberName);

        if (cancelled.getAsBoolean()) {
            log.info("Run of session {} was cancelled, turn not recorded", context.sessionId());
            return new RunResult(answer, context.sessionId(), memberName);
        }
        transcriptStore.appendTurn(
                context.tenantId(),
                context.instanceId(),
                context.sessionId(),
                List.of(
                        TranscriptMessage.user(message, receivedAt),
                        TranscriptMessage.assistant(memberName, answer, clock.instant())
                )
        );
        return new RunResult(answer, context.sessionId(), memberName);
    }

    AgentRuntime route(DelegatorRuntime delegator, List<TranscriptMessage> history, String message) {
        List<AgentRuntime> members = delegator.members();
        if (members.isEmpty()) {
            return null;
        }
        if (members.size() == 1) {
            return members.get(0);
        }
        String decision = complete(delegator.model(), routingPrompt(delegator), history, message, List.of());
        AgentRuntime chosen = matchMember(members, decision);
        if (chosen == null) {
            log.warn("Routing answer '{}' names no team member, delegator answers directly", abbreviate(decision));
        }
        return chosen;
    }

    static AgentRuntime matchMember(List<AgentRuntime> members, String decision) {
        if (!StringUtils.hasText(decision)) {
            return null;
        }
        String normalized = decision.trim().toLowerCase(Locale.ROOT);
        for (AgentRuntime member : members) {
            if (member.name().trim().toLowerCase(Locale.ROOT).equals(normalized)) {
                return member;
            }
        }
        List<AgentRuntime> byLength = new ArrayList<>(members);
        byLength.sort(Comparator.comparingInt((AgentRuntime member) -> member.name().length()).reversed());
        for (AgentRuntime member : byLength) {
            if (normalized.contains(member.name().trim().toLowerCase(Locale.ROOT))) {
                return member;
            }
        }
        return null;
    }

    private String routingPrompt(DelegatorRuntime delegator) {
        StringBuilder prompt = new StringBuilder(delegator.instructions());
        prompt.append("\n\nTeam members:\n");
        for (AgentRuntime member : delegator.members()) {
            prompt.append("- ").append(member.name());
            if (StringUtils.hasText(member.role())) {
                prompt.append(": ").append(member.role().trim());
            }
            prompt.append('\n');
        }
        prompt.append("\nAnswer with exactly one member name.");
        return prompt.toString();
    }

    private String memberSystemPrompt(AgentRuntime member) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are ").append(member.name()).append('.');
        if (StringUtils.hasText(member.role())) {
            prompt.append("\n").append(member.role().trim());
        }
        prompt.append("\n\nCurrent date and time: ")
                .append(ZonedDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        prompt.append("\nFormat answers in markdown.");
        return prompt.toString();
    }

    private String complete(ModelBinding model,
                            String systemPrompt,
                            List<TranscriptMessage> history,
                            String userMessage,
                            List<ToolCallback> toolCallbacks) {
        List<Message> messages = new ArrayList<>();
        if (StringUtils.hasText(systemPrompt)) {
            messages.add(new SystemMessage(systemPrompt));
        }
        for (TranscriptMessage item : history) {
            if (TranscriptMessage.ROLE_USER.equals(item.role())) {
                messages.add(new UserMessage(item.content()));
            } else if (TranscriptMessage.ROLE_ASSISTANT.equals(item.role())) {
                messages.add(new AssistantMessage(item.content()));
            }
        }
        messages.add(new UserMessage(userMessage));

        ToolCallingChatOptions options = ToolCallingChatOptions.builder()
                .model(model.modelId())
                .toolCallbacks(toolCallbacks)
                .build();
        ChatResponse response = model.chatModel().call(new Prompt(messages, options));
        Generation result = response == null ? null : response.getResult();
        if (result == null || result.getOutput() == null) {
            return "";
        }
        String text = result.getOutput().getText();
        return text == null ? "" : text;
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 80 ? value : value.substring(0, 80) + "...";
    }
}
