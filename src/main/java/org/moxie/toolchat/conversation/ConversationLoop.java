package org.moxie.toolchat.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.moxie.toolchat.llm.AiConfig;
import org.moxie.toolchat.llm.ChatMessage;
import org.moxie.toolchat.llm.ModelEndpoint;
import org.moxie.toolchat.llm.ToolCall;
import org.moxie.toolchat.mcp.ToolSessionRegistry;
import org.moxie.toolchat.tools.ToolCallException;
import org.moxie.toolchat.tools.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives the bounded exchange between the model endpoint and the connected tools.
 *
 * Each run owns its transcript. Tool failures are written into the transcript so the
 * model can react to them; only model failures and running out of iterations end
 * the run with an exception.
 */
@ApplicationScoped
public class ConversationLoop {

  private static final Logger log = LoggerFactory.getLogger(ConversationLoop.class);

  public static final int DEFAULT_MAX_ITERATIONS = 5;

  private static final String FORMATTING_REQUEST = "%s\n\nPlease rewrite your reply above according to the following instructions: %s";

  private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

  private final ModelEndpoint       modelEndpoint;
  private final ToolSessionRegistry registry;
  private final ObjectMapper        mapper;

  @Inject
  public ConversationLoop(ModelEndpoint modelEndpoint, ToolSessionRegistry registry, ObjectMapper mapper) {
    this.modelEndpoint = modelEndpoint;
    this.registry      = registry;
    this.mapper        = mapper;
  }

  /**
   * Run the conversation until the model answers without requesting tools.
   *
   * @param aiConfig              model endpoint to use
   * @param initialTranscript     seed turns, normally a system prompt and a user message
   * @param maxIterations         generation bound; values below 1 mean {@value #DEFAULT_MAX_ITERATIONS}
   * @param formattingInstruction optional restyling instruction applied to the final answer
   * @throws GenerationException          if any generation fails
   * @throws IterationsExceededException  if the model still requests tools after the last iteration
   * @throws ConversationTimeoutException if the running thread is interrupted
   */
  public ConversationResult run(AiConfig aiConfig, List<ChatMessage> initialTranscript,
                                int maxIterations, String formattingInstruction)
      throws ConversationException
  {
    int                  bound      = maxIterations > 0 ? maxIterations : DEFAULT_MAX_ITERATIONS;
    List<ChatMessage>    transcript = new ArrayList<>(initialTranscript);
    List<ToolDefinition> tools      = registry.listTools();
    ConversationState    state      = ConversationState.GENERATING;

    for (int iteration = 1; iteration <= bound; iteration++) {
      if (Thread.currentThread().isInterrupted()) {
        throw new ConversationTimeoutException("conversation cancelled at iteration " + iteration);
      }

      log.debug("Conversation iteration {} ({})", iteration, state);

      ChatMessage reply;
      try {
        reply = modelEndpoint.generate(aiConfig, transcript, tools);
      } catch (GenerationException e) {
        throw new GenerationException("generation error at iteration " + iteration + ": " + e.getMessage(), e);
      }

      transcript.add(reply);
      state = ConversationState.DECIDING;

      if (!reply.hasToolCalls()) {
        state = ConversationState.DONE;
        log.debug("Conversation finished after {} iteration(s) ({})", iteration, state);

        String finalText = applyFormatting(aiConfig, reply.content(), formattingInstruction);
        return new ConversationResult(finalText, transcript, iteration);
      }

      state = ConversationState.INVOKING;
      invokeTools(reply.toolCalls(), transcript);
      state = ConversationState.GENERATING;
    }

    log.warn("Reached maximum tool calling iterations ({})", bound);
    throw new IterationsExceededException(bound, transcript);
  }

  private void invokeTools(List<ToolCall> toolCalls, List<ChatMessage> transcript) {
    for (ToolCall call : toolCalls) {
      transcript.add(ChatMessage.tool(call.id(), invokeTool(call)));
    }
  }

  private String invokeTool(ToolCall call) {
    Map<String, Object> arguments;

    try {
      arguments = parseArguments(call.argumentsJson());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("Invalid arguments for tool {} ({}): {}", call.toolName(), call.id(), e.getMessage());
      return "Error parsing arguments: " + e.getMessage();
    }

    log.info("Executing tool: {} (id: {})", call.toolName(), call.id());

    try {
      String result = registry.callTool(call.toolName(), arguments);
      log.debug("Tool {} returned {} characters", call.toolName(), result == null ? 0 : result.length());
      return result == null ? "" : result;
    } catch (ToolCallException e) {
      log.error("Tool execution error: {}: {}", call.toolName(), e.getMessage());
      return "Error executing tool: " + e.getMessage();
    }
  }

  private Map<String, Object> parseArguments(String argumentsJson) throws JsonProcessingException {
    if (argumentsJson == null || argumentsJson.isBlank()) {
      return Map.of();
    }

    JsonNode node = mapper.readTree(argumentsJson);

    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("arguments must be a JSON object");
    }

    return mapper.convertValue(node, ARGUMENTS_TYPE);
  }

  private String applyFormatting(AiConfig aiConfig, String answer, String formattingInstruction) {
    if (formattingInstruction == null || formattingInstruction.isBlank() || answer == null || answer.isEmpty()) {
      return answer;
    }

    List<ChatMessage> request = List.of(ChatMessage.user(String.format(FORMATTING_REQUEST, answer, formattingInstruction)));

    try {
      ChatMessage formatted = modelEndpoint.generate(aiConfig, request, List.of());

      if (formatted.content() == null || formatted.content().isBlank()) {
        log.warn("Formatting pass returned no content, using original response");
        return answer;
      }

      return formatted.content();
    } catch (GenerationException e) {
      log.warn("Failed to apply formatting instruction, using original response: {}", e.getMessage());
      return answer;
    }
  }
}
