package org.moxie.toolchat.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.core.JsonValue;
import com.openai.models.FunctionDefinition;
import com.openai.models.FunctionParameters;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionAssistantMessageParam;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionFunctionTool;
import com.openai.models.chat.completions.ChatCompletionMessage;
import com.openai.models.chat.completions.ChatCompletionMessageFunctionToolCall;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionMessageToolCall;
import com.openai.models.chat.completions.ChatCompletionToolMessageParam;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.moxie.toolchat.conversation.GenerationException;
import org.moxie.toolchat.producers.OpenAIClientFactory;
import org.moxie.toolchat.tools.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model endpoint backed by any OpenAI-compatible chat completions API.
 */
@ApplicationScoped
public class OpenAIModelEndpoint implements ModelEndpoint {

  private static final Logger log = LoggerFactory.getLogger(OpenAIModelEndpoint.class);

  private final OpenAIClientFactory clientFactory;
  private final ObjectMapper        mapper;

  @Inject
  public OpenAIModelEndpoint(OpenAIClientFactory clientFactory, ObjectMapper mapper) {
    this.clientFactory = clientFactory;
    this.mapper        = mapper;
  }

  @Override
  public ChatMessage generate(AiConfig aiConfig, List<ChatMessage> transcript, List<ToolDefinition> tools) throws GenerationException {
    ChatCompletionCreateParams params = buildCompletionParams(aiConfig, transcript, tools);
    ChatCompletion             completion;

    try {
      completion = clientFactory.clientFor(aiConfig).chat().completions().create(params);
    } catch (RuntimeException e) {
      log.warn("Model endpoint request failed ({}): {}", aiConfig, e.getMessage());
      throw new GenerationException("model endpoint request failed: " + e.getMessage(), e);
    }

    try {
      if (completion.choices().isEmpty()) {
        throw new GenerationException("no response from model");
      }

      return toChatMessage(completion.choices().get(0).message());
    } catch (RuntimeException e) {
      log.warn("Malformed model response ({}): {}", aiConfig, e.getMessage());
      throw new GenerationException("malformed model response: " + e.getMessage(), e);
    }
  }

  ChatCompletionCreateParams buildCompletionParams(AiConfig aiConfig, List<ChatMessage> transcript, List<ToolDefinition> tools) {
    ChatCompletionCreateParams.Builder builder = ChatCompletionCreateParams.builder()
                                                                           .model(aiConfig.model());

    for (ChatMessage message : transcript) {
      String content = message.content() == null ? "" : message.content();

      switch (message.role()) {
        case system    -> builder.addSystemMessage(content);
        case user      -> builder.addUserMessage(content);
        case assistant -> builder.addMessage(buildAssistantMessage(message));
        case tool      -> builder.addMessage(ChatCompletionMessageParam.ofTool(ChatCompletionToolMessageParam.builder()
                                                                                                            .toolCallId(message.toolCallId())
                                                                                                            .content(content)
                                                                                                            .build()));
      }
    }

    if (tools != null) {
      for (ToolDefinition tool : tools) {
        builder.addTool(ChatCompletionFunctionTool.builder()
                                                  .function(toFunctionDefinition(tool))
                                                  .build());
      }
    }

    return builder.build();
  }

  private ChatCompletionMessageParam buildAssistantMessage(ChatMessage message) {
    ChatCompletionAssistantMessageParam.Builder assistant = ChatCompletionAssistantMessageParam.builder();

    if (message.content() != null) {
      assistant.content(message.content());
    }

    if (message.hasToolCalls()) {
      List<ChatCompletionMessageToolCall> toolCalls = new ArrayList<>();

      for (ToolCall call : message.toolCalls()) {
        ChatCompletionMessageFunctionToolCall functionToolCall = ChatCompletionMessageFunctionToolCall.builder()
            .id(call.id())
            .function(ChatCompletionMessageFunctionToolCall.Function.builder()
                .name(call.toolName())
                .arguments(call.argumentsJson() == null ? "" : call.argumentsJson())
                .build())
            .build();
        toolCalls.add(ChatCompletionMessageToolCall.ofFunction(functionToolCall));
      }

      assistant.toolCalls(toolCalls);
    }

    return ChatCompletionMessageParam.ofAssistant(assistant.build());
  }

  private FunctionDefinition toFunctionDefinition(ToolDefinition tool) {
    return FunctionDefinition.builder()
                             .name(tool.name())
                             .description(tool.description())
                             .parameters(FunctionParameters.builder()
                                                           .putAllAdditionalProperties(convertSchema(tool.parameterSchema()))
                                                           .build())
                             .build();
  }

  private Map<String, JsonValue> convertSchema(JsonNode schema) {
    Map<String, JsonValue> properties = new LinkedHashMap<>();

    if (schema == null || !schema.isObject()) {
      properties.put("type", JsonValue.from("object"));
      properties.put("properties", JsonValue.from(Map.of()));
      return properties;
    }

    Iterator<Map.Entry<String, JsonNode>> fields = schema.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      properties.put(field.getKey(), JsonValue.from(mapper.convertValue(field.getValue(), Object.class)));
    }

    return properties;
  }

  ChatMessage toChatMessage(ChatCompletionMessage message) {
    List<ToolCall> toolCalls = new ArrayList<>();

    for (ChatCompletionMessageToolCall toolCall : message.toolCalls().orElse(List.of())) {
      if (!toolCall.isFunction()) {
        log.warn("Ignoring non-function tool call from model");
        continue;
      }

      ChatCompletionMessageFunctionToolCall functionToolCall = toolCall.asFunction();
      toolCalls.add(new ToolCall(functionToolCall.id(),
                                 functionToolCall.function().name(),
                                 functionToolCall.function().arguments()));
    }

    return ChatMessage.assistant(message.content().orElse(null), toolCalls);
  }
}
